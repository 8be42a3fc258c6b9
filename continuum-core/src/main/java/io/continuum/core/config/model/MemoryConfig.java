package io.continuum.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MemoryConfig(
    double interactionTtlHours,
    int purgeIntervalMinutes
) {

    public static MemoryConfig defaults() {
        return new MemoryConfig(24.0, 60);
    }
}
