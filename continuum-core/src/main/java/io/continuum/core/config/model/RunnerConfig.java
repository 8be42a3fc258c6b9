package io.continuum.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RunnerConfig(
    String agentName,
    int invokeTimeoutSeconds
) {

    public static RunnerConfig defaults() {
        return new RunnerConfig("assistant", 120);
    }
}
