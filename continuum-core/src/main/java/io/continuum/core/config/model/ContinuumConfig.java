package io.continuum.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ContinuumConfig(
    StorageConfig storage,
    MemoryConfig memory,
    ModelConfig model,
    RunnerConfig runner
) {

    public static ContinuumConfig defaults() {
        return new ContinuumConfig(
            StorageConfig.defaults(),
            MemoryConfig.defaults(),
            ModelConfig.defaults(),
            RunnerConfig.defaults()
        );
    }
}
