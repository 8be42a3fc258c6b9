package io.continuum.core.runner;

import io.continuum.core.config.model.ContinuumConfig;
import java.time.Duration;

public record RunnerSettings(
    String agentName,
    Duration invokeTimeout,
    double interactionTtlHours
) {
    public RunnerSettings {
        agentName = agentName == null || agentName.isBlank() ? "assistant" : agentName.trim();
        invokeTimeout = invokeTimeout == null || invokeTimeout.isNegative() || invokeTimeout.isZero()
            ? Duration.ofSeconds(120)
            : invokeTimeout;
        interactionTtlHours = interactionTtlHours > 0 ? interactionTtlHours : 24.0;
    }

    public static RunnerSettings defaults() {
        return new RunnerSettings("assistant", Duration.ofSeconds(120), 24.0);
    }

    public static RunnerSettings from(ContinuumConfig config) {
        return new RunnerSettings(
            config.runner().agentName(),
            Duration.ofSeconds(config.runner().invokeTimeoutSeconds()),
            config.memory().interactionTtlHours()
        );
    }
}
