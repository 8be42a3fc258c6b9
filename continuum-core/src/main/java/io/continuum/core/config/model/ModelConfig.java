package io.continuum.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * {@code provider} is {@code openai} for any OpenAI-compatible endpoint or {@code echo} for offline runs.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelConfig(
    String provider,
    String apiBase,
    String apiKey,
    String model,
    String systemPrompt,
    int timeoutSeconds,
    int maxAttempts
) {
    public static final String OPENAI = "openai";
    public static final String ECHO = "echo";

    public static ModelConfig defaults() {
        return new ModelConfig(
            OPENAI,
            "https://api.openai.com/v1",
            "",
            "gpt-4o-mini",
            "You are a helpful assistant. Use the conversation history and context you are given.",
            90,
            3
        );
    }

    @JsonIgnore
    public boolean echo() {
        return ECHO.equalsIgnoreCase(provider == null ? "" : provider.trim());
    }

    @JsonIgnore
    public boolean configured() {
        return echo() || (apiKey != null && !apiKey.isBlank() && apiBase != null && !apiBase.isBlank());
    }
}
