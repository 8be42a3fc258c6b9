package io.continuum.core.runner;

import io.continuum.core.codec.Metadata;
import io.continuum.core.error.ValidationException;
import java.util.Map;

/**
 * One request to the runner. With neither {@code sessionId} nor {@code userId} the run is stateless.
 */
public record RunRequest(
    String prompt,
    String sessionId,
    String userId,
    Map<String, Object> additionalContext
) {
    public RunRequest {
        if (prompt == null || prompt.isBlank()) {
            throw new ValidationException("prompt must not be blank");
        }
        sessionId = sessionId == null || sessionId.isBlank() ? null : sessionId.trim();
        userId = userId == null || userId.isBlank() ? null : userId.trim();
        additionalContext = Metadata.copyOf(additionalContext);
    }

    public static RunRequest stateless(String prompt) {
        return new RunRequest(prompt, null, null, Map.of());
    }

    public static RunRequest forSession(String sessionId, String prompt) {
        return new RunRequest(prompt, sessionId, null, Map.of());
    }

    public static RunRequest forUser(String userId, String prompt) {
        return new RunRequest(prompt, null, userId, Map.of());
    }
}
