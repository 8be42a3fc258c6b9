package io.continuum.core.runner;

import java.util.Optional;

public record RunResponse(
    String responseText,
    SessionMetadata sessionMetadata,
    int shortTermMemoriesUsed,
    int longTermMemoriesUsed
) {
    public RunResponse {
        responseText = responseText == null ? "" : responseText;
    }

    static RunResponse stateless(String responseText) {
        return new RunResponse(responseText, null, 0, 0);
    }

    public Optional<SessionMetadata> session() {
        return Optional.ofNullable(sessionMetadata);
    }
}
