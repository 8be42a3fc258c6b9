package io.continuum.core.session;

import io.continuum.core.codec.Metadata;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

public record ConversationTurn(
    String sessionId,
    int turnNumber,
    TurnRole role,
    String content,
    Instant timestamp,
    Map<String, Object> metadata
) {
    public ConversationTurn {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(role, "role must not be null");
        content = content == null ? "" : content;
        metadata = Metadata.copyOf(metadata);
    }
}
