package io.continuum.core.session;

import io.continuum.core.codec.Metadata;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

public record Session(
    String sessionId,
    String userId,
    String agentName,
    Instant createdAt,
    Instant updatedAt,
    SessionStatus status,
    Map<String, Object> metadata
) {
    public Session {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        updatedAt = updatedAt == null || updatedAt.isBefore(createdAt) ? createdAt : updatedAt;
        status = status == null ? SessionStatus.ACTIVE : status;
        metadata = Metadata.copyOf(metadata);
    }

    Session withStatus(SessionStatus next, Instant now) {
        return new Session(sessionId, userId, agentName, createdAt, now, next, metadata);
    }

    Session withMetadata(Map<String, Object> next, Instant now) {
        return new Session(sessionId, userId, agentName, createdAt, now, status, next);
    }

    Session touchedAt(Instant now) {
        return new Session(sessionId, userId, agentName, createdAt, now, status, metadata);
    }
}
