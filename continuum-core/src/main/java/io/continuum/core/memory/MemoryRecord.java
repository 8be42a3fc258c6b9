package io.continuum.core.memory;

import java.time.Instant;
import java.util.Map;

/**
 * What long-term and short-term memories have in common: an id, a caller-chosen key and an opaque value.
 */
public interface MemoryRecord {
    String memoryId();

    String sessionId();

    String key();

    String value();

    String typeName();

    Instant createdAt();

    Instant expiresAt();

    Map<String, Object> metadata();
}
