package io.continuum.core.memory;

import io.continuum.core.codec.Metadata;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Session-scoped memory. A null {@code expiresAt} means it lives as long as the session stays open.
 */
public record ShortTermMemory(
    String memoryId,
    String sessionId,
    String key,
    String value,
    ShortTermMemoryType memoryType,
    Instant createdAt,
    Instant expiresAt,
    Map<String, Object> metadata
) implements MemoryRecord {
    public ShortTermMemory {
        Objects.requireNonNull(memoryId, "memoryId must not be null");
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        memoryType = memoryType == null ? ShortTermMemoryType.CONTEXT : memoryType;
        metadata = Metadata.copyOf(metadata);
    }

    @Override
    public String typeName() {
        return memoryType.value();
    }
}
