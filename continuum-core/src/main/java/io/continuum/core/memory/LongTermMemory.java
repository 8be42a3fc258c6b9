package io.continuum.core.memory;

import io.continuum.core.codec.Metadata;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * User-scoped memory ranked by importance. {@code sessionId} records provenance only.
 */
public record LongTermMemory(
    String memoryId,
    String userId,
    String sessionId,
    String key,
    String value,
    LongTermMemoryType memoryType,
    double importance,
    Instant createdAt,
    Instant updatedAt,
    Instant accessedAt,
    long accessCount,
    Instant expiresAt,
    Map<String, Object> metadata
) implements MemoryRecord {
    public LongTermMemory {
        Objects.requireNonNull(memoryId, "memoryId must not be null");
        Objects.requireNonNull(userId, "userId must not be null");
        memoryType = memoryType == null ? LongTermMemoryType.FACT : memoryType;
        accessCount = Math.max(0, accessCount);
        metadata = Metadata.copyOf(metadata);
    }

    @Override
    public String typeName() {
        return memoryType.value();
    }

    LongTermMemory accessed(Instant now) {
        return new LongTermMemory(memoryId, userId, sessionId, key, value, memoryType, importance,
            createdAt, updatedAt, now, accessCount + 1, expiresAt, metadata);
    }

    LongTermMemory withImportance(double next, Instant now) {
        return new LongTermMemory(memoryId, userId, sessionId, key, value, memoryType, next,
            createdAt, now, accessedAt, accessCount, expiresAt, metadata);
    }
}
