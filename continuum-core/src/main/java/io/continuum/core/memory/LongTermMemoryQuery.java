package io.continuum.core.memory;

import io.continuum.core.error.Checks;

/**
 * Filtered long-term retrieval. Null {@code key} or {@code memoryType} match anything.
 */
public record LongTermMemoryQuery(
    String userId,
    String key,
    LongTermMemoryType memoryType,
    double minImportance,
    int limit
) {
    public LongTermMemoryQuery {
        userId = Checks.requireText(userId, "userId");
        key = Checks.blankToNull(key);
        Checks.requirePositive(limit, "limit");
    }

    public static LongTermMemoryQuery topK(String userId, int topK) {
        return new LongTermMemoryQuery(userId, null, null, 0.0, topK);
    }
}
