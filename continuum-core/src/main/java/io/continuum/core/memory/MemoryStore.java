package io.continuum.core.memory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Short-term (session-scoped, expiring) and long-term (user-scoped, importance-ranked) memories plus the
 * associations between them.
 *
 * <p>Values are opaque text; callers encode and decode them. Memory metadata is stamped with a
 * {@code schemaVersion} when absent. Expired memories are invisible to every retrieval path.</p>
 */
public interface MemoryStore {

    /**
     * @param importance clamped into [0, 1]
     * @param ttl        null for a memory that never expires
     * @return the new memory id
     */
    String storeLongTermMemory(
        String userId,
        String sessionId,
        String key,
        String value,
        LongTermMemoryType memoryType,
        double importance,
        Duration ttl,
        Map<String, Object> metadata
    ) throws IOException;

    default String storeLongTermMemory(
        String userId,
        String sessionId,
        String key,
        String value,
        LongTermMemoryType memoryType,
        double importance,
        Duration ttl
    ) throws IOException {
        return storeLongTermMemory(userId, sessionId, key, value, memoryType, importance, ttl, Map.of());
    }

    /**
     * @param ttlHours must be strictly positive
     */
    String storeShortTermMemory(
        String sessionId,
        String key,
        String value,
        ShortTermMemoryType memoryType,
        double ttlHours,
        Map<String, Object> metadata
    ) throws IOException;

    default String storeShortTermMemory(
        String sessionId,
        String key,
        String value,
        ShortTermMemoryType memoryType,
        double ttlHours
    ) throws IOException {
        return storeShortTermMemory(sessionId, key, value, memoryType, ttlHours, Map.of());
    }

    /**
     * Stores a short-term memory without a TTL; it is removed by {@link #expireSessionScopedMemories}.
     */
    String storeSessionScopedMemory(
        String sessionId,
        String key,
        String value,
        ShortTermMemoryType memoryType,
        Map<String, Object> metadata
    ) throws IOException;

    /**
     * Top memories by importance, then most recently accessed. Every returned memory counts as used: its
     * {@code accessedAt} moves to now and its {@code accessCount} grows by one.
     */
    default List<LongTermMemory> retrieveLongTermMemories(String userId, int topK) throws IOException {
        return queryLongTermMemories(LongTermMemoryQuery.topK(userId, topK));
    }

    /**
     * Filtered form of {@link #retrieveLongTermMemories}, with the same ordering and side effect.
     */
    List<LongTermMemory> queryLongTermMemories(LongTermMemoryQuery query) throws IOException;

    /**
     * Looks a memory up without counting it as a use. Expired memories are not returned.
     */
    Optional<LongTermMemory> findLongTermMemory(String memoryId) throws IOException;

    LongTermMemory updateImportance(String memoryId, double importance) throws IOException;

    /**
     * Newest live memories of the session first.
     */
    List<ShortTermMemory> retrieveShortTermMemories(String sessionId, int topN) throws IOException;

    /**
     * Upserts the link keyed by the unordered pair plus type. Both memories must exist when called.
     */
    MemoryAssociation associateMemories(String memoryId1, String memoryId2, String associationType, double strength)
        throws IOException;

    /**
     * Live memories linked to the given one, strongest link first. Links to missing or expired memories are
     * skipped. A null type matches any.
     */
    List<AssociatedMemory> getAssociatedMemories(String memoryId, String associationType, double minStrength)
        throws IOException;

    /**
     * Raw links touching the memory, including ones whose other end is gone.
     */
    List<MemoryAssociation> listAssociations(String memoryId) throws IOException;

    /**
     * Deletes short-term memories that expired before the purge started. Long-term memories are kept.
     *
     * @return number of rows removed
     */
    int purgeExpiredShortTermMemories() throws IOException;

    /**
     * Deletes the session's short-term memories that carry no TTL.
     */
    int expireSessionScopedMemories(String sessionId) throws IOException;
}
