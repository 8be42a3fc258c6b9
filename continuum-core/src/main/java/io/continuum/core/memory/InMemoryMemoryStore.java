package io.continuum.core.memory;

import io.continuum.core.codec.PayloadCodec;
import io.continuum.core.error.Checks;
import io.continuum.core.error.NotFoundException;
import io.continuum.core.error.ValidationException;
import io.continuum.core.time.Ttl;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local memory store. All state sits behind one monitor, which keeps retrieval and its access-count
 * update atomic.
 */
public final class InMemoryMemoryStore implements MemoryStore {
    private static final Logger LOG = LoggerFactory.getLogger(InMemoryMemoryStore.class);

    private static final Comparator<LongTermMemory> RANKING = Comparator
        .comparingDouble(LongTermMemory::importance).reversed()
        .thenComparing(LongTermMemory::accessedAt, Comparator.reverseOrder())
        .thenComparing(LongTermMemory::memoryId);

    private final Object lock = new Object();
    private final Map<String, LongTermMemory> longTerm = new LinkedHashMap<>();
    private final Map<String, ShortTermMemory> shortTerm = new LinkedHashMap<>();
    private final Map<String, MemoryAssociation> associations = new LinkedHashMap<>();
    private final Clock clock;
    private final PayloadCodec codec = new PayloadCodec();

    public InMemoryMemoryStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String storeLongTermMemory(
        String userId,
        String sessionId,
        String key,
        String value,
        LongTermMemoryType memoryType,
        double importance,
        Duration ttl,
        Map<String, Object> metadata
    ) {
        String owner = Checks.requireText(userId, "userId");
        String memoryKey = Checks.requireText(key, "key");
        String body = requireValue(value);
        double clamped = Importance.clamp(importance);
        Instant now = clock.instant();
        Instant expiresAt = Ttl.expiresAt(now, ttl);
        LongTermMemory memory = new LongTermMemory(UUID.randomUUID().toString(), owner, Checks.blankToNull(sessionId),
            memoryKey, body, memoryType, clamped, now, now, now, 0, expiresAt, codec.tag(metadata));
        synchronized (lock) {
            longTerm.put(memory.memoryId(), memory);
        }
        LOG.debug("Long-term memory stored: memory_id={}, user_id={}, key={}, importance={}",
            memory.memoryId(), owner, memoryKey, clamped);
        return memory.memoryId();
    }

    @Override
    public String storeShortTermMemory(
        String sessionId,
        String key,
        String value,
        ShortTermMemoryType memoryType,
        double ttlHours,
        Map<String, Object> metadata
    ) {
        return insertShortTerm(sessionId, key, value, memoryType, Ttl.ofHours(ttlHours), metadata);
    }

    @Override
    public String storeSessionScopedMemory(
        String sessionId,
        String key,
        String value,
        ShortTermMemoryType memoryType,
        Map<String, Object> metadata
    ) {
        return insertShortTerm(sessionId, key, value, memoryType, null, metadata);
    }

    private String insertShortTerm(
        String sessionId,
        String key,
        String value,
        ShortTermMemoryType memoryType,
        Duration ttl,
        Map<String, Object> metadata
    ) {
        String session = Checks.requireText(sessionId, "sessionId");
        String memoryKey = Checks.requireText(key, "key");
        String body = requireValue(value);
        Instant now = clock.instant();
        ShortTermMemory memory = new ShortTermMemory(UUID.randomUUID().toString(), session, memoryKey, body,
            memoryType, now, Ttl.expiresAt(now, ttl), codec.tag(metadata));
        synchronized (lock) {
            shortTerm.put(memory.memoryId(), memory);
        }
        LOG.debug("Short-term memory stored: memory_id={}, session_id={}, key={}, expires_at={}",
            memory.memoryId(), session, memoryKey, memory.expiresAt());
        return memory.memoryId();
    }

    @Override
    public List<LongTermMemory> queryLongTermMemories(LongTermMemoryQuery query) {
        if (query == null) {
            throw new ValidationException("query must not be null");
        }
        synchronized (lock) {
            Instant now = clock.instant();
            List<LongTermMemory> ranked = longTerm.values().stream()
                .filter(memory -> memory.userId().equals(query.userId()))
                .filter(memory -> memory.importance() >= query.minImportance())
                .filter(memory -> query.key() == null || query.key().equals(memory.key()))
                .filter(memory -> query.memoryType() == null || query.memoryType() == memory.memoryType())
                .filter(memory -> Ttl.isAlive(memory.expiresAt(), now))
                .sorted(RANKING)
                .limit(query.limit())
                .toList();
            List<LongTermMemory> touched = new ArrayList<>(ranked.size());
            for (LongTermMemory memory : ranked) {
                LongTermMemory accessed = memory.accessed(now);
                longTerm.put(accessed.memoryId(), accessed);
                touched.add(accessed);
            }
            return List.copyOf(touched);
        }
    }

    @Override
    public Optional<LongTermMemory> findLongTermMemory(String memoryId) {
        String id = Checks.requireText(memoryId, "memoryId");
        synchronized (lock) {
            return Optional.ofNullable(longTerm.get(id))
                .filter(memory -> Ttl.isAlive(memory.expiresAt(), clock.instant()));
        }
    }

    @Override
    public LongTermMemory updateImportance(String memoryId, double importance) {
        String id = Checks.requireText(memoryId, "memoryId");
        double clamped = Importance.clamp(importance);
        synchronized (lock) {
            LongTermMemory current = longTerm.get(id);
            if (current == null) {
                throw new NotFoundException("memory", id);
            }
            LongTermMemory updated = current.withImportance(clamped, clock.instant());
            longTerm.put(id, updated);
            return updated;
        }
    }

    @Override
    public List<ShortTermMemory> retrieveShortTermMemories(String sessionId, int topN) {
        String session = Checks.requireText(sessionId, "sessionId");
        int limit = Checks.requirePositive(topN, "topN");
        synchronized (lock) {
            Instant now = clock.instant();
            List<ShortTermMemory> newestFirst = new ArrayList<>();
            for (ShortTermMemory memory : shortTerm.values()) {
                if (memory.sessionId().equals(session) && Ttl.isAlive(memory.expiresAt(), now)) {
                    newestFirst.add(memory);
                }
            }
            Collections.reverse(newestFirst);
            newestFirst.sort(Comparator.comparing(ShortTermMemory::createdAt).reversed());
            return List.copyOf(newestFirst.subList(0, Math.min(limit, newestFirst.size())));
        }
    }

    @Override
    public MemoryAssociation associateMemories(String memoryId1, String memoryId2, String associationType, double strength) {
        String first = Checks.requireText(memoryId1, "memoryId1");
        String second = Checks.requireText(memoryId2, "memoryId2");
        String type = Checks.requireText(associationType, "associationType");
        double checked = Importance.requireStrength(strength);
        if (first.equals(second)) {
            throw new ValidationException("a memory cannot be associated with itself");
        }
        String low = first.compareTo(second) <= 0 ? first : second;
        String high = low.equals(first) ? second : first;
        synchronized (lock) {
            requireExists(first);
            requireExists(second);
            String linkKey = low + '\u0000' + high + '\u0000' + type;
            MemoryAssociation association = new MemoryAssociation(low, high, type, checked, clock.instant());
            associations.put(linkKey, association);
            return association;
        }
    }

    @Override
    public List<AssociatedMemory> getAssociatedMemories(String memoryId, String associationType, double minStrength) {
        String id = Checks.requireText(memoryId, "memoryId");
        String type = Checks.blankToNull(associationType);
        synchronized (lock) {
            Instant now = clock.instant();
            List<AssociatedMemory> result = new ArrayList<>();
            for (MemoryAssociation association : associationsOf(id)) {
                if (type != null && !type.equals(association.associationType())) {
                    continue;
                }
                if (association.strength() < minStrength) {
                    continue;
                }
                MemoryRecord other = resolve(association.otherEnd(id));
                if (other != null && Ttl.isAlive(other.expiresAt(), now)) {
                    result.add(new AssociatedMemory(other, association.associationType(), association.strength()));
                }
            }
            return List.copyOf(result);
        }
    }

    @Override
    public List<MemoryAssociation> listAssociations(String memoryId) {
        String id = Checks.requireText(memoryId, "memoryId");
        synchronized (lock) {
            return associationsOf(id);
        }
    }

    @Override
    public int purgeExpiredShortTermMemories() {
        int removed = 0;
        synchronized (lock) {
            Instant now = clock.instant();
            Iterator<ShortTermMemory> iterator = shortTerm.values().iterator();
            while (iterator.hasNext()) {
                ShortTermMemory memory = iterator.next();
                if (memory.expiresAt() != null && memory.expiresAt().isBefore(now)) {
                    iterator.remove();
                    removed++;
                }
            }
        }
        if (removed > 0) {
            LOG.info("Purged {} expired short-term memories", removed);
        }
        return removed;
    }

    @Override
    public int expireSessionScopedMemories(String sessionId) {
        String session = Checks.requireText(sessionId, "sessionId");
        int removed = 0;
        synchronized (lock) {
            Iterator<ShortTermMemory> iterator = shortTerm.values().iterator();
            while (iterator.hasNext()) {
                ShortTermMemory memory = iterator.next();
                if (memory.sessionId().equals(session) && memory.expiresAt() == null) {
                    iterator.remove();
                    removed++;
                }
            }
        }
        LOG.debug("Expired {} session-scoped memories for session_id={}", removed, session);
        return removed;
    }

    private List<MemoryAssociation> associationsOf(String memoryId) {
        return associations.values().stream()
            .filter(association -> association.touches(memoryId))
            .sorted(Comparator.comparingDouble(MemoryAssociation::strength).reversed()
                .thenComparing(MemoryAssociation::associationType)
                .thenComparing(MemoryAssociation::memoryId1)
                .thenComparing(MemoryAssociation::memoryId2))
            .toList();
    }

    private void requireExists(String memoryId) {
        if (!longTerm.containsKey(memoryId) && !shortTerm.containsKey(memoryId)) {
            throw new NotFoundException("memory", memoryId);
        }
    }

    private MemoryRecord resolve(String memoryId) {
        MemoryRecord memory = longTerm.get(memoryId);
        return memory != null ? memory : shortTerm.get(memoryId);
    }

    private static String requireValue(String value) {
        if (value == null) {
            throw new ValidationException("value must not be null");
        }
        return value;
    }
}
