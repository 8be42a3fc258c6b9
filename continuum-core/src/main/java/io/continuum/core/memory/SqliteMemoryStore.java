package io.continuum.core.memory;

import io.continuum.core.codec.PayloadCodec;
import io.continuum.core.error.Checks;
import io.continuum.core.error.NotFoundException;
import io.continuum.core.error.ValidationException;
import io.continuum.core.sqlite.SqliteDatabase;
import io.continuum.core.time.Ttl;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SqliteMemoryStore implements MemoryStore {
    private static final Logger LOG = LoggerFactory.getLogger(SqliteMemoryStore.class);

    private static final List<String> SCHEMA = List.of(
        """
        CREATE TABLE IF NOT EXISTS long_term_memory (
            memory_id TEXT PRIMARY KEY,
            user_id TEXT NOT NULL,
            session_id TEXT,
            key TEXT NOT NULL,
            value TEXT NOT NULL,
            memory_type TEXT NOT NULL,
            importance REAL NOT NULL DEFAULT 0.5,
            created_at INTEGER NOT NULL,
            updated_at INTEGER NOT NULL,
            accessed_at INTEGER NOT NULL,
            access_count INTEGER NOT NULL DEFAULT 0,
            expires_at INTEGER,
            metadata TEXT
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS short_term_memory (
            memory_id TEXT PRIMARY KEY,
            session_id TEXT NOT NULL,
            key TEXT NOT NULL,
            value TEXT NOT NULL,
            memory_type TEXT NOT NULL,
            created_at INTEGER NOT NULL,
            expires_at INTEGER,
            metadata TEXT
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS memory_associations (
            memory_id_1 TEXT NOT NULL,
            memory_id_2 TEXT NOT NULL,
            association_type TEXT NOT NULL,
            strength REAL NOT NULL,
            created_at INTEGER NOT NULL,
            PRIMARY KEY (memory_id_1, memory_id_2, association_type)
        )
        """,
        "CREATE INDEX IF NOT EXISTS idx_ltm_user ON long_term_memory(user_id, importance DESC, accessed_at DESC)",
        "CREATE INDEX IF NOT EXISTS idx_ltm_key ON long_term_memory(user_id, key)",
        "CREATE INDEX IF NOT EXISTS idx_stm_session ON short_term_memory(session_id, created_at DESC)",
        "CREATE INDEX IF NOT EXISTS idx_stm_expires ON short_term_memory(expires_at)",
        "CREATE INDEX IF NOT EXISTS idx_assoc_second ON memory_associations(memory_id_2)"
    );

    private static final String LTM_COLUMNS = """
        memory_id, user_id, session_id, key, value, memory_type, importance,
        created_at, updated_at, accessed_at, access_count, expires_at, metadata
        """;

    private final SqliteDatabase database;
    private final Clock clock;
    private final PayloadCodec codec;

    public SqliteMemoryStore(SqliteDatabase database, Clock clock) throws IOException {
        this.database = database;
        this.clock = clock;
        this.codec = new PayloadCodec();
        database.migrate("memory store", SCHEMA);
        LOG.info("Memory store initialized at {}", database.path());
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
    ) throws IOException {
        String owner = Checks.requireText(userId, "userId");
        String memoryKey = Checks.requireText(key, "key");
        String body = requireValue(value);
        LongTermMemoryType type = memoryType == null ? LongTermMemoryType.FACT : memoryType;
        double clamped = Importance.clamp(importance);
        Instant now = clock.instant();
        Instant expiresAt = Ttl.expiresAt(now, ttl);
        String memoryId = UUID.randomUUID().toString();
        String metadataJson = codec.writeMetadata(codec.tag(metadata));

        database.write("store long-term memory " + memoryKey, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                "INSERT INTO long_term_memory (" + LTM_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 0, ?, ?)")) {
                statement.setString(1, memoryId);
                statement.setString(2, owner);
                statement.setString(3, Checks.blankToNull(sessionId));
                statement.setString(4, memoryKey);
                statement.setString(5, body);
                statement.setString(6, type.value());
                statement.setDouble(7, clamped);
                statement.setLong(8, now.toEpochMilli());
                statement.setLong(9, now.toEpochMilli());
                statement.setLong(10, now.toEpochMilli());
                setInstant(statement, 11, expiresAt);
                statement.setString(12, metadataJson);
                statement.executeUpdate();
            }
            return null;
        });

        LOG.debug("Long-term memory stored: memory_id={}, user_id={}, key={}, importance={}", memoryId, owner, memoryKey, clamped);
        return memoryId;
    }

    @Override
    public String storeShortTermMemory(
        String sessionId,
        String key,
        String value,
        ShortTermMemoryType memoryType,
        double ttlHours,
        Map<String, Object> metadata
    ) throws IOException {
        Duration ttl = Ttl.ofHours(ttlHours);
        return insertShortTerm(sessionId, key, value, memoryType, ttl, metadata);
    }

    @Override
    public String storeSessionScopedMemory(
        String sessionId,
        String key,
        String value,
        ShortTermMemoryType memoryType,
        Map<String, Object> metadata
    ) throws IOException {
        return insertShortTerm(sessionId, key, value, memoryType, null, metadata);
    }

    private String insertShortTerm(
        String sessionId,
        String key,
        String value,
        ShortTermMemoryType memoryType,
        Duration ttl,
        Map<String, Object> metadata
    ) throws IOException {
        String session = Checks.requireText(sessionId, "sessionId");
        String memoryKey = Checks.requireText(key, "key");
        String body = requireValue(value);
        ShortTermMemoryType type = memoryType == null ? ShortTermMemoryType.CONTEXT : memoryType;
        Instant now = clock.instant();
        Instant expiresAt = Ttl.expiresAt(now, ttl);
        String memoryId = UUID.randomUUID().toString();
        String metadataJson = codec.writeMetadata(codec.tag(metadata));

        database.write("store short-term memory " + memoryKey, connection -> {
            try (PreparedStatement statement = connection.prepareStatement("""
                INSERT INTO short_term_memory (memory_id, session_id, key, value, memory_type, created_at, expires_at, metadata)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """)) {
                statement.setString(1, memoryId);
                statement.setString(2, session);
                statement.setString(3, memoryKey);
                statement.setString(4, body);
                statement.setString(5, type.value());
                statement.setLong(6, now.toEpochMilli());
                setInstant(statement, 7, expiresAt);
                statement.setString(8, metadataJson);
                statement.executeUpdate();
            }
            return null;
        });

        LOG.debug("Short-term memory stored: memory_id={}, session_id={}, key={}, expires_at={}", memoryId, session, memoryKey, expiresAt);
        return memoryId;
    }

    @Override
    public List<LongTermMemory> queryLongTermMemories(LongTermMemoryQuery query) throws IOException {
        if (query == null) {
            throw new ValidationException("query must not be null");
        }
        StringBuilder sql = new StringBuilder("SELECT " + LTM_COLUMNS + " FROM long_term_memory WHERE user_id = ?")
            .append(" AND importance >= ?")
            .append(" AND (expires_at IS NULL OR expires_at >= ?)");
        if (query.key() != null) {
            sql.append(" AND key = ?");
        }
        if (query.memoryType() != null) {
            sql.append(" AND memory_type = ?");
        }
        sql.append(" ORDER BY importance DESC, accessed_at DESC, memory_id LIMIT ?");

        return database.write("retrieve long-term memories for user " + query.userId(), connection -> {
            Instant now = clock.instant();
            List<LongTermMemory> found = new ArrayList<>();
            try (PreparedStatement statement = connection.prepareStatement(sql.toString())) {
                int index = 1;
                statement.setString(index++, query.userId());
                statement.setDouble(index++, query.minImportance());
                statement.setLong(index++, now.toEpochMilli());
                if (query.key() != null) {
                    statement.setString(index++, query.key());
                }
                if (query.memoryType() != null) {
                    statement.setString(index++, query.memoryType().value());
                }
                statement.setInt(index, query.limit());
                try (ResultSet rs = statement.executeQuery()) {
                    while (rs.next()) {
                        found.add(mapLongTerm(rs));
                    }
                }
            }
            if (found.isEmpty()) {
                return List.<LongTermMemory>of();
            }
            List<LongTermMemory> touched = new ArrayList<>(found.size());
            try (PreparedStatement update = connection.prepareStatement(
                "UPDATE long_term_memory SET accessed_at = ?, access_count = access_count + 1 WHERE memory_id = ?")) {
                for (LongTermMemory memory : found) {
                    update.setLong(1, now.toEpochMilli());
                    update.setString(2, memory.memoryId());
                    update.addBatch();
                    touched.add(memory.accessed(now));
                }
                update.executeBatch();
            }
            return List.copyOf(touched);
        });
    }

    @Override
    public Optional<LongTermMemory> findLongTermMemory(String memoryId) throws IOException {
        String id = Checks.requireText(memoryId, "memoryId");
        return database.read("find long-term memory " + id, connection ->
            loadLongTerm(connection, id).filter(memory -> Ttl.isAlive(memory.expiresAt(), clock.instant())));
    }

    @Override
    public LongTermMemory updateImportance(String memoryId, double importance) throws IOException {
        String id = Checks.requireText(memoryId, "memoryId");
        double clamped = Importance.clamp(importance);
        LongTermMemory updated = database.write("update importance of memory " + id, connection -> {
            LongTermMemory current = loadLongTerm(connection, id)
                .orElseThrow(() -> new NotFoundException("memory", id));
            Instant now = clock.instant();
            try (PreparedStatement statement = connection.prepareStatement(
                "UPDATE long_term_memory SET importance = ?, updated_at = ? WHERE memory_id = ?")) {
                statement.setDouble(1, clamped);
                statement.setLong(2, now.toEpochMilli());
                statement.setString(3, id);
                statement.executeUpdate();
            }
            return current.withImportance(clamped, now);
        });
        LOG.debug("Importance updated: memory_id={}, importance={}", id, clamped);
        return updated;
    }

    @Override
    public List<ShortTermMemory> retrieveShortTermMemories(String sessionId, int topN) throws IOException {
        String session = Checks.requireText(sessionId, "sessionId");
        int limit = Checks.requirePositive(topN, "topN");
        return database.read("retrieve short-term memories for session " + session, connection -> {
            try (PreparedStatement statement = connection.prepareStatement("""
                SELECT memory_id, session_id, key, value, memory_type, created_at, expires_at, metadata
                FROM short_term_memory
                WHERE session_id = ? AND (expires_at IS NULL OR expires_at >= ?)
                ORDER BY created_at DESC, rowid DESC
                LIMIT ?
                """)) {
                statement.setString(1, session);
                statement.setLong(2, clock.instant().toEpochMilli());
                statement.setInt(3, limit);
                try (ResultSet rs = statement.executeQuery()) {
                    List<ShortTermMemory> memories = new ArrayList<>();
                    while (rs.next()) {
                        memories.add(mapShortTerm(rs));
                    }
                    return List.copyOf(memories);
                }
            }
        });
    }

    @Override
    public MemoryAssociation associateMemories(String memoryId1, String memoryId2, String associationType, double strength)
        throws IOException {
        String first = Checks.requireText(memoryId1, "memoryId1");
        String second = Checks.requireText(memoryId2, "memoryId2");
        String type = Checks.requireText(associationType, "associationType");
        double checked = Importance.requireStrength(strength);
        if (first.equals(second)) {
            throw new ValidationException("a memory cannot be associated with itself");
        }
        String low = first.compareTo(second) <= 0 ? first : second;
        String high = low.equals(first) ? second : first;

        MemoryAssociation association = database.write("associate memories " + low + " and " + high, connection -> {
            requireExists(connection, first);
            requireExists(connection, second);
            Instant now = clock.instant();
            try (PreparedStatement statement = connection.prepareStatement("""
                INSERT INTO memory_associations (memory_id_1, memory_id_2, association_type, strength, created_at)
                VALUES (?, ?, ?, ?, ?)
                ON CONFLICT (memory_id_1, memory_id_2, association_type)
                DO UPDATE SET strength = excluded.strength, created_at = excluded.created_at
                """)) {
                statement.setString(1, low);
                statement.setString(2, high);
                statement.setString(3, type);
                statement.setDouble(4, checked);
                statement.setLong(5, now.toEpochMilli());
                statement.executeUpdate();
            }
            return loadAssociation(connection, low, high, type);
        });
        LOG.debug("Memories associated: {} <-> {} type={} strength={}", low, high, type, checked);
        return association;
    }

    @Override
    public List<AssociatedMemory> getAssociatedMemories(String memoryId, String associationType, double minStrength)
        throws IOException {
        String id = Checks.requireText(memoryId, "memoryId");
        String type = Checks.blankToNull(associationType);
        return database.read("load associated memories of " + id, connection -> {
            Instant now = clock.instant();
            List<AssociatedMemory> result = new ArrayList<>();
            for (MemoryAssociation association : associationsOf(connection, id)) {
                if (type != null && !type.equals(association.associationType())) {
                    continue;
                }
                if (association.strength() < minStrength) {
                    continue;
                }
                String other = association.otherEnd(id);
                Optional<? extends MemoryRecord> memory = loadLongTerm(connection, other);
                if (memory.isEmpty()) {
                    memory = loadShortTerm(connection, other);
                }
                if (memory.isPresent() && Ttl.isAlive(memory.get().expiresAt(), now)) {
                    result.add(new AssociatedMemory(memory.get(), association.associationType(), association.strength()));
                }
            }
            return List.copyOf(result);
        });
    }

    @Override
    public List<MemoryAssociation> listAssociations(String memoryId) throws IOException {
        String id = Checks.requireText(memoryId, "memoryId");
        return database.read("list associations of " + id, connection -> associationsOf(connection, id));
    }

    @Override
    public int purgeExpiredShortTermMemories() throws IOException {
        int removed = database.write("purge expired short-term memories", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                "DELETE FROM short_term_memory WHERE expires_at IS NOT NULL AND expires_at < ?")) {
                statement.setLong(1, clock.instant().toEpochMilli());
                return statement.executeUpdate();
            }
        });
        if (removed > 0) {
            LOG.info("Purged {} expired short-term memories", removed);
        }
        return removed;
    }

    @Override
    public int expireSessionScopedMemories(String sessionId) throws IOException {
        String session = Checks.requireText(sessionId, "sessionId");
        int removed = database.write("expire session-scoped memories of " + session, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                "DELETE FROM short_term_memory WHERE session_id = ? AND expires_at IS NULL")) {
                statement.setString(1, session);
                return statement.executeUpdate();
            }
        });
        LOG.debug("Expired {} session-scoped memories for session_id={}", removed, session);
        return removed;
    }

    private List<MemoryAssociation> associationsOf(Connection connection, String memoryId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("""
            SELECT memory_id_1, memory_id_2, association_type, strength, created_at
            FROM memory_associations
            WHERE memory_id_1 = ? OR memory_id_2 = ?
            ORDER BY strength DESC, association_type, memory_id_1, memory_id_2
            """)) {
            statement.setString(1, memoryId);
            statement.setString(2, memoryId);
            try (ResultSet rs = statement.executeQuery()) {
                List<MemoryAssociation> associations = new ArrayList<>();
                while (rs.next()) {
                    associations.add(mapAssociation(rs));
                }
                return List.copyOf(associations);
            }
        }
    }

    private MemoryAssociation loadAssociation(Connection connection, String low, String high, String type) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("""
            SELECT memory_id_1, memory_id_2, association_type, strength, created_at
            FROM memory_associations
            WHERE memory_id_1 = ? AND memory_id_2 = ? AND association_type = ?
            """)) {
            statement.setString(1, low);
            statement.setString(2, high);
            statement.setString(3, type);
            try (ResultSet rs = statement.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("association vanished inside its own transaction");
                }
                return mapAssociation(rs);
            }
        }
    }

    private void requireExists(Connection connection, String memoryId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("""
            SELECT 1 FROM long_term_memory WHERE memory_id = ?
            UNION ALL
            SELECT 1 FROM short_term_memory WHERE memory_id = ?
            LIMIT 1
            """)) {
            statement.setString(1, memoryId);
            statement.setString(2, memoryId);
            try (ResultSet rs = statement.executeQuery()) {
                if (!rs.next()) {
                    throw new NotFoundException("memory", memoryId);
                }
            }
        }
    }

    private Optional<LongTermMemory> loadLongTerm(Connection connection, String memoryId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT " + LTM_COLUMNS + " FROM long_term_memory WHERE memory_id = ?")) {
            statement.setString(1, memoryId);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? Optional.of(mapLongTerm(rs)) : Optional.empty();
            }
        }
    }

    private Optional<ShortTermMemory> loadShortTerm(Connection connection, String memoryId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("""
            SELECT memory_id, session_id, key, value, memory_type, created_at, expires_at, metadata
            FROM short_term_memory WHERE memory_id = ?
            """)) {
            statement.setString(1, memoryId);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? Optional.of(mapShortTerm(rs)) : Optional.empty();
            }
        }
    }

    private LongTermMemory mapLongTerm(ResultSet rs) throws SQLException {
        return new LongTermMemory(
            rs.getString("memory_id"),
            rs.getString("user_id"),
            rs.getString("session_id"),
            rs.getString("key"),
            rs.getString("value"),
            LongTermMemoryType.fromValue(rs.getString("memory_type")),
            rs.getDouble("importance"),
            Instant.ofEpochMilli(rs.getLong("created_at")),
            Instant.ofEpochMilli(rs.getLong("updated_at")),
            Instant.ofEpochMilli(rs.getLong("accessed_at")),
            rs.getLong("access_count"),
            readInstant(rs, "expires_at"),
            codec.readMetadata(rs.getString("metadata"))
        );
    }

    private ShortTermMemory mapShortTerm(ResultSet rs) throws SQLException {
        return new ShortTermMemory(
            rs.getString("memory_id"),
            rs.getString("session_id"),
            rs.getString("key"),
            rs.getString("value"),
            ShortTermMemoryType.fromValue(rs.getString("memory_type")),
            Instant.ofEpochMilli(rs.getLong("created_at")),
            readInstant(rs, "expires_at"),
            codec.readMetadata(rs.getString("metadata"))
        );
    }

    private MemoryAssociation mapAssociation(ResultSet rs) throws SQLException {
        return new MemoryAssociation(
            rs.getString("memory_id_1"),
            rs.getString("memory_id_2"),
            rs.getString("association_type"),
            rs.getDouble("strength"),
            Instant.ofEpochMilli(rs.getLong("created_at"))
        );
    }

    private static String requireValue(String value) {
        if (value == null) {
            throw new ValidationException("value must not be null");
        }
        return value;
    }

    private static void setInstant(PreparedStatement statement, int index, Instant instant) throws SQLException {
        if (instant == null) {
            statement.setNull(index, Types.INTEGER);
        } else {
            statement.setLong(index, instant.toEpochMilli());
        }
    }

    private static Instant readInstant(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }
}
