package io.continuum.core.session;

import io.continuum.core.codec.PayloadCodec;
import io.continuum.core.error.Checks;
import io.continuum.core.error.InvalidTransitionException;
import io.continuum.core.error.NotFoundException;
import io.continuum.core.error.ValidationException;
import io.continuum.core.sqlite.SqliteDatabase;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SqliteSessionStore implements SessionStore {
    private static final Logger LOG = LoggerFactory.getLogger(SqliteSessionStore.class);

    private static final List<String> SCHEMA = List.of(
        """
        CREATE TABLE IF NOT EXISTS users (
            user_id TEXT PRIMARY KEY,
            created_at INTEGER NOT NULL,
            metadata TEXT
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS sessions (
            session_id TEXT PRIMARY KEY,
            user_id TEXT,
            agent_name TEXT NOT NULL,
            created_at INTEGER NOT NULL,
            updated_at INTEGER NOT NULL,
            status TEXT NOT NULL DEFAULT 'active',
            metadata TEXT
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS conversation_turns (
            session_id TEXT NOT NULL,
            turn_number INTEGER NOT NULL,
            role TEXT NOT NULL,
            content TEXT NOT NULL,
            timestamp INTEGER NOT NULL,
            metadata TEXT,
            PRIMARY KEY (session_id, turn_number)
        )
        """,
        "CREATE INDEX IF NOT EXISTS idx_sessions_user_id ON sessions(user_id, created_at DESC)",
        "CREATE INDEX IF NOT EXISTS idx_sessions_status ON sessions(status)"
    );

    private final SqliteDatabase database;
    private final Clock clock;
    private final PayloadCodec codec;

    public SqliteSessionStore(SqliteDatabase database, Clock clock) throws IOException {
        this.database = database;
        this.clock = clock;
        this.codec = new PayloadCodec();
        database.migrate("session store", SCHEMA);
        LOG.info("Session store initialized at {}", database.path());
    }

    @Override
    public Session createSession(String userId, String agentName, Map<String, Object> metadata) throws IOException {
        String agent = Checks.requireText(agentName, "agentName");
        String owner = Checks.blankToNull(userId);
        Instant now = clock.instant();
        Session session = new Session(UUID.randomUUID().toString(), owner, agent, now, now, SessionStatus.ACTIVE, metadata);

        database.write("create session", connection -> {
            if (owner != null) {
                ensureUser(connection, owner, now);
            }
            try (PreparedStatement statement = connection.prepareStatement("""
                INSERT INTO sessions (session_id, user_id, agent_name, created_at, updated_at, status, metadata)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """)) {
                statement.setString(1, session.sessionId());
                statement.setString(2, owner);
                statement.setString(3, agent);
                statement.setLong(4, now.toEpochMilli());
                statement.setLong(5, now.toEpochMilli());
                statement.setString(6, SessionStatus.ACTIVE.value());
                statement.setString(7, codec.writeMetadata(session.metadata()));
                statement.executeUpdate();
            }
            return null;
        });

        LOG.info("Session created: session_id={}, user_id={}, agent={}", session.sessionId(), owner, agent);
        return session;
    }

    @Override
    public Session getSession(String sessionId) throws IOException {
        String id = Checks.requireText(sessionId, "sessionId");
        return database.read("load session " + id, connection -> requireSession(connection, id));
    }

    @Override
    public Optional<UserRecord> getUser(String userId) throws IOException {
        String id = Checks.requireText(userId, "userId");
        return database.read("load user " + id, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                "SELECT user_id, created_at, metadata FROM users WHERE user_id = ?")) {
                statement.setString(1, id);
                try (ResultSet rs = statement.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    return Optional.of(new UserRecord(
                        rs.getString("user_id"),
                        Instant.ofEpochMilli(rs.getLong("created_at")),
                        codec.readMetadata(rs.getString("metadata"))
                    ));
                }
            }
        });
    }

    @Override
    public ConversationTurn appendTurn(String sessionId, TurnRole role, String content, Map<String, Object> metadata)
        throws IOException {
        String id = Checks.requireText(sessionId, "sessionId");
        if (role == null) {
            throw new ValidationException("role must not be null");
        }
        String text = content == null ? "" : content;
        ConversationTurn turn = database.write("append turn to session " + id, connection -> {
            requireSession(connection, id);
            Instant now = clock.instant();
            ConversationTurn appended = insertTurn(connection, id, nextTurnNumber(connection, id), role, text, metadata, now);
            touch(connection, id, now);
            return appended;
        });

        LOG.debug("Turn appended: session_id={}, turn={}, role={}", id, turn.turnNumber(), role.value());
        return turn;
    }

    @Override
    public TurnPair appendTurnPair(
        String sessionId,
        String userContent,
        Map<String, Object> userMetadata,
        String assistantContent,
        Map<String, Object> assistantMetadata
    ) throws IOException {
        String id = Checks.requireText(sessionId, "sessionId");
        String question = userContent == null ? "" : userContent;
        String answer = assistantContent == null ? "" : assistantContent;

        TurnPair pair = database.write("append turn pair to session " + id, connection -> {
            requireSession(connection, id);
            Instant now = clock.instant();
            int next = nextTurnNumber(connection, id);
            ConversationTurn user = insertTurn(connection, id, next, TurnRole.USER, question, userMetadata, now);
            ConversationTurn assistant =
                insertTurn(connection, id, next + 1, TurnRole.ASSISTANT, answer, assistantMetadata, now);
            touch(connection, id, now);
            return new TurnPair(user, assistant);
        });

        LOG.debug("Turn pair appended: session_id={}, turns={}-{}", id, pair.user().turnNumber(), pair.assistant().turnNumber());
        return pair;
    }

    @Override
    public List<ConversationTurn> getHistory(String sessionId, int limit) throws IOException {
        return getHistoryBefore(sessionId, Integer.MAX_VALUE, limit);
    }

    @Override
    public List<ConversationTurn> getHistoryBefore(String sessionId, int beforeTurn, int limit) throws IOException {
        String id = Checks.requireText(sessionId, "sessionId");
        int max = Checks.requirePositive(limit, "limit");
        return database.read("load history for session " + id, connection -> {
            requireSession(connection, id);
            try (PreparedStatement statement = connection.prepareStatement("""
                SELECT session_id, turn_number, role, content, timestamp, metadata
                FROM conversation_turns
                WHERE session_id = ? AND turn_number < ?
                ORDER BY turn_number DESC
                LIMIT ?
                """)) {
                statement.setString(1, id);
                statement.setInt(2, beforeTurn);
                statement.setInt(3, max);
                try (ResultSet rs = statement.executeQuery()) {
                    List<ConversationTurn> turns = new ArrayList<>();
                    while (rs.next()) {
                        turns.add(new ConversationTurn(
                            rs.getString("session_id"),
                            rs.getInt("turn_number"),
                            TurnRole.fromValue(rs.getString("role")),
                            rs.getString("content"),
                            Instant.ofEpochMilli(rs.getLong("timestamp")),
                            codec.readMetadata(rs.getString("metadata"))
                        ));
                    }
                    return List.copyOf(turns);
                }
            }
        });
    }

    @Override
    public List<Session> listSessionsForUser(String userId, SessionStatus status, int limit) throws IOException {
        String id = Checks.requireText(userId, "userId");
        StringBuilder sql = new StringBuilder("SELECT * FROM sessions WHERE user_id = ?");
        if (status != null) {
            sql.append(" AND status = ?");
        }
        sql.append(" ORDER BY created_at DESC, session_id");
        if (limit > 0) {
            sql.append(" LIMIT ?");
        }
        return database.read("list sessions for user " + id, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql.toString())) {
                int index = 1;
                statement.setString(index++, id);
                if (status != null) {
                    statement.setString(index++, status.value());
                }
                if (limit > 0) {
                    statement.setInt(index, limit);
                }
                try (ResultSet rs = statement.executeQuery()) {
                    List<Session> sessions = new ArrayList<>();
                    while (rs.next()) {
                        sessions.add(mapSession(rs));
                    }
                    return List.copyOf(sessions);
                }
            }
        });
    }

    @Override
    public Session setStatus(String sessionId, SessionStatus status) throws IOException {
        String id = Checks.requireText(sessionId, "sessionId");
        if (status == null) {
            throw new ValidationException("status must not be null");
        }
        Session updated = database.write("set status of session " + id, connection -> {
            Session current = requireSession(connection, id);
            if (!current.status().canMoveTo(status)) {
                throw new InvalidTransitionException(id, current.status(), status);
            }
            if (current.status() == status) {
                return current;
            }
            Instant now = latest(current);
            try (PreparedStatement statement = connection.prepareStatement(
                "UPDATE sessions SET status = ?, updated_at = MAX(updated_at, ?) WHERE session_id = ?")) {
                statement.setString(1, status.value());
                statement.setLong(2, now.toEpochMilli());
                statement.setString(3, id);
                statement.executeUpdate();
            }
            return current.withStatus(status, now);
        });
        LOG.info("Session status: session_id={}, status={}", id, updated.status().value());
        return updated;
    }

    @Override
    public Session updateMetadata(String sessionId, Map<String, Object> metadata) throws IOException {
        String id = Checks.requireText(sessionId, "sessionId");
        String json = codec.writeMetadata(metadata);
        return database.write("update metadata of session " + id, connection -> {
            Session current = requireSession(connection, id);
            Instant now = latest(current);
            try (PreparedStatement statement = connection.prepareStatement(
                "UPDATE sessions SET metadata = ?, updated_at = MAX(updated_at, ?) WHERE session_id = ?")) {
                statement.setString(1, json);
                statement.setLong(2, now.toEpochMilli());
                statement.setString(3, id);
                statement.executeUpdate();
            }
            return current.withMetadata(metadata, now);
        });
    }

    private ConversationTurn insertTurn(
        Connection connection,
        String sessionId,
        int turnNumber,
        TurnRole role,
        String content,
        Map<String, Object> metadata,
        Instant now
    ) throws SQLException {
        try (PreparedStatement insert = connection.prepareStatement("""
            INSERT INTO conversation_turns (session_id, turn_number, role, content, timestamp, metadata)
            VALUES (?, ?, ?, ?, ?, ?)
            """)) {
            insert.setString(1, sessionId);
            insert.setInt(2, turnNumber);
            insert.setString(3, role.value());
            insert.setString(4, content);
            insert.setLong(5, now.toEpochMilli());
            insert.setString(6, codec.writeMetadata(metadata));
            insert.executeUpdate();
        }
        return new ConversationTurn(sessionId, turnNumber, role, content, now, metadata);
    }

    private int nextTurnNumber(Connection connection, String sessionId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT COALESCE(MAX(turn_number), 0) + 1 FROM conversation_turns WHERE session_id = ?")) {
            statement.setString(1, sessionId);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 1;
            }
        }
    }

    private Instant latest(Session current) {
        Instant now = clock.instant();
        return now.isBefore(current.updatedAt()) ? current.updatedAt() : now;
    }

    private void touch(Connection connection, String sessionId, Instant now) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "UPDATE sessions SET updated_at = MAX(updated_at, ?) WHERE session_id = ?")) {
            statement.setLong(1, now.toEpochMilli());
            statement.setString(2, sessionId);
            statement.executeUpdate();
        }
    }

    private void ensureUser(Connection connection, String userId, Instant now) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "INSERT OR IGNORE INTO users (user_id, created_at, metadata) VALUES (?, ?, ?)")) {
            statement.setString(1, userId);
            statement.setLong(2, now.toEpochMilli());
            statement.setString(3, codec.writeMetadata(Map.of()));
            statement.executeUpdate();
        }
    }

    private Session requireSession(Connection connection, String sessionId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT * FROM sessions WHERE session_id = ?")) {
            statement.setString(1, sessionId);
            try (ResultSet rs = statement.executeQuery()) {
                if (!rs.next()) {
                    throw new NotFoundException("session", sessionId);
                }
                return mapSession(rs);
            }
        }
    }

    private Session mapSession(ResultSet rs) throws SQLException {
        return new Session(
            rs.getString("session_id"),
            rs.getString("user_id"),
            rs.getString("agent_name"),
            Instant.ofEpochMilli(rs.getLong("created_at")),
            Instant.ofEpochMilli(rs.getLong("updated_at")),
            SessionStatus.fromValue(rs.getString("status")),
            codec.readMetadata(rs.getString("metadata"))
        );
    }
}
