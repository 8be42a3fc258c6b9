package io.continuum.core.session;

import io.continuum.core.error.Checks;
import io.continuum.core.error.InvalidTransitionException;
import io.continuum.core.error.NotFoundException;
import io.continuum.core.error.ValidationException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local session store. Each session is guarded by its own monitor, so appends to different sessions
 * never contend with each other.
 */
public final class InMemorySessionStore implements SessionStore {
    private static final Logger LOG = LoggerFactory.getLogger(InMemorySessionStore.class);

    private final Map<String, SessionLog> sessions = new ConcurrentHashMap<>();
    private final Map<String, UserRecord> users = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySessionStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Session createSession(String userId, String agentName, Map<String, Object> metadata) {
        String agent = Checks.requireText(agentName, "agentName");
        String owner = Checks.blankToNull(userId);
        Instant now = clock.instant();
        if (owner != null) {
            users.putIfAbsent(owner, new UserRecord(owner, now, Map.of()));
        }
        Session session = new Session(UUID.randomUUID().toString(), owner, agent, now, now, SessionStatus.ACTIVE, metadata);
        sessions.put(session.sessionId(), new SessionLog(session));
        LOG.info("Session created: session_id={}, user_id={}, agent={}", session.sessionId(), owner, agent);
        return session;
    }

    @Override
    public Session getSession(String sessionId) {
        return log(sessionId).snapshot();
    }

    @Override
    public Optional<UserRecord> getUser(String userId) {
        return Optional.ofNullable(users.get(Checks.requireText(userId, "userId")));
    }

    @Override
    public ConversationTurn appendTurn(String sessionId, TurnRole role, String content, Map<String, Object> metadata) {
        if (role == null) {
            throw new ValidationException("role must not be null");
        }
        SessionLog log = log(sessionId);
        ConversationTurn turn;
        synchronized (log) {
            Instant now = clock.instant();
            turn = new ConversationTurn(log.session.sessionId(), log.turns.size() + 1, role, content, now, metadata);
            log.turns.add(turn);
            if (now.isAfter(log.session.updatedAt())) {
                log.session = log.session.touchedAt(now);
            }
        }
        LOG.debug("Turn appended: session_id={}, turn={}, role={}", turn.sessionId(), turn.turnNumber(), role.value());
        return turn;
    }

    @Override
    public TurnPair appendTurnPair(
        String sessionId,
        String userContent,
        Map<String, Object> userMetadata,
        String assistantContent,
        Map<String, Object> assistantMetadata
    ) {
        SessionLog log = log(sessionId);
        TurnPair pair;
        synchronized (log) {
            Instant now = clock.instant();
            String id = log.session.sessionId();
            int next = log.turns.size() + 1;
            pair = new TurnPair(
                new ConversationTurn(id, next, TurnRole.USER, userContent, now, userMetadata),
                new ConversationTurn(id, next + 1, TurnRole.ASSISTANT, assistantContent, now, assistantMetadata)
            );
            log.turns.add(pair.user());
            log.turns.add(pair.assistant());
            if (now.isAfter(log.session.updatedAt())) {
                log.session = log.session.touchedAt(now);
            }
        }
        LOG.debug("Turn pair appended: session_id={}, turns={}-{}", sessionId, pair.user().turnNumber(), pair.assistant().turnNumber());
        return pair;
    }

    @Override
    public List<ConversationTurn> getHistory(String sessionId, int limit) {
        return getHistoryBefore(sessionId, Integer.MAX_VALUE, limit);
    }

    @Override
    public List<ConversationTurn> getHistoryBefore(String sessionId, int beforeTurn, int limit) {
        int max = Checks.requirePositive(limit, "limit");
        SessionLog log = log(sessionId);
        List<ConversationTurn> copy;
        synchronized (log) {
            copy = new ArrayList<>(log.turns);
        }
        List<ConversationTurn> newestFirst = new ArrayList<>();
        for (int i = copy.size() - 1; i >= 0 && newestFirst.size() < max; i--) {
            ConversationTurn turn = copy.get(i);
            if (turn.turnNumber() < beforeTurn) {
                newestFirst.add(turn);
            }
        }
        return List.copyOf(newestFirst);
    }

    @Override
    public List<Session> listSessionsForUser(String userId, SessionStatus status, int limit) {
        String owner = Checks.requireText(userId, "userId");
        Stream<Session> matching = sessions.values().stream()
            .map(SessionLog::snapshot)
            .filter(session -> owner.equals(session.userId()))
            .filter(session -> status == null || session.status() == status)
            .sorted(Comparator.comparing(Session::createdAt).reversed().thenComparing(Session::sessionId));
        if (limit > 0) {
            matching = matching.limit(limit);
        }
        return matching.toList();
    }

    @Override
    public Session setStatus(String sessionId, SessionStatus status) {
        if (status == null) {
            throw new ValidationException("status must not be null");
        }
        SessionLog log = log(sessionId);
        Session updated;
        synchronized (log) {
            Session current = log.session;
            if (!current.status().canMoveTo(status)) {
                throw new InvalidTransitionException(current.sessionId(), current.status(), status);
            }
            if (current.status() != status) {
                log.session = current.withStatus(status, latest(current));
            }
            updated = log.session;
        }
        LOG.info("Session status: session_id={}, status={}", updated.sessionId(), updated.status().value());
        return updated;
    }

    @Override
    public Session updateMetadata(String sessionId, Map<String, Object> metadata) {
        SessionLog log = log(sessionId);
        synchronized (log) {
            log.session = log.session.withMetadata(metadata, latest(log.session));
            return log.session;
        }
    }

    private Instant latest(Session session) {
        Instant now = clock.instant();
        return now.isBefore(session.updatedAt()) ? session.updatedAt() : now;
    }

    private SessionLog log(String sessionId) {
        String id = Checks.requireText(sessionId, "sessionId");
        SessionLog log = sessions.get(id);
        if (log == null) {
            throw new NotFoundException("session", id);
        }
        return log;
    }

    private static final class SessionLog {
        private Session session;
        private final List<ConversationTurn> turns = new ArrayList<>();

        private SessionLog(Session session) {
            this.session = session;
        }

        private synchronized Session snapshot() {
            return session;
        }
    }
}
