package io.continuum.core.session;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable record of users, sessions and their append-only conversation logs.
 *
 * <p>Domain failures are unchecked ({@code ValidationException}, {@code NotFoundException},
 * {@code InvalidTransitionException}, {@code ConcurrencyConflictException}); backend failures are
 * reported as {@link IOException}.</p>
 */
public interface SessionStore {

    /**
     * Creates an active session with a fresh id. A non-null user is created on first sight.
     */
    Session createSession(String userId, String agentName, Map<String, Object> metadata) throws IOException;

    Session getSession(String sessionId) throws IOException;

    Optional<UserRecord> getUser(String userId) throws IOException;

    /**
     * Assigns the next turn number for the session atomically, writes the turn and bumps
     * {@code updatedAt}. Concurrent appends to one session never share a number.
     */
    ConversationTurn appendTurn(String sessionId, TurnRole role, String content, Map<String, Object> metadata)
        throws IOException;

    /**
     * Appends a user turn and the assistant turn answering it under one lock, so they receive consecutive
     * numbers N and N+1 even while other writers append to the same session.
     */
    TurnPair appendTurnPair(
        String sessionId,
        String userContent,
        Map<String, Object> userMetadata,
        String assistantContent,
        Map<String, Object> assistantMetadata
    ) throws IOException;

    /**
     * The newest {@code limit} turns, most recent first.
     */
    List<ConversationTurn> getHistory(String sessionId, int limit) throws IOException;

    /**
     * Like {@link #getHistory} but only turns numbered strictly below {@code beforeTurn}.
     */
    List<ConversationTurn> getHistoryBefore(String sessionId, int beforeTurn, int limit) throws IOException;

    default List<Session> listSessionsForUser(String userId) throws IOException {
        return listSessionsForUser(userId, null, 0);
    }

    /**
     * Sessions owned by the user, newest first. A null status means any; a limit below 1 means all.
     */
    List<Session> listSessionsForUser(String userId, SessionStatus status, int limit) throws IOException;

    /**
     * Moves the session forward along active, completed, archived. Re-applying the current status is a no-op.
     */
    Session setStatus(String sessionId, SessionStatus status) throws IOException;

    Session updateMetadata(String sessionId, Map<String, Object> metadata) throws IOException;
}
