package io.continuum.core.error;

import io.continuum.core.session.SessionStatus;

public final class InvalidTransitionException extends ContinuumException {
    private final SessionStatus from;
    private final SessionStatus to;

    public InvalidTransitionException(String sessionId, SessionStatus from, SessionStatus to) {
        super("Session " + sessionId + " cannot move from " + from.value() + " to " + to.value());
        this.from = from;
        this.to = to;
    }

    public SessionStatus from() {
        return from;
    }

    public SessionStatus to() {
        return to;
    }
}
