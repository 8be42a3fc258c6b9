package io.continuum.core.session;

import io.continuum.core.error.ValidationException;
import java.util.Locale;

/**
 * Session lifecycle. Declaration order is the only legal direction of travel.
 */
public enum SessionStatus {
    ACTIVE("active"),
    COMPLETED("completed"),
    ARCHIVED("archived");

    private final String value;

    SessionStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean canMoveTo(SessionStatus next) {
        return next.ordinal() >= ordinal();
    }

    public static SessionStatus fromValue(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (SessionStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        throw new ValidationException("Unknown session status: " + raw);
    }
}
