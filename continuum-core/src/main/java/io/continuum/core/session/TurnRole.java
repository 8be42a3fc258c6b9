package io.continuum.core.session;

import io.continuum.core.error.ValidationException;
import java.util.Locale;

public enum TurnRole {
    USER("user"),
    ASSISTANT("assistant");

    private final String value;

    TurnRole(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public String label() {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    public static TurnRole fromValue(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (TurnRole role : values()) {
            if (role.value.equals(normalized)) {
                return role;
            }
        }
        throw new ValidationException("Unknown turn role: " + raw);
    }
}
