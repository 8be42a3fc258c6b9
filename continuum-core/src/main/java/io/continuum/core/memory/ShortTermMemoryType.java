package io.continuum.core.memory;

import io.continuum.core.error.ValidationException;
import java.util.Locale;

public enum ShortTermMemoryType {
    CONTEXT,
    EVENT,
    STATE,
    OTHER;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ShortTermMemoryType fromValue(String raw) {
        try {
            return valueOf(raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown short-term memory type: " + raw);
        }
    }
}
