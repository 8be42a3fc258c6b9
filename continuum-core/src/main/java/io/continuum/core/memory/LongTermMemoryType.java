package io.continuum.core.memory;

import io.continuum.core.error.ValidationException;
import java.util.Locale;

public enum LongTermMemoryType {
    FACT,
    PREFERENCE,
    SKILL,
    OTHER;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static LongTermMemoryType fromValue(String raw) {
        try {
            return valueOf(raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown long-term memory type: " + raw);
        }
    }
}
