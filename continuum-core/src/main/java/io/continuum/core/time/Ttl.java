package io.continuum.core.time;

import io.continuum.core.error.ValidationException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;

/**
 * Expiry arithmetic shared by both stores. A record is alive up to and including its expiry instant.
 */
public final class Ttl {
    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    private Ttl() {
    }

    public static Instant expiresAt(Instant now, Duration ttl) {
        if (ttl == null) {
            return null;
        }
        if (ttl.isNegative() || ttl.isZero()) {
            throw new ValidationException("ttl must be positive");
        }
        try {
            Instant expiresAt = now.plus(ttl);
            expiresAt.toEpochMilli();
            return expiresAt;
        } catch (ArithmeticException | DateTimeException e) {
            throw new ValidationException("ttl " + ttl + " reaches past the representable time range");
        }
    }

    public static Duration ofHours(double hours) {
        if (Double.isNaN(hours) || Double.isInfinite(hours) || hours <= 0) {
            throw new ValidationException("ttlHours must be > 0");
        }
        long millis = Math.max(1L, Math.round(hours * MILLIS_PER_HOUR));
        return Duration.ofMillis(millis);
    }

    public static boolean isExpired(Instant expiresAt, Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public static boolean isAlive(Instant expiresAt, Instant now) {
        return !isExpired(expiresAt, now);
    }
}
