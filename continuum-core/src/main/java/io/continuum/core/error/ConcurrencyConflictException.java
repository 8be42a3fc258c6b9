package io.continuum.core.error;

/**
 * A write kept losing races after the store's internal retries. Transient.
 */
public final class ConcurrencyConflictException extends ContinuumException {

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
