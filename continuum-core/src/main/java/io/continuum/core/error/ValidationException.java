package io.continuum.core.error;

/**
 * Malformed or out-of-range input. Never retried.
 */
public final class ValidationException extends ContinuumException {

    public ValidationException(String message) {
        super(message);
    }
}
