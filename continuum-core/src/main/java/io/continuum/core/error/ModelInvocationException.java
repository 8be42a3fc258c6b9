package io.continuum.core.error;

/**
 * The external model call failed, timed out or was cancelled.
 */
public final class ModelInvocationException extends ContinuumException {

    public ModelInvocationException(String message) {
        super(message);
    }

    public ModelInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
