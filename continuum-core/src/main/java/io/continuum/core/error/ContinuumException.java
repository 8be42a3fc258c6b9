package io.continuum.core.error;

/**
 * Root of the domain failures raised by the session and memory layer.
 * Backend I/O failures are reported separately as {@link java.io.IOException}.
 */
public class ContinuumException extends RuntimeException {

    public ContinuumException(String message) {
        super(message);
    }

    public ContinuumException(String message, Throwable cause) {
        super(message, cause);
    }
}
