package io.continuum.core.provider;

/**
 * Turns an assembled prompt into response text. Implementations throw
 * {@link io.continuum.core.error.ModelInvocationException} on any failure and never return an error string as
 * content.
 */
public interface ModelInvoker {
    String name();

    String invoke(String prompt);
}
