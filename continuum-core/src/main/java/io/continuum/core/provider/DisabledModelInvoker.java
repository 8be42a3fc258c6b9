package io.continuum.core.provider;

import io.continuum.core.error.ModelInvocationException;

/**
 * Invoker placeholder used when no model is configured. Every call fails.
 */
public final class DisabledModelInvoker implements ModelInvoker {
    private final String name;
    private final String reason;

    public DisabledModelInvoker(String name, String reason) {
        this.name = name;
        this.reason = reason == null || reason.isBlank() ? "model is disabled" : reason;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String invoke(String prompt) {
        throw new ModelInvocationException("Model " + name + " is not configured (" + reason + ")");
    }
}
