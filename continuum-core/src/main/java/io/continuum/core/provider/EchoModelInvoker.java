package io.continuum.core.provider;

public final class EchoModelInvoker implements ModelInvoker {
    private final String name;

    public EchoModelInvoker(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String invoke(String prompt) {
        return "[" + name + "] " + lastLine(prompt == null ? "" : prompt);
    }

    private static String lastLine(String prompt) {
        String trimmed = prompt.strip();
        int newline = trimmed.lastIndexOf('\n');
        return newline < 0 ? trimmed : trimmed.substring(newline + 1);
    }
}
