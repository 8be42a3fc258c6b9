package io.continuum.core.error;

public final class Checks {

    private Checks() {
    }

    public static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(name + " must not be blank");
        }
        return value.trim();
    }

    public static int requirePositive(int value, String name) {
        if (value < 1) {
            throw new ValidationException(name + " must be >= 1");
        }
        return value;
    }

    public static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
