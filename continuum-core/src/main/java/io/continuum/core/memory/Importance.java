package io.continuum.core.memory;

import io.continuum.core.error.ValidationException;

final class Importance {

    private Importance() {
    }

    static double clamp(double importance) {
        if (Double.isNaN(importance)) {
            throw new ValidationException("importance must be a number");
        }
        return Math.max(0.0, Math.min(1.0, importance));
    }

    static double requireStrength(double strength) {
        if (Double.isNaN(strength) || strength < 0.0 || strength > 1.0) {
            throw new ValidationException("strength must be within [0, 1]");
        }
        return strength;
    }
}
