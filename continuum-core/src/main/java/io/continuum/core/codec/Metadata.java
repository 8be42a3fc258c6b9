package io.continuum.core.codec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class Metadata {

    private Metadata() {
    }

    /**
     * Immutable, order-preserving copy. Unlike {@link Map#copyOf} it tolerates null values, which decoded
     * JSON metadata may carry.
     */
    public static Map<String, Object> copyOf(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
