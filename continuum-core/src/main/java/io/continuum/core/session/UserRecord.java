package io.continuum.core.session;

import io.continuum.core.codec.Metadata;
import java.time.Instant;
import java.util.Map;

public record UserRecord(String userId, Instant createdAt, Map<String, Object> metadata) {
    public UserRecord {
        metadata = Metadata.copyOf(metadata);
    }
}
