package io.continuum.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * {@code backend} is {@code sqlite} or {@code memory}; the database paths are ignored for the latter.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(
    String backend,
    String sessionsDb,
    String memoryDb
) {
    public static final String SQLITE = "sqlite";
    public static final String MEMORY = "memory";

    public static StorageConfig defaults() {
        return new StorageConfig(
            SQLITE,
            "~/.continuum/data/sessions.db",
            "~/.continuum/data/memory.db"
        );
    }

    @JsonIgnore
    public boolean inMemory() {
        return MEMORY.equalsIgnoreCase(backend == null ? "" : backend.trim());
    }
}
