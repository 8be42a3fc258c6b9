package io.continuum.core.memory;

import java.time.Instant;

/**
 * Advisory link between two memories of either kind. Endpoints are stored in canonical order so the pair is
 * unordered; an endpoint may no longer exist.
 */
public record MemoryAssociation(
    String memoryId1,
    String memoryId2,
    String associationType,
    double strength,
    Instant createdAt
) {

    public boolean touches(String memoryId) {
        return memoryId1.equals(memoryId) || memoryId2.equals(memoryId);
    }

    public String otherEnd(String memoryId) {
        return memoryId1.equals(memoryId) ? memoryId2 : memoryId1;
    }
}
