package io.continuum.core.runner;

/**
 * {@code turnNumber} is the number of the assistant turn just written.
 */
public record SessionMetadata(String sessionId, int turnNumber) {
}
