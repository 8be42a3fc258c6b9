package io.continuum.core.memory;

public record AssociatedMemory(MemoryRecord memory, String associationType, double strength) {
}
