package io.continuum.core.runner;

import io.continuum.core.memory.LongTermMemory;
import io.continuum.core.memory.ShortTermMemory;
import io.continuum.core.session.ConversationTurn;
import java.util.List;

/**
 * What a run injects ahead of the prompt. {@code history} is oldest first, {@code longTerm} most important
 * first and {@code shortTerm} newest first.
 */
public record ContextSnapshot(
    List<ConversationTurn> history,
    List<LongTermMemory> longTerm,
    List<ShortTermMemory> shortTerm
) {
    public ContextSnapshot {
        history = history == null ? List.of() : List.copyOf(history);
        longTerm = longTerm == null ? List.of() : List.copyOf(longTerm);
        shortTerm = shortTerm == null ? List.of() : List.copyOf(shortTerm);
    }

    public static ContextSnapshot empty() {
        return new ContextSnapshot(List.of(), List.of(), List.of());
    }
}
