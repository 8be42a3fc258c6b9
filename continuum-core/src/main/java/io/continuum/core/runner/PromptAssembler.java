package io.continuum.core.runner;

import io.continuum.core.codec.PayloadCodec;
import io.continuum.core.memory.MemoryRecord;
import io.continuum.core.session.ConversationTurn;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders the context snapshot and the caller's prompt into one block of text. Section order is fixed:
 * history, long-term memories, short-term memories, additional context, then the request. Empty sections are
 * left out.
 */
public final class PromptAssembler {
    static final String HISTORY_HEADER = "=== Previous Conversation ===";
    static final String LONG_TERM_HEADER = "=== Relevant Context ===";
    static final String SHORT_TERM_HEADER = "=== Recent Session Context ===";
    static final String ADDITIONAL_HEADER = "=== Additional Context ===";
    static final String REQUEST_HEADER = "=== Current Request ===";

    private final PayloadCodec codec;

    public PromptAssembler(PayloadCodec codec) {
        this.codec = codec;
    }

    public String build(ContextSnapshot context, Map<String, Object> additionalContext, String prompt) {
        StringBuilder out = new StringBuilder();

        if (!context.history().isEmpty()) {
            out.append(HISTORY_HEADER).append('\n');
            for (ConversationTurn turn : context.history()) {
                out.append(turn.role().label()).append(": ").append(turn.content()).append('\n');
            }
            out.append('\n');
        }

        appendMemories(out, LONG_TERM_HEADER, context.longTerm());
        appendMemories(out, SHORT_TERM_HEADER, context.shortTerm());

        if (additionalContext != null && !additionalContext.isEmpty()) {
            out.append(ADDITIONAL_HEADER).append('\n');
            // sorted so identical state yields an identical prompt
            for (Map.Entry<String, Object> entry : new TreeMap<>(additionalContext).entrySet()) {
                out.append("- ").append(entry.getKey()).append(": ").append(codec.encode(entry.getValue())).append('\n');
            }
            out.append('\n');
        }

        out.append(REQUEST_HEADER).append('\n');
        out.append(prompt);
        return out.toString();
    }

    private void appendMemories(StringBuilder out, String header, List<? extends MemoryRecord> memories) {
        if (memories.isEmpty()) {
            return;
        }
        out.append(header).append('\n');
        for (MemoryRecord memory : memories) {
            out.append("- ").append(memory.key()).append(": ").append(memory.value()).append('\n');
        }
        out.append('\n');
    }
}
