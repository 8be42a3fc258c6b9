package io.continuum.core.session;

import java.util.Objects;

public record TurnPair(ConversationTurn user, ConversationTurn assistant) {
    public TurnPair {
        Objects.requireNonNull(user, "user must not be null");
        Objects.requireNonNull(assistant, "assistant must not be null");
    }
}
