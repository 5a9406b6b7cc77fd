package com.jdocs.llm;

import com.jdocs.model.ConversationTurn;

/**
 * Canonical assistant message returned by the {@link ModelGateway}: plain text with
 * reasoning markup removed, plus the mapped stop reason.
 */
public record ModelReply(String text, StopReason stopReason) {

    public ConversationTurn asTurn() {
        return ConversationTurn.assistant(text);
    }
}
