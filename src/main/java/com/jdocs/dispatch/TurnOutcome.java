package com.jdocs.dispatch;

/**
 * What one user turn produced.
 *
 * @param kind     how the turn ended
 * @param text     text to show the user: the answer, the raw reply, or the failure detail
 * @param toolName tool involved in the turn, or null when none was requested
 */
public record TurnOutcome(Kind kind, String text, String toolName) {

    public enum Kind {
        /** The model answered directly. */
        ANSWER,
        /** A tool ran and its result was turned into an answer. */
        SYNTHESIZED,
        /** The reply held no parseable JSON. */
        MALFORMED,
        /** The reply was JSON without "tool" or "answer". */
        UNRECOGNIZED,
        TOOL_FAILED,
        MODEL_UNAVAILABLE
    }

    public boolean isFailure() {
        return kind == Kind.TOOL_FAILED || kind == Kind.MODEL_UNAVAILABLE;
    }
}
