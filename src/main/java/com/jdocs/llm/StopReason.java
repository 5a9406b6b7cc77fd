package com.jdocs.llm;

import java.util.Set;

/**
 * Canonical stop reason of a completion. Informational only; the gateway never
 * performs native tool calling.
 */
public enum StopReason {
    TOOL_USE("tool_use"),
    END("end");

    private static final Set<String> TOOL_FINISH_REASONS = Set.of("tool_calls", "function_call");

    private final String wireName;

    StopReason(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static StopReason fromFinishReason(String finishReason) {
        return finishReason != null && TOOL_FINISH_REASONS.contains(finishReason) ? TOOL_USE : END;
    }
}
