package com.jdocs.dispatch;

import java.util.Map;

/**
 * Progress callbacks for a user turn. All methods default to no-ops.
 */
public interface TurnListener {

    TurnListener NONE = new TurnListener() {
    };

    default void onStateChange(DispatchState state) {
    }

    default void onToolCall(String toolName, Map<String, Object> arguments) {
    }

    default void onToolResult(String toolName, String resultText) {
    }
}
