package com.jdocs.dispatch;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured intent extracted from exactly one model reply.
 */
public sealed interface Directive
        permits Directive.ToolCall, Directive.Answer, Directive.Malformed, Directive.Unrecognized {

    /** The model wants a tool run. Arguments keep the model's order. */
    record ToolCall(String name, Map<String, Object> arguments) implements Directive {
        public ToolCall {
            arguments = Collections.unmodifiableMap(
                    new LinkedHashMap<>(arguments != null ? arguments : Map.of()));
        }
    }

    /** The model answered the user directly. */
    record Answer(String text) implements Directive {
    }

    /** The reply did not contain parseable JSON. */
    record Malformed(String rawText, String candidate) implements Directive {
    }

    /** Valid JSON, but neither a tool call nor an answer. */
    record Unrecognized(String rawText, JsonNode value) implements Directive {
    }
}
