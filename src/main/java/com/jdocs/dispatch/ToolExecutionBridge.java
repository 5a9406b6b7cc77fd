package com.jdocs.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.jdocs.tools.ToolExecutionException;
import com.jdocs.tools.ToolProvider;

import java.util.Map;

/**
 * Runs a tool through the {@link ToolProvider} and reduces its result payload to text.
 * Provider failures propagate to the caller.
 */
public class ToolExecutionBridge {

    private final ToolProvider provider;

    public ToolExecutionBridge(ToolProvider provider) {
        this.provider = provider;
    }

    public String execute(String toolName, Map<String, Object> arguments) throws ToolExecutionException {
        return resultText(provider.callTool(toolName, arguments));
    }

    /**
     * Prefer {@code structuredContent.result}, then the first text content block, then the
     * raw content array, then the raw result.
     */
    static String resultText(JsonNode result) {
        if (result == null) {
            return "null";
        }

        JsonNode structured = result.get("structuredContent");
        if (structured != null && structured.isObject() && structured.has("result")) {
            JsonNode value = structured.get("result");
            return value.isValueNode() ? value.asText() : value.toString();
        }

        JsonNode content = result.get("content");
        if (content != null && content.isArray() && !content.isEmpty()) {
            for (JsonNode block : content) {
                if ("text".equals(block.path("type").asText()) && block.has("text")) {
                    return block.get("text").asText();
                }
            }
            return content.toString();
        }

        return result.toString();
    }
}
