package com.jdocs.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * A tool operating on the {@link DocumentStore}.
 */
public interface DocumentTool {

    /** Tool name the model uses in a directive. */
    String name();

    /** Human-readable description for the tool catalog. */
    String description();

    /**
     * JSON schema for the tool parameters, published as the MCP {@code inputSchema}.
     */
    Map<String, Object> parameterSchema();

    /**
     * Execute the tool.
     *
     * @param args  arguments from the model, already normalized to canonical names
     * @param store documents to read or edit
     * @return tool result as a string
     * @throws DocumentNotFoundException when the document id is unknown
     * @throws IllegalArgumentException  when a required argument is missing
     */
    String execute(JsonNode args, DocumentStore store);

    static String requireText(JsonNode args, String field) {
        JsonNode value = args.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Missing required argument: " + field);
        }
        return value.asText();
    }
}
