package com.jdocs.model;

import java.util.Map;

/**
 * A tool advertised by the tool provider.
 */
public record ToolDescriptor(
        String name,
        String description,
        Map<String, Object> inputSchema
) {
    public ToolDescriptor {
        description = description != null ? description : "";
        inputSchema = inputSchema != null ? inputSchema : Map.of("type", "object", "properties", Map.of());
    }

    public ToolDescriptor(String name, String description) {
        this(name, description, null);
    }
}
