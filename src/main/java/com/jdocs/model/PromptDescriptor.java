package com.jdocs.model;

import java.util.List;

/**
 * A prompt template advertised by the tool provider, with the names of its arguments.
 */
public record PromptDescriptor(
        String name,
        String description,
        List<String> arguments
) {
    public PromptDescriptor {
        description = description != null ? description : "";
        arguments = arguments != null ? List.copyOf(arguments) : List.of();
    }
}
