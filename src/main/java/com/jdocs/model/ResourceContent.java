package com.jdocs.model;

/**
 * Text contents of a resource read from the tool provider.
 */
public record ResourceContent(
        String uri,
        String mimeType,
        String text
) {
    public static final String JSON = "application/json";
    public static final String PLAIN_TEXT = "text/plain";

    public boolean isJson() {
        return JSON.equals(mimeType);
    }
}
