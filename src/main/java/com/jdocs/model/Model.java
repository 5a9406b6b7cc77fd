package com.jdocs.model;

/**
 * Represents the completion model and how to reach it.
 */
public record Model(
        String id,
        String baseUrl,
        String apiKey,
        int requestTimeoutSeconds
) {
    public static final String NO_API_KEY = "not-needed";
    public static final int DEFAULT_TIMEOUT_SECONDS = 300;

    public Model(String id, String baseUrl) {
        this(id, baseUrl, NO_API_KEY, DEFAULT_TIMEOUT_SECONDS);
    }
}
