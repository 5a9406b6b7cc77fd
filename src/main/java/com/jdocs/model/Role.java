package com.jdocs.model;

import java.util.Locale;

/**
 * Speaker of a conversation turn, serialized in lower case on the wire.
 */
public enum Role {
    SYSTEM,
    USER,
    ASSISTANT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Parse a wire role, treating anything unknown as a user turn. */
    public static Role fromWire(String value) {
        if (value == null) return USER;
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "system" -> SYSTEM;
            case "assistant" -> ASSISTANT;
            default -> USER;
        };
    }
}
