package com.jdocs.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.jdocs.llm.ContentText;

import java.util.Objects;

/**
 * One role-tagged turn of a conversation.
 * Content may be plain text, a single content block, or a sequence of blocks;
 * {@link #text()} reduces it to plain text.
 */
public record ConversationTurn(Role role, JsonNode content) {

    public ConversationTurn {
        Objects.requireNonNull(role, "role");
        content = content != null ? content : TextNode.valueOf("");
    }

    public static ConversationTurn system(String text) {
        return new ConversationTurn(Role.SYSTEM, TextNode.valueOf(text));
    }

    public static ConversationTurn user(String text) {
        return new ConversationTurn(Role.USER, TextNode.valueOf(text));
    }

    public static ConversationTurn assistant(String text) {
        return new ConversationTurn(Role.ASSISTANT, TextNode.valueOf(text));
    }

    public String text() {
        return ContentText.reduce(content);
    }
}
