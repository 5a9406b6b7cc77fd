package com.jdocs.llm;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Reduces message content to plain text.
 *
 * <p>Content arrives as a bare string, a single block (JSON object) or an ordered
 * array of blocks. A block with a {@code "text"} field contributes that field; any
 * other block contributes its raw JSON so nothing is dropped. Blocks are joined with
 * newlines in their original order.
 */
public final class ContentText {

    private static final String TEXT_FIELD = "text";

    private ContentText() {}

    public static String reduce(JsonNode content) {
        if (content == null || content.isNull() || content.isMissingNode()) {
            return "";
        }
        if (content.isArray()) {
            List<String> parts = new ArrayList<>();
            for (JsonNode block : content) {
                parts.add(blockText(block));
            }
            return String.join("\n", parts);
        }
        return blockText(content);
    }

    private static String blockText(JsonNode block) {
        if (block.isObject()) {
            return block.has(TEXT_FIELD) ? scalarText(block.get(TEXT_FIELD)) : block.toString();
        }
        return scalarText(block);
    }

    private static String scalarText(JsonNode node) {
        if (node.isNull()) return "";
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
