package com.jdocs.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ContentTextTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void plainStringIsReturnedAsIs() {
        assertEquals("hello", ContentText.reduce(TextNode.valueOf("hello")));
    }

    @Test
    void singleBlockContributesItsTextField() throws Exception {
        assertEquals("from block",
                ContentText.reduce(objectMapper.readTree("{\"type\": \"text\", \"text\": \"from block\"}")));
    }

    @Test
    void blockWithoutTextIsKeptAsRawJson() throws Exception {
        assertEquals("{\"type\":\"image\",\"url\":\"x\"}",
                ContentText.reduce(objectMapper.readTree("{\"type\": \"image\", \"url\": \"x\"}")));
    }

    @Test
    void blocksAreJoinedWithNewlinesInOrder() throws Exception {
        String content = """
                [
                  {"type": "text", "text": "first"},
                  "second",
                  {"type": "document", "text": "third"},
                  {"type": "tool_result", "id": 7}
                ]
                """;

        assertEquals("first\nsecond\nthird\n{\"type\":\"tool_result\",\"id\":7}",
                ContentText.reduce(objectMapper.readTree(content)));
    }

    @Test
    void nullContentIsEmpty() {
        assertEquals("", ContentText.reduce(null));
    }
}
