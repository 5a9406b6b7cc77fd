package com.jdocs.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jdocs.tools.DocumentToolProvider;
import com.jdocs.tools.InMemoryDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class McpStdioServerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private InMemoryDocumentStore store;
    private McpStdioServer server;

    @BeforeEach
    void setUp() {
        store = InMemoryDocumentStore.withSampleDocuments();
        server = new McpStdioServer(new DocumentToolProvider(store), objectMapper, "docs");
    }

    private JsonNode request(int id, String method, String params) {
        String line = "{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"method\":\"" + method + "\""
                + (params != null ? ",\"params\":" + params : "") + "}";
        JsonNode response = server.handle(line);
        assertNotNull(response);
        assertEquals("2.0", response.get("jsonrpc").asText());
        assertEquals(id, response.get("id").asInt());
        return response;
    }

    @Test
    void initializeAdvertisesCapabilities() {
        JsonNode result = request(1, "initialize",
                "{\"protocolVersion\":\"2024-11-05\",\"clientInfo\":{\"name\":\"test\"}}").get("result");

        assertEquals("2024-11-05", result.get("protocolVersion").asText());
        assertEquals("docs", result.at("/serverInfo/name").asText());
        assertTrue(result.at("/capabilities/tools").isObject());
        assertTrue(result.at("/capabilities/prompts").isObject());
        assertTrue(result.at("/capabilities/resources").isObject());
    }

    @Test
    void notificationsGetNoResponse() {
        assertNull(server.handle("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}"));
    }

    @Test
    void toolsListCarriesSchemas() {
        JsonNode tools = request(2, "tools/list", null).at("/result/tools");

        assertEquals(2, tools.size());
        assertEquals("read_doc_contents", tools.get(0).get("name").asText());
        assertEquals("object", tools.get(0).at("/inputSchema/type").asText());
        assertEquals("edit_document", tools.get(1).get("name").asText());
    }

    @Test
    void toolsCallReturnsTextContent() {
        JsonNode result = request(3, "tools/call",
                "{\"name\":\"read_doc_contents\",\"arguments\":{\"doc_id\":\"report.pdf\"}}").get("result");

        assertEquals("The report details the state of a 20m condenser tower.", result.at("/content/0/text").asText());
        assertFalse(result.get("isError").asBoolean());
    }

    @Test
    void toolsCallEditsStore() {
        request(4, "tools/call",
                "{\"name\":\"edit_document\",\"arguments\":{\"doc_id\":\"plan.md\",\"old_str\":\"plan\",\"new_str\":\"roadmap\"}}");

        assertEquals("The roadmap outlines the steps for the project's implementation.",
                store.get("plan.md").orElseThrow());
    }

    @Test
    void toolFailureIsAnErrorResult() {
        JsonNode response = request(5, "tools/call",
                "{\"name\":\"read_doc_contents\",\"arguments\":{\"doc_id\":\"missing.md\"}}");

        assertNull(response.get("error"));
        assertTrue(response.at("/result/isError").asBoolean());
        assertEquals("Error executing tool read_doc_contents: Doc with id missing.md not found",
                response.at("/result/content/0/text").asText());
    }

    @Test
    void promptsListAndGet() {
        JsonNode prompts = request(6, "prompts/list", null).at("/result/prompts");
        assertEquals(3, prompts.size());
        assertEquals("doc_id", prompts.get(0).at("/arguments/0/name").asText());
        assertTrue(prompts.get(0).at("/arguments/0/required").asBoolean());

        JsonNode messages = request(7, "prompts/get",
                "{\"name\":\"summarize\",\"arguments\":{\"doc_id\":\"plan.md\"}}").at("/result/messages");
        assertEquals(1, messages.size());
        assertEquals("user", messages.get(0).get("role").asText());
        assertEquals("text", messages.get(0).at("/content/type").asText());
        assertTrue(messages.get(0).at("/content/text").asText().contains("The plan outlines"));
    }

    @Test
    void unknownPromptIsInvalidParams() {
        JsonNode response = request(8, "prompts/get", "{\"name\":\"nope\",\"arguments\":{\"doc_id\":\"plan.md\"}}");

        assertEquals(McpStdioServer.INVALID_PARAMS, response.at("/error/code").asInt());
        assertEquals("Unknown prompt: nope", response.at("/error/message").asText());
    }

    @Test
    void resourcesListAndRead() {
        JsonNode resources = request(9, "resources/list", null).at("/result/resources");
        assertEquals("docs://documents", resources.get(0).get("uri").asText());

        JsonNode contents = request(10, "resources/read", "{\"uri\":\"docs://documents/spec.txt\"}")
                .at("/result/contents");
        assertEquals("text/plain", contents.get(0).get("mimeType").asText());
        assertEquals("These specifications define the technical requirements for the equipment.",
                contents.get(0).get("text").asText());
    }

    @Test
    void missingParameterIsInvalidParams() {
        JsonNode response = request(11, "resources/read", "{}");

        assertEquals(McpStdioServer.INVALID_PARAMS, response.at("/error/code").asInt());
        assertTrue(response.at("/error/message").asText().contains("uri"));
    }

    @Test
    void unknownMethodIsReported() {
        JsonNode response = request(12, "sampling/createMessage", "{}");

        assertEquals(McpStdioServer.METHOD_NOT_FOUND, response.at("/error/code").asInt());
    }

    @Test
    void unparseableLineIsParseError() {
        JsonNode response = server.handle("{not json");

        assertEquals(McpStdioServer.PARSE_ERROR, response.at("/error/code").asInt());
        assertTrue(response.get("id").isNull());
    }

    @Test
    void serveAnswersEachRequestLine() throws Exception {
        String input = """
                {"jsonrpc":"2.0","id":1,"method":"ping"}
                {"jsonrpc":"2.0","method":"notifications/initialized"}

                {"jsonrpc":"2.0","id":2,"method":"tools/list"}
                """;
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        server.serve(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), out);

        String[] lines = out.toString(StandardCharsets.UTF_8).split("\n");
        assertEquals(2, lines.length);
        assertEquals(1, objectMapper.readTree(lines[0]).get("id").asInt());
        assertEquals(2, objectMapper.readTree(lines[1]).get("id").asInt());
    }
}
