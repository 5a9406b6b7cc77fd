package com.jdocs.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jdocs.model.ConversationTurn;
import com.jdocs.model.PromptDescriptor;
import com.jdocs.model.ResourceContent;
import com.jdocs.model.ToolDescriptor;
import com.jdocs.tools.ToolExecutionException;
import com.jdocs.tools.ToolProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serves a {@link ToolProvider} as an MCP server over newline-delimited JSON-RPC 2.0.
 * Tool failures are reported as {@code isError} results, everything else that goes wrong
 * as a JSON-RPC error object.
 */
public class McpStdioServer {

    private static final Logger log = LoggerFactory.getLogger(McpStdioServer.class);

    static final int PARSE_ERROR = -32700;
    static final int METHOD_NOT_FOUND = -32601;
    static final int INVALID_PARAMS = -32602;
    static final int INTERNAL_ERROR = -32603;

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, String>> STRING_MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ToolProvider provider;
    private final ObjectMapper objectMapper;
    private final String serverName;

    public McpStdioServer(ToolProvider provider, ObjectMapper objectMapper, String serverName) {
        this.provider = provider;
        this.objectMapper = objectMapper;
        this.serverName = serverName;
    }

    /**
     * Handle requests until the input reaches end of stream.
     */
    public void serve(InputStream in, OutputStream out) throws IOException {
        log.info("[MCP:{}] Serving on stdio", serverName);
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));

        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) continue;
            log.debug("[MCP:{}] ← {}", serverName, line);

            JsonNode response = handle(line);
            if (response != null) {
                String json = objectMapper.writeValueAsString(response);
                log.debug("[MCP:{}] → {}", serverName, json);
                writer.write(json);
                writer.newLine();
                writer.flush();
            }
        }
        log.info("[MCP:{}] Input closed, stopping", serverName);
        writer.close();
    }

    /**
     * Handle one JSON-RPC line.
     *
     * @return the response, or null for notifications
     */
    JsonNode handle(String line) {
        JsonNode message;
        try {
            message = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            return error(null, PARSE_ERROR, "Parse error: " + e.getOriginalMessage());
        }

        JsonNode id = message.get("id");
        String method = message.path("method").asText("");
        if (id == null || id.isNull()) {
            log.debug("[MCP:{}] Notification: {}", serverName, method);
            return null;
        }

        JsonNode params = message.path("params");
        try {
            return success(id, switch (method) {
                case "initialize" -> initialize();
                case "ping" -> objectMapper.createObjectNode();
                case "tools/list" -> listTools();
                case "tools/call" -> callTool(params);
                case "prompts/list" -> listPrompts();
                case "prompts/get" -> getPrompt(params);
                case "resources/list" -> listResources();
                case "resources/read" -> readResource(params);
                default -> throw new RpcError(METHOD_NOT_FOUND, "Method not found: " + method);
            });
        } catch (RpcError e) {
            return error(id, e.code, e.getMessage());
        } catch (ToolExecutionException e) {
            return error(id, INVALID_PARAMS, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[MCP:{}] {} failed", serverName, method, e);
            return error(id, INTERNAL_ERROR, String.valueOf(e.getMessage()));
        }
    }

    private JsonNode initialize() {
        ObjectNode result = objectMapper.createObjectNode();
        result.put("protocolVersion", McpStdioClient.MCP_PROTOCOL_VERSION);
        ObjectNode capabilities = result.putObject("capabilities");
        capabilities.putObject("tools");
        capabilities.putObject("prompts");
        capabilities.putObject("resources");
        ObjectNode info = result.putObject("serverInfo");
        info.put("name", serverName);
        info.put("version", "0.1.0");
        return result;
    }

    private JsonNode listTools() throws ToolExecutionException {
        ObjectNode result = objectMapper.createObjectNode();
        ArrayNode tools = result.putArray("tools");
        for (ToolDescriptor tool : provider.listTools()) {
            ObjectNode node = tools.addObject();
            node.put("name", tool.name());
            node.put("description", tool.description());
            node.set("inputSchema", objectMapper.valueToTree(tool.inputSchema()));
        }
        return result;
    }

    private JsonNode callTool(JsonNode params) {
        String name = requireText(params, "name");
        Map<String, Object> arguments = params.path("arguments").isObject()
                ? objectMapper.convertValue(params.get("arguments"), MAP_TYPE_REF)
                : Map.of();
        try {
            return provider.callTool(name, arguments);
        } catch (ToolExecutionException e) {
            log.debug("[MCP:{}] Tool {} failed: {}", serverName, name, e.getMessage());
            ObjectNode result = objectMapper.createObjectNode();
            ObjectNode block = result.putArray("content").addObject();
            block.put("type", "text");
            block.put("text", "Error executing tool %s: %s".formatted(name, e.getMessage()));
            result.put("isError", true);
            return result;
        }
    }

    private JsonNode listPrompts() throws ToolExecutionException {
        ObjectNode result = objectMapper.createObjectNode();
        ArrayNode prompts = result.putArray("prompts");
        for (PromptDescriptor prompt : provider.listPrompts()) {
            ObjectNode node = prompts.addObject();
            node.put("name", prompt.name());
            node.put("description", prompt.description());
            ArrayNode args = node.putArray("arguments");
            for (String arg : prompt.arguments()) {
                args.addObject().put("name", arg).put("required", true);
            }
        }
        return result;
    }

    private JsonNode getPrompt(JsonNode params) throws ToolExecutionException {
        String name = requireText(params, "name");
        Map<String, String> arguments = params.path("arguments").isObject()
                ? objectMapper.convertValue(params.get("arguments"), STRING_MAP_TYPE_REF)
                : new LinkedHashMap<>();

        ObjectNode result = objectMapper.createObjectNode();
        ArrayNode messages = result.putArray("messages");
        for (ConversationTurn turn : provider.getPrompt(name, arguments)) {
            ObjectNode node = messages.addObject();
            node.put("role", turn.role().wireName());
            if (turn.content().isObject()) {
                node.set("content", turn.content());
            } else {
                node.putObject("content").put("type", "text").put("text", turn.text());
            }
        }
        return result;
    }

    private JsonNode listResources() throws ToolExecutionException {
        ObjectNode result = objectMapper.createObjectNode();
        ArrayNode resources = result.putArray("resources");
        for (String uri : provider.listResources()) {
            resources.addObject().put("uri", uri).put("name", uri);
        }
        return result;
    }

    private JsonNode readResource(JsonNode params) throws ToolExecutionException {
        ResourceContent content = provider.readResource(requireText(params, "uri"));
        ObjectNode result = objectMapper.createObjectNode();
        result.putArray("contents").addObject()
                .put("uri", content.uri())
                .put("mimeType", content.mimeType())
                .put("text", content.text());
        return result;
    }

    private static String requireText(JsonNode params, String field) {
        JsonNode value = params.get(field);
        if (value == null || !value.isTextual()) {
            throw new RpcError(INVALID_PARAMS, "Missing required parameter: " + field);
        }
        return value.asText();
    }

    private ObjectNode success(JsonNode id, JsonNode result) {
        ObjectNode response = objectMapper.createObjectNode();
        response.put("jsonrpc", McpStdioClient.JSONRPC_VERSION);
        response.set("id", id);
        response.set("result", result);
        return response;
    }

    private ObjectNode error(JsonNode id, int code, String message) {
        ObjectNode response = objectMapper.createObjectNode();
        response.put("jsonrpc", McpStdioClient.JSONRPC_VERSION);
        response.set("id", id);
        response.putObject("error").put("code", code).put("message", message);
        return response;
    }

    private static class RpcError extends RuntimeException {
        private static final long serialVersionUID = 1L;
        private final int code;

        RpcError(int code, String message) {
            super(message);
            this.code = code;
        }
    }
}
