package com.jdocs.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jdocs.model.ConversationTurn;
import com.jdocs.model.PromptDescriptor;
import com.jdocs.model.ResourceContent;
import com.jdocs.model.Role;
import com.jdocs.model.ToolDescriptor;
import com.jdocs.tools.ToolExecutionException;
import com.jdocs.tools.ToolProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSON-RPC 2.0 client for an MCP (Model Context Protocol) server over stdio.
 *
 * <p>Requests are written as single lines to the server's stdin; a reader thread parses
 * stdout and completes the pending request with the matching id. Calls block until the
 * response arrives or the request timeout expires, so callers see plain request/response.
 *
 * <p>MCP protocol version: 2024-11-05
 */
public class McpStdioClient implements ToolProvider {

    private static final Logger log = LoggerFactory.getLogger(McpStdioClient.class);

    static final String JSONRPC_VERSION = "2.0";
    static final String MCP_PROTOCOL_VERSION = "2024-11-05";
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final String serverName;
    private final ObjectMapper objectMapper;
    private final InputStream in;
    private final BufferedWriter writer;
    private final Duration requestTimeout;

    private final AtomicInteger nextId = new AtomicInteger(1);
    private final Map<Integer, CompletableFuture<JsonNode>> pendingRequests = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private Process process;
    private Thread readerThread;

    public McpStdioClient(String serverName, InputStream in, OutputStream out, ObjectMapper objectMapper,
                          Duration requestTimeout) {
        this.serverName = serverName;
        this.in = in;
        this.writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Start the server process and complete the initialize handshake.
     * The process is destroyed if the handshake fails.
     */
    public static McpStdioClient launch(List<String> command, Map<String, String> env, ObjectMapper objectMapper)
            throws IOException, ToolExecutionException {
        String name = String.join(" ", command);
        log.info("[MCP:{}] Starting server", name);

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(false);
        if (env != null) {
            pb.environment().putAll(env);
        }
        Process process = pb.start();

        McpStdioClient client = new McpStdioClient(name, process.getInputStream(), process.getOutputStream(),
                objectMapper, DEFAULT_REQUEST_TIMEOUT);
        client.process = process;

        Thread stderrThread = new Thread(() -> client.drainStderr(process.getErrorStream()), "mcp-stderr");
        stderrThread.setDaemon(true);
        stderrThread.start();

        try {
            client.initialize();
        } catch (ToolExecutionException | RuntimeException e) {
            log.error("[MCP:{}] Initialization failed, cleaning up: {}", name, e.getMessage());
            client.close();
            throw e;
        }
        return client;
    }

    /**
     * Start reading responses and perform the {@code initialize} handshake.
     */
    public JsonNode initialize() throws ToolExecutionException {
        readerThread = new Thread(this::readLoop, "mcp-reader");
        readerThread.setDaemon(true);
        readerThread.start();

        JsonNode initResult = request("initialize", Map.of(
                "protocolVersion", MCP_PROTOCOL_VERSION,
                "capabilities", Map.of(),
                "clientInfo", Map.of("name", "jdocs", "version", "0.1.0")));
        log.info("[MCP:{}] Initialized: {}", serverName, initResult.path("serverInfo"));

        sendNotification("notifications/initialized");
        return initResult;
    }

    @Override
    public List<ToolDescriptor> listTools() throws ToolExecutionException {
        JsonNode result = request("tools/list", Map.of());
        List<ToolDescriptor> tools = new ArrayList<>();
        for (JsonNode toolNode : result.path("tools")) {
            String name = toolNode.path("name").asText(null);
            if (name == null) continue;

            Map<String, Object> inputSchema = null;
            if (toolNode.has("inputSchema")) {
                inputSchema = objectMapper.convertValue(toolNode.get("inputSchema"), MAP_TYPE_REF);
            }
            tools.add(new ToolDescriptor(name, toolNode.path("description").asText(""), inputSchema));
        }
        log.debug("[MCP:{}] Available tools: {}", serverName, tools.stream().map(ToolDescriptor::name).toList());
        return tools;
    }

    /**
     * @throws ToolExecutionException also when the server flags the result with {@code isError}
     */
    @Override
    public JsonNode callTool(String name, Map<String, Object> arguments) throws ToolExecutionException {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", name);
        params.put("arguments", arguments != null ? arguments : Map.of());

        JsonNode result = request("tools/call", params);
        if (result.path("isError").asBoolean(false)) {
            StringBuilder message = new StringBuilder();
            for (JsonNode item : result.path("content")) {
                if (item.has("text")) {
                    if (message.length() > 0) message.append('\n');
                    message.append(item.get("text").asText());
                }
            }
            throw new ToolExecutionException(message.length() > 0 ? message.toString() : "MCP tool error");
        }
        return result;
    }

    @Override
    public List<PromptDescriptor> listPrompts() throws ToolExecutionException {
        JsonNode result = request("prompts/list", Map.of());
        List<PromptDescriptor> prompts = new ArrayList<>();
        for (JsonNode promptNode : result.path("prompts")) {
            List<String> arguments = new ArrayList<>();
            for (JsonNode arg : promptNode.path("arguments")) {
                arguments.add(arg.path("name").asText());
            }
            prompts.add(new PromptDescriptor(promptNode.path("name").asText(),
                    promptNode.path("description").asText(""), arguments));
        }
        return prompts;
    }

    @Override
    public List<ConversationTurn> getPrompt(String name, Map<String, String> arguments)
            throws ToolExecutionException {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", name);
        params.put("arguments", arguments != null ? arguments : Map.of());

        JsonNode result = request("prompts/get", params);
        List<ConversationTurn> messages = new ArrayList<>();
        for (JsonNode message : result.path("messages")) {
            messages.add(new ConversationTurn(Role.fromWire(message.path("role").asText()), message.get("content")));
        }
        return messages;
    }

    @Override
    public List<String> listResources() throws ToolExecutionException {
        JsonNode result = request("resources/list", Map.of());
        List<String> uris = new ArrayList<>();
        for (JsonNode resource : result.path("resources")) {
            uris.add(resource.path("uri").asText());
        }
        return uris;
    }

    @Override
    public ResourceContent readResource(String uri) throws ToolExecutionException {
        JsonNode result = request("resources/read", Map.of("uri", uri));
        JsonNode first = result.path("contents").path(0);
        if (first.isMissingNode()) {
            throw new ToolExecutionException("Resource has no contents: " + uri);
        }
        return new ResourceContent(first.path("uri").asText(uri),
                first.path("mimeType").asText(ResourceContent.PLAIN_TEXT),
                first.path("text").asText(first.toString()));
    }

    /**
     * Send a request and wait for its result.
     */
    JsonNode request(String method, Map<String, Object> params) throws ToolExecutionException {
        try {
            JsonNode result = sendRequest(method, params).get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : objectMapper.createObjectNode();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolExecutionException("Interrupted while waiting for " + method, e);
        } catch (TimeoutException e) {
            throw new ToolExecutionException("MCP request %s timed out after %ds"
                    .formatted(method, requestTimeout.toSeconds()), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ToolExecutionException(cause.getMessage(), cause);
        }
    }

    CompletableFuture<JsonNode> sendRequest(String method, Map<String, Object> params) {
        int id = nextId.getAndIncrement();
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        future.whenComplete((result, ex) -> pendingRequests.remove(id));

        if (closed.get()) {
            future.completeExceptionally(new IOException("MCP client closed"));
            return future;
        }
        pendingRequests.put(id, future);

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", JSONRPC_VERSION);
        request.put("id", id);
        request.put("method", method);
        request.put("params", params);

        try {
            writeLine(objectMapper.writeValueAsString(request));
        } catch (IOException e) {
            pendingRequests.remove(id);
            future.completeExceptionally(e);
        }
        return future;
    }

    void sendNotification(String method) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("jsonrpc", JSONRPC_VERSION);
        notification.put("method", method);
        try {
            writeLine(objectMapper.writeValueAsString(notification));
        } catch (IOException e) {
            log.warn("[MCP:{}] Failed to send notification {}: {}", serverName, method, e.getMessage());
        }
    }

    private void writeLine(String json) throws IOException {
        log.debug("[MCP:{}] → {}", serverName, json);
        synchronized (writer) {
            writer.write(json);
            writer.newLine();
            writer.flush();
        }
    }

    private void readLoop() {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while (!closed.get() && (line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) continue;
                log.debug("[MCP:{}] ← {}", serverName, line);
                dispatchMessage(line);
            }
        } catch (IOException e) {
            if (!closed.get()) {
                log.warn("[MCP:{}] Reader thread error: {}", serverName, e.getMessage());
            }
        } finally {
            failPending(new IOException("MCP server connection closed"));
        }
    }

    private void dispatchMessage(String line) {
        JsonNode message;
        try {
            message = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.warn("[MCP:{}] Failed to parse message: {}", serverName, e.getOriginalMessage());
            return;
        }

        JsonNode idNode = message.get("id");
        if (idNode == null || !idNode.canConvertToInt()) {
            log.debug("[MCP:{}] Server notification: {}", serverName, message.path("method").asText("unknown"));
            return;
        }

        CompletableFuture<JsonNode> pending = pendingRequests.remove(idNode.asInt());
        if (pending == null) {
            log.warn("[MCP:{}] Received response for unknown id: {}", serverName, idNode);
            return;
        }
        JsonNode error = message.get("error");
        if (error != null && !error.isNull()) {
            pending.completeExceptionally(new McpException(
                    error.path("code").asInt(-1), error.path("message").asText("Unknown MCP error")));
        } else {
            pending.complete(message.get("result"));
        }
    }

    private void drainStderr(InputStream stderr) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stderr, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("[MCP:{}] stderr: {}", serverName, line);
            }
        } catch (IOException e) {
            log.debug("[MCP:{}] Stderr drain ended: {}", serverName, e.getMessage());
        }
    }

    private void failPending(Exception cause) {
        for (CompletableFuture<JsonNode> future : pendingRequests.values()) {
            future.completeExceptionally(cause);
        }
        pendingRequests.clear();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Fail pending requests, close the server's stdin and stop the process.
     * Safe to call more than once.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        log.info("[MCP:{}] Closing client", serverName);

        failPending(new IOException("MCP client closing"));

        try {
            writer.close();
        } catch (IOException e) {
            log.debug("[MCP:{}] Error closing writer: {}", serverName, e.getMessage());
        }

        if (process != null && process.isAlive()) {
            process.destroy();
            try {
                if (!process.waitFor(5, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
    }

    /**
     * JSON-RPC error returned by the server.
     */
    public static class McpException extends Exception {
        private static final long serialVersionUID = 1L;
        private final int code;

        public McpException(int code, String message) {
            super(message);
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }
}
