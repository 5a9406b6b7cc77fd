package com.jdocs.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.jdocs.model.ConversationTurn;
import com.jdocs.model.PromptDescriptor;
import com.jdocs.model.ResourceContent;
import com.jdocs.model.ToolDescriptor;

import java.util.List;
import java.util.Map;

/**
 * Catalog of callable tools, prompts and resources, reached over a request/response channel.
 * Opened once per process and closed on shutdown.
 */
public interface ToolProvider extends AutoCloseable {

    List<ToolDescriptor> listTools() throws ToolExecutionException;

    /**
     * Run a tool.
     *
     * @return the provider's raw result payload, shaped like an MCP {@code tools/call} result
     */
    JsonNode callTool(String name, Map<String, Object> arguments) throws ToolExecutionException;

    List<PromptDescriptor> listPrompts() throws ToolExecutionException;

    /** Render a prompt template into the messages to send to the model. */
    List<ConversationTurn> getPrompt(String name, Map<String, String> arguments) throws ToolExecutionException;

    /** URIs of the concrete resources the provider can read. */
    List<String> listResources() throws ToolExecutionException;

    ResourceContent readResource(String uri) throws ToolExecutionException;

    @Override
    void close();
}
