package com.jdocs.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jdocs.model.ConversationTurn;
import com.jdocs.model.PromptDescriptor;
import com.jdocs.model.ResourceContent;
import com.jdocs.model.Role;
import com.jdocs.model.ToolDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * In-process tool provider serving the document tools, prompts and resources on top of
 * an injected {@link DocumentStore}.
 */
public class DocumentToolProvider implements ToolProvider {

    private static final Logger log = LoggerFactory.getLogger(DocumentToolProvider.class);

    public static final String DOCUMENTS_URI = "docs://documents";
    private static final String DOCUMENT_URI_PREFIX = DOCUMENTS_URI + "/";

    private final DocumentStore store;
    private final ObjectMapper mapper;
    private final List<DocumentTool> tools;

    public DocumentToolProvider(DocumentStore store) {
        this(store, new ObjectMapper());
    }

    public DocumentToolProvider(DocumentStore store, ObjectMapper mapper) {
        this.store = store;
        this.mapper = mapper;
        this.tools = List.of(new ReadDocumentTool(), new EditDocumentTool());
    }

    @Override
    public List<ToolDescriptor> listTools() {
        return tools.stream()
                .map(t -> new ToolDescriptor(t.name(), t.description(), t.parameterSchema()))
                .toList();
    }

    @Override
    public JsonNode callTool(String name, Map<String, Object> arguments) throws ToolExecutionException {
        DocumentTool tool = findTool(name);
        if (tool == null) {
            throw new ToolExecutionException("Unknown tool: " + name);
        }

        log.debug("Calling {} with {}", name, arguments);
        String text;
        try {
            text = tool.execute(mapper.valueToTree(arguments != null ? arguments : Map.of()), store);
        } catch (DocumentNotFoundException | IllegalArgumentException e) {
            throw new ToolExecutionException(e.getMessage(), e);
        }
        return textResult(text);
    }

    private JsonNode textResult(String text) {
        ObjectNode result = mapper.createObjectNode();
        ObjectNode block = result.putArray("content").addObject();
        block.put("type", "text");
        block.put("text", text);
        result.putObject("structuredContent").put("result", text);
        result.put("isError", false);
        return result;
    }

    @Override
    public List<PromptDescriptor> listPrompts() {
        List<PromptDescriptor> prompts = new ArrayList<>();
        for (DocumentPrompt prompt : DocumentPrompt.values()) {
            prompts.add(new PromptDescriptor(prompt.promptName(), prompt.description(), prompt.arguments()));
        }
        return prompts;
    }

    @Override
    public List<ConversationTurn> getPrompt(String name, Map<String, String> arguments)
            throws ToolExecutionException {
        DocumentPrompt prompt = DocumentPrompt.byName(name);
        if (prompt == null) {
            throw new ToolExecutionException("Unknown prompt: " + name);
        }
        String docId = arguments != null ? arguments.get(DocumentPrompt.DOC_ID) : null;
        if (docId == null) {
            throw new ToolExecutionException("Missing required argument: " + DocumentPrompt.DOC_ID);
        }
        String content = store.get(docId)
                .orElseThrow(() -> new ToolExecutionException("Doc with id %s not found".formatted(docId)));

        ObjectNode block = mapper.createObjectNode();
        block.put("type", "text");
        block.put("text", prompt.render(content));
        return List.of(new ConversationTurn(Role.USER, block));
    }

    @Override
    public List<String> listResources() {
        return List.of(DOCUMENTS_URI);
    }

    @Override
    public ResourceContent readResource(String uri) throws ToolExecutionException {
        if (DOCUMENTS_URI.equals(uri)) {
            try {
                return new ResourceContent(uri, ResourceContent.JSON, mapper.writeValueAsString(store.list()));
            } catch (JsonProcessingException e) {
                throw new ToolExecutionException("Could not encode document list", e);
            }
        }
        if (uri != null && uri.startsWith(DOCUMENT_URI_PREFIX)) {
            String docId = uri.substring(DOCUMENT_URI_PREFIX.length());
            String content = store.get(docId)
                    .orElseThrow(() -> new ToolExecutionException("Doc with id %s not found".formatted(docId)));
            return new ResourceContent(uri, ResourceContent.PLAIN_TEXT, content);
        }
        throw new ToolExecutionException("Unknown resource: " + uri);
    }

    private DocumentTool findTool(String name) {
        return tools.stream()
                .filter(t -> t.name().equals(name))
                .findFirst()
                .orElse(null);
    }

    @Override
    public void close() {
        // nothing to release
    }
}
