package com.jdocs.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jdocs.model.ConversationTurn;
import com.jdocs.model.Model;
import okhttp3.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Talks to an OpenAI-compatible chat-completions endpoint (LM Studio, Ollama, ...).
 * One blocking round trip per call, no retries.
 */
public class ModelGateway {

    private static final Logger log = LoggerFactory.getLogger(ModelGateway.class);

    private static final MediaType JSON = MediaType.parse("application/json");
    private static final Pattern REASONING_BLOCK =
            Pattern.compile("\\[THINK\\].*?\\[/THINK\\]|<think>.*?</think>", Pattern.DOTALL);

    private final Model model;
    private final OkHttpClient http;
    private final ObjectMapper mapper;

    public ModelGateway(Model model) {
        this(model, new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(model.requestTimeoutSeconds(), TimeUnit.SECONDS)
                .build(), new ObjectMapper());
    }

    public ModelGateway(Model model, OkHttpClient http, ObjectMapper mapper) {
        this.model = model;
        this.http = http;
        this.mapper = mapper;
    }

    public Model getModel() {
        return model;
    }

    public ModelReply chat(List<ConversationTurn> turns, String systemInstruction, double temperature)
            throws ModelGatewayException {
        return chat(turns, systemInstruction, temperature, List.of());
    }

    /**
     * Send the conversation, optionally preceded by a system turn, and return the first choice.
     *
     * @throws ModelGatewayException on connection errors, non-2xx responses or a reply without choices
     */
    public ModelReply chat(List<ConversationTurn> turns, String systemInstruction, double temperature,
                           List<String> stopSequences) throws ModelGatewayException {
        ObjectNode requestBody = buildRequest(turns, systemInstruction, temperature, stopSequences);

        String payload;
        try {
            payload = mapper.writeValueAsString(requestBody);
        } catch (IOException e) {
            throw new ModelGatewayException("Could not encode completion request", e);
        }

        Request request = new Request.Builder()
                .url(model.baseUrl() + "/chat/completions")
                .header("Authorization", "Bearer " + model.apiKey())
                .post(RequestBody.create(payload, JSON))
                .build();

        log.debug("POST {}/chat/completions ({} turns, temperature {})",
                model.baseUrl(), requestBody.get("messages").size(), temperature);

        String responseText;
        try (Response response = http.newCall(request).execute()) {
            ResponseBody body = response.body();
            responseText = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw new ModelGatewayException(
                        "LLM API error (HTTP %d): %s".formatted(response.code(), responseText), response.code());
            }
        } catch (ModelGatewayException e) {
            throw e;
        } catch (IOException e) {
            throw new ModelGatewayException("Could not reach LLM at " + model.baseUrl() + ": " + e.getMessage(), e);
        }

        return parseReply(responseText);
    }

    ObjectNode buildRequest(List<ConversationTurn> turns, String systemInstruction, double temperature,
                            List<String> stopSequences) {
        ObjectNode requestBody = mapper.createObjectNode();
        requestBody.put("model", model.id());

        ArrayNode messages = requestBody.putArray("messages");
        if (systemInstruction != null && !systemInstruction.isEmpty()) {
            ObjectNode sysMsg = messages.addObject();
            sysMsg.put("role", "system");
            sysMsg.put("content", systemInstruction);
        }
        for (ConversationTurn turn : turns) {
            ObjectNode msg = messages.addObject();
            msg.put("role", turn.role().wireName());
            msg.put("content", turn.text());
        }

        requestBody.put("temperature", temperature);
        if (stopSequences != null && !stopSequences.isEmpty()) {
            ArrayNode stop = requestBody.putArray("stop");
            stopSequences.forEach(stop::add);
        }
        return requestBody;
    }

    private ModelReply parseReply(String responseText) throws ModelGatewayException {
        JsonNode root;
        try {
            root = mapper.readTree(responseText);
        } catch (IOException e) {
            throw new ModelGatewayException("LLM returned a non-JSON response", e);
        }

        JsonNode choice = root == null ? null : root.path("choices").path(0);
        if (choice == null || choice.isMissingNode()) {
            throw new ModelGatewayException("LLM response has no choices: " + responseText, 200);
        }

        String text = ContentText.reduce(choice.path("message").path("content"));
        StopReason stopReason = StopReason.fromFinishReason(choice.path("finish_reason").asText("stop"));
        return new ModelReply(stripReasoning(text), stopReason);
    }

    /**
     * Remove every {@code [THINK]...[/THINK]} or {@code <think>...</think>} block and trim.
     */
    public static String stripReasoning(String text) {
        return REASONING_BLOCK.matcher(text).replaceAll("").trim();
    }
}
