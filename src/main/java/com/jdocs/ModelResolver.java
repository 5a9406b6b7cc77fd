package com.jdocs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jdocs.model.Model;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Resolves the completion model, discovering it from the endpoint when none is configured.
 */
public final class ModelResolver {

    private static final Logger log = LoggerFactory.getLogger(ModelResolver.class);

    private static final OkHttpClient HTTP = new OkHttpClient.Builder()
            .connectTimeout(5, TimeUnit.SECONDS)
            .readTimeout(10, TimeUnit.SECONDS)
            .build();
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ModelResolver() {}

    /**
     * List model ids reported by {@code GET {baseUrl}/models}; empty when the endpoint is down.
     */
    public static List<String> discoverModels(OkHttpClient http, String baseUrl, String apiKey) {
        List<String> models = new ArrayList<>();
        Request request = new Request.Builder()
                .url(baseUrl + "/models")
                .header("Authorization", "Bearer " + apiKey)
                .build();
        try (Response response = http.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) return models;
            JsonNode data = MAPPER.readTree(response.body().string()).get("data");
            if (data != null && data.isArray()) {
                for (JsonNode node : data) {
                    JsonNode id = node.get("id");
                    if (id != null) models.add(id.asText());
                }
            }
        } catch (IOException e) {
            log.debug("Model discovery at {} failed: {}", baseUrl, e.getMessage());
        }
        return models;
    }

    public static Model resolveModel(String modelId, String baseUrl, String apiKey, int timeoutSeconds) {
        return resolveModel(HTTP, modelId, baseUrl, apiKey, timeoutSeconds);
    }

    static Model resolveModel(OkHttpClient http, String modelId, String baseUrl, String apiKey,
                              int timeoutSeconds) {
        String id = modelId;
        if (id == null || id.isBlank()) {
            List<String> models = discoverModels(http, baseUrl, apiKey);
            if (models.isEmpty()) {
                throw new IllegalStateException(
                        "No model configured and none loaded at %s. Set %s or pass --model."
                                .formatted(baseUrl, Config.ENV_MODEL));
            }
            id = models.get(0);
            log.info("Using first model reported by {}: {}", baseUrl, id);
        }
        return new Model(id, baseUrl, apiKey, timeoutSeconds);
    }
}
