package com.jdocs;

import com.jdocs.model.Model;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelResolverTest {

    private MockWebServer server;
    private OkHttpClient http;
    private String baseUrl;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        http = new OkHttpClient();
        baseUrl = server.url("/v1").toString();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void discoversModelIds() throws Exception {
        server.enqueue(new MockResponse().setBody(
                "{\"object\":\"list\",\"data\":[{\"id\":\"mistral-7b\"},{\"id\":\"llama-3-8b\"}]}"));

        List<String> models = ModelResolver.discoverModels(http, baseUrl, "not-needed");

        assertEquals(List.of("mistral-7b", "llama-3-8b"), models);
        RecordedRequest request = server.takeRequest();
        assertEquals("/v1/models", request.getPath());
        assertEquals("Bearer not-needed", request.getHeader("Authorization"));
    }

    @Test
    void failedDiscoveryIsEmpty() {
        server.enqueue(new MockResponse().setResponseCode(500));

        assertTrue(ModelResolver.discoverModels(http, baseUrl, "k").isEmpty());
    }

    @Test
    void configuredModelSkipsDiscovery() {
        Model model = ModelResolver.resolveModel(http, "phi-3", baseUrl, "k", 30);

        assertEquals(new Model("phi-3", baseUrl, "k", 30), model);
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void firstDiscoveredModelIsUsed() {
        server.enqueue(new MockResponse().setBody("{\"data\":[{\"id\":\"mistral-7b\"},{\"id\":\"other\"}]}"));

        Model model = ModelResolver.resolveModel(http, null, baseUrl, "k", 300);

        assertEquals("mistral-7b", model.id());
    }

    @Test
    void noModelAnywhereFails() {
        server.enqueue(new MockResponse().setBody("{\"data\":[]}"));

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> ModelResolver.resolveModel(http, "", baseUrl, "k", 300));
        assertTrue(e.getMessage().contains(Config.ENV_MODEL));
    }
}
