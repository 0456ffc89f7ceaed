package com.pagepilot.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagepilot.models.AgentConfig;
import com.pagepilot.models.Observation;
import com.pagepilot.support.FakeClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpClient;

import static org.junit.jupiter.api.Assertions.*;

class LiteLlmChatProviderTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private RecordingServer server;
    private LiteLlmChatProvider provider;
    private FakeClock clock;

    @BeforeEach
    void setUp() throws IOException {
        server = new RecordingServer();
        provider = new LiteLlmChatProvider(mapper, HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build());
        clock = new FakeClock();
        provider.useClock(clock);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private AgentConfig config() {
        AgentConfig config = AgentConfig.defaults();
        config.setApiBaseUrl(server.baseUrl() + "/v1/");
        config.setApiKeyLiteLlm("sk-test");
        return config;
    }

    @Test
    void postsChatCompletionWithScreenshotParts() throws Exception {
        server.respond(200, "{\"choices\":[{\"message\":{\"content\":\"  {\\\"action\\\":{\\\"type\\\":\\\"finish\\\"}}  \"}}]}");
        Observation observation = Observation.builder()
            .url("https://example.com/")
            .screenshot("data:image/png;base64,AAAA", "abc")
            .build();

        String content = provider.chat("prompt", "system", observation, config());

        assertEquals("{\"action\":{\"type\":\"finish\"}}", content);
        assertEquals("/v1/chat/completions", server.getLastRawPath());
        assertEquals("Bearer sk-test", server.getLastHeader("Authorization"));

        JsonNode sent = mapper.readTree(server.getLastBody());
        assertEquals("gemini/gemini-1.5-pro", sent.path("model").asText());
        assertEquals(0.2, sent.path("temperature").asDouble(), 1e-9);
        assertEquals(900, sent.path("max_tokens").asInt());
        assertEquals("system", sent.path("messages").path(0).path("role").asText());
        assertEquals("system", sent.path("messages").path(0).path("content").asText());
        JsonNode userContent = sent.path("messages").path(1).path("content");
        assertTrue(userContent.isArray());
        assertEquals("prompt", userContent.path(0).path("text").asText());
        assertEquals("image_url", userContent.path(1).path("type").asText());
        assertEquals("data:image/png;base64,AAAA", userContent.path(1).path("image_url").path("url").asText());
    }

    @Test
    void sendsPlainTextWhenScreenshotsAreDisabled() throws Exception {
        server.respond(200, "{\"choices\":[{\"message\":{\"content\":\"ok\"}}]}");
        AgentConfig config = config();
        config.setIncludeScreenshotsInPrompt(false);
        config.setApiKeyLiteLlm("");
        Observation observation = Observation.builder().screenshot("data:image/png;base64,AAAA", "abc").build();

        provider.chat("prompt", "system", observation, config);

        JsonNode sent = mapper.readTree(server.getLastBody());
        assertEquals("prompt", sent.path("messages").path(1).path("content").asText());
        assertNull(server.getLastHeader("Authorization"));
    }

    @Test
    void joinsArrayContentParts() throws Exception {
        JsonNode response = mapper.readTree("{\"choices\":[{\"message\":{\"content\":[{\"type\":\"text\",\"text\":\"a\"},{\"type\":\"text\",\"text\":\"b\"}]}}]}");
        assertEquals("a\nb", provider.extractContent(response));
        assertEquals("", provider.extractContent(mapper.createObjectNode()));
    }

    @Test
    void reportsHttpFailureWithLabelStatusAndBody() {
        server.respond(401, "{\"error\":\"bad key\"}");
        AgentConfig config = config();
        config.setTransportRetries(2);

        IOException error = assertThrows(IOException.class,
            () -> provider.chat("prompt", "system", Observation.builder().build(), config));

        assertEquals("LiteLLM request failed (401): {\"error\":\"bad key\"}", error.getMessage());
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void truncatesLongErrorBodies() {
        server.respond(400, "x".repeat(1000));

        IOException error = assertThrows(IOException.class,
            () -> provider.chat("prompt", "system", Observation.builder().build(), config()));

        assertEquals("LiteLLM request failed (400): ".length() + 300, error.getMessage().length());
    }

    @Test
    void retriesServerErrorsWhenConfigured() throws Exception {
        server.respond(503, "busy").respond(200, "{\"choices\":[{\"message\":{\"content\":\"done\"}}]}");
        AgentConfig config = config();
        config.setTransportRetries(1);

        assertEquals("done", provider.chat("prompt", "system", Observation.builder().build(), config));
        assertEquals(2, server.getRequestCount());
        assertEquals(1, clock.getSleeps().size());
        long backoff = clock.getSleeps().get(0);
        assertTrue(backoff >= 350 && backoff < 570, "backoff was " + backoff);
    }

    @Test
    void stopsRetryingOnceCallerGivesUp() {
        server.respond(503, "busy").respond(200, "{\"choices\":[{\"message\":{\"content\":\"done\"}}]}");
        AgentConfig config = config();
        config.setTransportRetries(3);

        IOException error = assertThrows(IOException.class,
            () -> provider.chat("prompt", "system", Observation.builder().build(), config, () -> false));

        assertTrue(error.getMessage().contains("(503)"));
        assertEquals(1, server.getRequestCount());
        assertTrue(clock.getSleeps().isEmpty());
    }

    @Test
    void abandonsRetryWhenStoppedDuringBackoff() {
        server.respond(503, "busy").respond(200, "{\"choices\":[{\"message\":{\"content\":\"done\"}}]}");
        AgentConfig config = config();
        config.setTransportRetries(3);
        boolean[] running = {true};
        clock.onSleep(ms -> running[0] = false);

        assertThrows(IOException.class,
            () -> provider.chat("prompt", "system", Observation.builder().build(), config, () -> running[0]));

        assertEquals(1, server.getRequestCount());
        assertEquals(1, clock.getSleeps().size());
    }

    @Test
    void backoffGrowsWithAttempts() {
        assertTrue(AbstractChatProvider.backoffMillis(0) < 570);
        assertTrue(AbstractChatProvider.backoffMillis(1) >= 900);
        assertTrue(AbstractChatProvider.backoffMillis(2) >= 1800);
        assertEquals(10_000, AbstractChatProvider.backoffMillis(50));
    }

    @Test
    void classifiesRetryableFailures() {
        assertTrue(AbstractChatProvider.isRetryableChatFailure(new IOException("LiteLLM request failed (429): slow down")));
        assertTrue(AbstractChatProvider.isRetryableChatFailure(new IOException("Gemini request failed (502): ")));
        assertTrue(AbstractChatProvider.isRetryableChatFailure(new IOException("request timed out")));
        assertFalse(AbstractChatProvider.isRetryableChatFailure(new IOException("LiteLLM request failed (400): nope")));
        assertFalse(AbstractChatProvider.isRetryableChatFailure(null));
    }
}
