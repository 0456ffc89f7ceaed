package com.pagepilot.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagepilot.models.ActionType;
import com.pagepilot.models.BrowserAction;
import com.pagepilot.models.PageState;
import com.pagepilot.models.Screenshot;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

class HttpPageExecutorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, String> responses = new ConcurrentHashMap<>();
    private final Map<String, Integer> statuses = new ConcurrentHashMap<>();
    private final Map<String, String> requestBodies = new ConcurrentHashMap<>();
    private HttpServer server;
    private HttpPageExecutor executor;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/bridge", this::handle);
        server.start();
        executor = new HttpPageExecutor(mapper,
            "http://localhost:" + server.getAddress().getPort() + "/bridge/", Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath().substring("/bridge".length());
        try (InputStream in = exchange.getRequestBody()) {
            requestBodies.put(path, new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
        byte[] body = responses.getOrDefault(path, "").getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(statuses.getOrDefault(path, 200), body.length == 0 ? -1 : body.length);
        if (body.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        }
        exchange.close();
    }

    @Test
    void readsPageState() throws Exception {
        responses.put("/state", "{\"url\":\"https://example.com/\",\"title\":\"Home\","
            + "\"viewport\":{\"width\":800,\"height\":600},"
            + "\"scroll\":{\"x\":0,\"y\":10,\"maxY\":100,\"atTop\":false,\"atBottom\":false},"
            + "\"elements\":[{\"id\":\"e_1\",\"tag\":\"button\",\"text\":\"Go\",\"selector\":\"#go\",\"rect\":{}}],"
            + "\"domSignature\":\"sig\",\"extra\":true}");

        PageState state = executor.getPageState();

        assertEquals("https://example.com/", state.getUrl());
        assertEquals(800, state.getViewport().getWidth());
        assertEquals(10, state.getScroll().getY(), 1e-9);
        assertEquals(1, state.getElements().size());
        assertEquals("Go", state.getElements().get(0).getText());
        assertEquals("sig", state.getDomSignature());
    }

    @Test
    void stateFailureFlagBecomesIOException() {
        responses.put("/state", "{\"ok\":false,\"message\":\"No active tab.\"}");

        IOException error = assertThrows(IOException.class, () -> executor.getPageState());
        assertEquals("No active tab.", error.getMessage());
    }

    @Test
    void httpErrorIncludesStatus() {
        statuses.put("/state", 503);
        responses.put("/state", "busy");

        IOException error = assertThrows(IOException.class, () -> executor.getPageState());
        assertEquals("Executor request failed (503): busy", error.getMessage());
    }

    @Test
    void performActionPostsWrappedAction() throws Exception {
        responses.put("/action", "{\"ok\":true,\"message\":\"Clicked #go\"}");
        BrowserAction action = new BrowserAction(ActionType.CLICK);
        action.getTarget().setSelector("#go");

        ExecutionResult result = executor.performAction(action);

        assertTrue(result.isOk());
        assertEquals("Clicked #go", result.getMessage());
        JsonNode sent = mapper.readTree(requestBodies.get("/action"));
        assertEquals("click", sent.path("action").path("type").asText());
        assertEquals("#go", sent.path("action").path("target").path("selector").asText());
    }

    @Test
    void performActionFillsDefaultMessage() throws Exception {
        responses.put("/action", "{\"ok\":false}");

        ExecutionResult result = executor.performAction(new BrowserAction(ActionType.WAIT));

        assertFalse(result.isOk());
        assertEquals("Action failed.", result.getMessage());
    }

    @Test
    void pingReportsReachability() {
        responses.put("/ping", "{\"ok\":true}");
        assertTrue(executor.ping());

        statuses.put("/ping", 500);
        assertFalse(executor.ping());
    }

    @Test
    void indicatorSendsActiveAndStep() throws Exception {
        executor.setRunningIndicator(true, 4);

        JsonNode sent = mapper.readTree(requestBodies.get("/indicator"));
        assertTrue(sent.path("active").asBoolean());
        assertEquals(4, sent.path("step").asInt());
    }

    @Test
    void screenshotIsHashed() throws Exception {
        responses.put("/screenshot", "{\"dataUrl\":\"data:image/png;base64,AAAA\"}");

        Screenshot shot = executor.captureScreenshot();

        assertEquals("data:image/png;base64,AAAA", shot.getDataUrl());
        assertEquals(Screenshot.hash("data:image/png;base64,AAAA"), shot.getHash());

        responses.put("/screenshot", "{}");
        assertNull(executor.captureScreenshot());
    }
}
