package com.pagepilot.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pagepilot.AppLogger;
import com.pagepilot.models.BrowserAction;
import com.pagepilot.models.PageState;
import com.pagepilot.models.Screenshot;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Talks JSON to an automation endpoint running next to the browser
 * ({@code GET /state}, {@code POST /action}, {@code GET /ping}, {@code POST /indicator}, {@code GET /screenshot}).
 */
public class HttpPageExecutor implements PageExecutor {

    private static final int ERROR_BODY_LIMIT = 300;

    private final ObjectMapper mapper;
    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration timeout;

    public HttpPageExecutor(ObjectMapper mapper, String baseUrl, Duration timeout) {
        this(mapper, HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(5))
            .build(), baseUrl, timeout);
    }

    public HttpPageExecutor(ObjectMapper mapper, HttpClient httpClient, String baseUrl, Duration timeout) {
        this.mapper = mapper;
        this.httpClient = httpClient;
        String url = baseUrl == null ? "" : baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        this.baseUrl = url;
        this.timeout = timeout;
    }

    @Override
    public PageState getPageState() throws IOException, InterruptedException {
        JsonNode body = send(HttpRequest.newBuilder(URI.create(baseUrl + "/state")).GET());
        if (body.has("ok") && !body.path("ok").asBoolean()) {
            String message = body.path("message").asText("");
            throw new IOException(message.isBlank() ? "Failed to collect page state." : message);
        }
        return mapper.treeToValue(body, PageState.class);
    }

    @Override
    public ExecutionResult performAction(BrowserAction action) throws IOException, InterruptedException {
        ObjectNode payload = mapper.createObjectNode();
        payload.set("action", mapper.valueToTree(action));
        JsonNode body = send(post("/action", payload));
        ExecutionResult result = mapper.treeToValue(body, ExecutionResult.class);
        if (result.getMessage() == null || result.getMessage().isBlank()) {
            result.setMessage(result.isOk() ? "Action executed." : "Action failed.");
        }
        return result;
    }

    @Override
    public boolean ping() {
        try {
            send(HttpRequest.newBuilder(URI.create(baseUrl + "/ping")).GET());
            return true;
        } catch (IOException e) {
            AppLogger.get().warn("[HttpPageExecutor] Ping failed: " + e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void setRunningIndicator(boolean active, int step) throws IOException, InterruptedException {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("active", active);
        payload.put("step", step);
        send(post("/indicator", payload));
    }

    @Override
    public Screenshot captureScreenshot() throws IOException, InterruptedException {
        JsonNode body = send(HttpRequest.newBuilder(URI.create(baseUrl + "/screenshot")).GET());
        String dataUrl = body.path("dataUrl").asText("");
        return dataUrl.isBlank() ? null : Screenshot.of(dataUrl);
    }

    private HttpRequest.Builder post(String path, JsonNode payload) throws IOException {
        return HttpRequest.newBuilder(URI.create(baseUrl + path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload)));
    }

    private JsonNode send(HttpRequest.Builder builder) throws IOException, InterruptedException {
        HttpResponse<String> response = httpClient.send(builder.timeout(timeout).build(),
            HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        String body = response.body() == null ? "" : response.body();
        if (status < 200 || status >= 300) {
            throw new IOException("Executor request failed (" + status + "): "
                + body.substring(0, Math.min(ERROR_BODY_LIMIT, body.length())));
        }
        return body.isBlank() ? mapper.createObjectNode() : mapper.readTree(body);
    }
}
