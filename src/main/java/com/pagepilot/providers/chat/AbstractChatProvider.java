package com.pagepilot.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagepilot.models.AgentConfig;
import com.pagepilot.models.Observation;
import com.pagepilot.util.SessionClock;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BooleanSupplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Abstract base class for chat providers with shared HTTP logic.
 */
public abstract class AbstractChatProvider implements ChatProvider {

    protected static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 120;
    protected static final int ERROR_BODY_LIMIT = 300;
    private static final Pattern STATUS_PATTERN = Pattern.compile("\\((\\d{3})\\)");

    protected final ObjectMapper mapper;
    protected final HttpClient httpClient;
    private volatile SessionClock sleeper = SessionClock.system();

    protected AbstractChatProvider(ObjectMapper mapper, HttpClient httpClient) {
        this.mapper = mapper;
        this.httpClient = httpClient;
    }

    /**
     * Backoff between transport retries sleeps on this clock.
     */
    void useClock(SessionClock clock) {
        this.sleeper = clock != null ? clock : SessionClock.system();
    }

    /**
     * Send a JSON POST request and return the parsed response.
     */
    protected JsonNode sendJsonPost(String url, String body, Map<String, String> headers, Integer timeoutMs)
        throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(resolveTimeout(timeoutMs))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body));

        if (headers != null) {
            for (Map.Entry<String, String> header : headers.entrySet()) {
                if ("Content-Type".equalsIgnoreCase(header.getKey())) {
                    continue;
                }
                if (header.getValue() != null && !header.getValue().isBlank()) {
                    builder.header(header.getKey(), header.getValue());
                }
            }
        }

        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            String errorBody = response.body() == null ? "" : response.body();
            throw new IOException(getProviderType().getLabel() + " request failed (" + status + "): "
                + errorBody.substring(0, Math.min(ERROR_BODY_LIMIT, errorBody.length())));
        }
        String responseBody = response.body();
        if (responseBody == null || responseBody.isBlank()) {
            return mapper.createObjectNode();
        }
        return mapper.readTree(responseBody);
    }

    /**
     * Retry wrapper for transient network/provider failures. {@code maxRetries} of zero sends once.
     * No further attempt is made once {@code keepRetrying} reports false.
     */
    protected JsonNode sendJsonPostWithRetries(String url, String body, Map<String, String> headers,
                                               Integer timeoutMs, int maxRetries, BooleanSupplier keepRetrying)
        throws IOException, InterruptedException {
        int retries = Math.max(0, maxRetries);
        IOException lastIo = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                return sendJsonPost(url, body, headers, timeoutMs);
            } catch (IOException e) {
                lastIo = e;
                if (attempt >= retries || !isRetryableChatFailure(e) || !keepRetrying.getAsBoolean()) {
                    throw e;
                }
                sleeper.sleep(backoffMillis(attempt));
                if (!keepRetrying.getAsBoolean()) {
                    throw e;
                }
            }
        }
        throw lastIo != null ? lastIo : new IOException(getProviderType().getLabel() + " request failed");
    }

    static boolean isRetryableChatFailure(IOException e) {
        if (e == null) return false;
        String msg = e.getMessage() != null ? e.getMessage() : "";
        if (msg.contains("EOF reached while reading")) return true;
        if (msg.contains("Connection reset")) return true;
        if (msg.contains("timed out") || msg.contains("Timeout")) return true;
        Matcher m = STATUS_PATTERN.matcher(msg);
        if (m.find()) {
            int code = Integer.parseInt(m.group(1));
            return code == 429 || (code >= 500 && code <= 599);
        }
        return false;
    }

    // 350ms, 900ms, 1800ms, then +1200ms per attempt, with jitter
    static long backoffMillis(int attempt) {
        long base;
        if (attempt <= 0) base = 350;
        else if (attempt == 1) base = 900;
        else if (attempt == 2) base = 1800;
        else base = 2800L + 1200L * (attempt - 3);
        long jitter = ThreadLocalRandom.current().nextLong(0, 220);
        return Math.min(10_000, base + jitter);
    }

    protected Duration resolveTimeout(Integer timeoutMs) {
        if (timeoutMs != null && timeoutMs > 0) {
            return Duration.ofMillis(timeoutMs);
        }
        return Duration.ofSeconds(DEFAULT_REQUEST_TIMEOUT_SECONDS);
    }

    protected String toJson(JsonNode payload) throws IOException {
        return mapper.writeValueAsString(payload);
    }

    protected boolean shouldAttachScreenshot(Observation observation, AgentConfig config) {
        return config.isIncludeScreenshotsInPrompt() && observation != null && observation.hasScreenshot();
    }

    /**
     * Concatenate the {@code text} fields of a content-part array, newline separated.
     */
    protected String joinTextParts(JsonNode parts) {
        if (parts == null || !parts.isArray()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) {
                sb.append('\n');
            }
            JsonNode part = parts.get(i);
            if (part.isTextual()) {
                sb.append(part.asText());
            } else if (part.path("text").isTextual()) {
                sb.append(part.path("text").asText());
            }
        }
        return sb.toString().trim();
    }

    /**
     * Normalize a base URL by removing trailing slashes.
     */
    protected String normalizeBaseUrl(String baseUrl, String fallback) {
        String url = (baseUrl == null || baseUrl.isBlank()) ? fallback : baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    protected static String requireText(String value, String message) throws IOException {
        if (value == null || value.isBlank()) {
            throw new IOException(message);
        }
        return value.trim();
    }
}
