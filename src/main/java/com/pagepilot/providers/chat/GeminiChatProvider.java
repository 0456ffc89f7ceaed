package com.pagepilot.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pagepilot.models.AgentConfig;
import com.pagepilot.models.Observation;
import com.pagepilot.models.ProviderType;
import java.io.IOException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.function.BooleanSupplier;

public class GeminiChatProvider extends AbstractChatProvider {

    public GeminiChatProvider(ObjectMapper mapper, HttpClient httpClient) {
        super(mapper, httpClient);
    }

    @Override
    public ProviderType getProviderType() {
        return ProviderType.GEMINI_DIRECT;
    }

    @Override
    public String chat(String promptText, String systemPrompt, Observation observation, AgentConfig config,
                       BooleanSupplier keepRetrying)
        throws IOException, InterruptedException {
        String apiKey = requireText(config.getApiKeyGemini(), "Gemini direct mode requires API key.");
        String model = requireText(normalizeModel(config.getModel()), "Gemini model is empty.");

        String baseUrl = normalizeGeminiBaseUrl(config.getGeminiBaseUrl(), AgentConfig.DEFAULT_GEMINI_BASE_URL);
        String url = baseUrl + "/v1beta/models/" + URLEncoder.encode(model, StandardCharsets.UTF_8) + ":generateContent";

        ObjectNode payload = mapper.createObjectNode();
        payload.putObject("systemInstruction").putArray("parts").addObject().put("text", systemPrompt);

        ArrayNode contents = payload.putArray("contents");
        ObjectNode content = contents.addObject();
        content.put("role", "user");
        ArrayNode parts = content.putArray("parts");
        parts.addObject().put("text", promptText);
        if (shouldAttachScreenshot(observation, config)) {
            InlineImage image = InlineImage.fromDataUrl(observation.getScreenshotDataUrl());
            if (image != null) {
                ObjectNode inline = parts.addObject().putObject("inline_data");
                inline.put("mime_type", image.getMimeType());
                inline.put("data", image.getBase64());
            }
        }

        ObjectNode generationConfig = payload.putObject("generationConfig");
        generationConfig.put("temperature", config.getTemperature());
        generationConfig.put("maxOutputTokens", config.getMaxTokens());

        JsonNode response = sendJsonPostWithRetries(url, toJson(payload), Map.of("x-goog-api-key", apiKey),
            config.getRequestTimeoutMs(), config.getTransportRetries(), keepRetrying);
        return joinTextParts(response.path("candidates").path(0).path("content").path("parts"));
    }

    /**
     * Strip the {@code models/} and {@code gemini/} prefixes other tools put in front of model ids.
     */
    static String normalizeModel(String model) {
        String value = model == null ? "" : model.trim();
        if (value.startsWith("models/")) {
            return value.substring("models/".length());
        }
        if (value.startsWith("gemini/")) {
            return value.substring("gemini/".length());
        }
        return value;
    }

    private String normalizeGeminiBaseUrl(String baseUrl, String fallback) {
        String url = normalizeBaseUrl(baseUrl, fallback);
        if (url.endsWith("/v1beta/models")) {
            url = url.substring(0, url.length() - 14);
        }
        if (url.endsWith("/v1beta")) {
            url = url.substring(0, url.length() - 7);
        }
        return url;
    }
}
