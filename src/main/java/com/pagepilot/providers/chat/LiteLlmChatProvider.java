package com.pagepilot.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pagepilot.models.AgentConfig;
import com.pagepilot.models.Observation;
import com.pagepilot.models.ProviderType;
import java.io.IOException;
import java.net.http.HttpClient;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * OpenAI-compatible chat completions through a LiteLLM proxy.
 */
public class LiteLlmChatProvider extends AbstractChatProvider {

    public LiteLlmChatProvider(ObjectMapper mapper, HttpClient httpClient) {
        super(mapper, httpClient);
    }

    @Override
    public ProviderType getProviderType() {
        return ProviderType.LITELLM;
    }

    @Override
    public String chat(String promptText, String systemPrompt, Observation observation, AgentConfig config,
                       BooleanSupplier keepRetrying)
        throws IOException, InterruptedException {
        String model = requireText(config.getModel(), "LiteLLM model is empty.");
        String url = normalizeOpenAiBaseUrl(config.getApiBaseUrl(), AgentConfig.DEFAULT_API_BASE_URL) + "/v1/chat/completions";

        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", model);
        payload.put("temperature", config.getTemperature());
        payload.put("max_tokens", config.getMaxTokens());

        ArrayNode messages = payload.putArray("messages");
        ObjectNode system = messages.addObject();
        system.put("role", "system");
        system.put("content", systemPrompt);

        ObjectNode user = messages.addObject();
        user.put("role", "user");
        if (shouldAttachScreenshot(observation, config)) {
            ArrayNode content = user.putArray("content");
            ObjectNode text = content.addObject();
            text.put("type", "text");
            text.put("text", promptText);
            ObjectNode image = content.addObject();
            image.put("type", "image_url");
            image.putObject("image_url").put("url", observation.getScreenshotDataUrl());
        } else {
            user.put("content", promptText);
        }

        Map<String, String> headers = new LinkedHashMap<>();
        String apiKey = config.getApiKeyLiteLlm();
        if (apiKey != null && !apiKey.isBlank()) {
            headers.put("Authorization", "Bearer " + apiKey);
        }

        JsonNode response = sendJsonPostWithRetries(url, toJson(payload), headers,
            config.getRequestTimeoutMs(), config.getTransportRetries(), keepRetrying);
        return extractContent(response);
    }

    String extractContent(JsonNode response) {
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        if (content.isArray()) {
            return joinTextParts(content);
        }
        if (content.isTextual()) {
            return content.asText().trim();
        }
        if (content.isObject()) {
            return content.toString();
        }
        return "";
    }

    private String normalizeOpenAiBaseUrl(String baseUrl, String fallback) {
        String url = normalizeBaseUrl(baseUrl, fallback);
        if (url.endsWith("/v1")) {
            url = url.substring(0, url.length() - 3);
        }
        return url;
    }
}
