package com.pagepilot.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pagepilot.models.AgentConfig;
import com.pagepilot.models.Observation;
import com.pagepilot.models.ProviderType;
import com.pagepilot.providers.signing.SigV4Signer;
import com.pagepilot.providers.signing.SignedRequest;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.function.BooleanSupplier;

/**
 * Bedrock Runtime Converse API with SigV4-signed requests.
 */
public class BedrockChatProvider extends AbstractChatProvider {

    static final String SERVICE = "bedrock";

    private final Clock clock;

    public BedrockChatProvider(ObjectMapper mapper, HttpClient httpClient) {
        this(mapper, httpClient, Clock.systemUTC());
    }

    public BedrockChatProvider(ObjectMapper mapper, HttpClient httpClient, Clock clock) {
        super(mapper, httpClient);
        this.clock = clock;
    }

    @Override
    public ProviderType getProviderType() {
        return ProviderType.BEDROCK_DIRECT;
    }

    @Override
    public String chat(String promptText, String systemPrompt, Observation observation, AgentConfig config,
                       BooleanSupplier keepRetrying)
        throws IOException, InterruptedException {
        String region = requireText(config.getBedrockRegion(), "Bedrock region is empty.");
        String model = requireText(config.getModel(), "Bedrock model is empty.");
        if (isBlank(config.getBedrockAccessKeyId()) || isBlank(config.getBedrockSecretAccessKey())) {
            throw new IOException("Bedrock direct mode requires AWS access key ID and secret access key.");
        }

        String base = normalizeBaseUrl(config.getBedrockEndpoint(), "https://bedrock-runtime." + region + ".amazonaws.com");
        String path = "/model/" + URLEncoder.encode(model, StandardCharsets.UTF_8) + "/converse";
        URI uri = URI.create(base + path);

        ObjectNode payload = mapper.createObjectNode();
        payload.putArray("system").addObject().put("text", systemPrompt);
        ObjectNode message = payload.putArray("messages").addObject();
        message.put("role", "user");
        ArrayNode content = message.putArray("content");
        content.addObject().put("text", promptText);
        if (shouldAttachScreenshot(observation, config)) {
            InlineImage image = InlineImage.fromDataUrl(observation.getScreenshotDataUrl());
            String format = image != null ? image.getBedrockFormat() : null;
            if (format != null) {
                ObjectNode imageNode = content.addObject().putObject("image");
                imageNode.put("format", format);
                imageNode.putObject("source").put("bytes", image.getBase64());
            }
        }
        ObjectNode inference = payload.putObject("inferenceConfig");
        inference.put("temperature", config.getTemperature());
        inference.put("maxTokens", config.getMaxTokens());

        String body = toJson(payload);
        SigV4Signer signer = new SigV4Signer(
            config.getBedrockAccessKeyId(),
            config.getBedrockSecretAccessKey(),
            config.getBedrockSessionToken(),
            region,
            SERVICE);
        SignedRequest signed = signer.sign("POST", hostHeader(uri), uri.getRawPath(), body, clock.instant());

        // Signed once up front; a retried send reuses the same signature within its validity window.
        JsonNode response = sendJsonPostWithRetries(uri.toString(), body, signed.getHeaders(),
            config.getRequestTimeoutMs(), config.getTransportRetries(), keepRetrying);
        return joinTextParts(response.path("output").path("message").path("content"));
    }

    /**
     * Host as the HTTP client will send it: explicit ports are part of the signed value.
     */
    static String hostHeader(URI uri) {
        return uri.getPort() >= 0 ? uri.getHost() + ":" + uri.getPort() : uri.getHost();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
