package com.pagepilot.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagepilot.util.Values;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Agent settings: provider selection and credentials, loop limits, and safety switches.
 * Instances coming from outside go through {@link #merge} so every field is sanitized and clamped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentConfig {

    public static final String DEFAULT_API_BASE_URL = "http://localhost:4000";
    public static final String DEFAULT_GEMINI_BASE_URL = "https://generativelanguage.googleapis.com";
    public static final String DEFAULT_BEDROCK_REGION = "us-east-1";
    public static final String DEFAULT_RESPONSE_LANGUAGE = "Japanese";
    public static final List<String> DEFAULT_HIGH_RISK_KEYWORDS = List.of(
        "delete",
        "remove",
        "destroy",
        "terminate",
        "cancel",
        "unsubscribe",
        "close account",
        "purchase",
        "buy",
        "checkout",
        "pay",
        "confirm order",
        "submit order",
        "transfer",
        "send money"
    );

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ProviderType provider = ProviderType.LITELLM;
    private String apiBaseUrl = DEFAULT_API_BASE_URL;
    private String apiKeyLiteLlm = "";
    private String apiKeyGemini = "";
    private String geminiBaseUrl = DEFAULT_GEMINI_BASE_URL;
    private String bedrockRegion = DEFAULT_BEDROCK_REGION;
    private String bedrockAccessKeyId = "";
    private String bedrockSecretAccessKey = "";
    private String bedrockSessionToken = "";
    private String bedrockEndpoint = "";
    private Map<String, String> providerModels = defaultProviderModels();
    private String responseLanguage = DEFAULT_RESPONSE_LANGUAGE;
    private int maxSteps = 20;
    private int settleDelayMs = 1200;
    private int maxStagnationSteps = 3;
    private boolean includeScreenshotsInPrompt = true;
    private String allowedDomains = "";
    private double temperature = 0.2;
    private int maxTokens = 900;
    private boolean blockHighRisk = true;
    private int approvalTimeoutMs = 120_000;
    private List<String> highRiskKeywords = new ArrayList<>(DEFAULT_HIGH_RISK_KEYWORDS);
    private int requestTimeoutMs = 120_000;
    private int transportRetries = 0;

    public static AgentConfig defaults() {
        return new AgentConfig();
    }

    /**
     * Apply a partial, loosely-typed update on top of {@code base}. Absent or unusable fields keep
     * the base value; the result is fully normalized. {@code base} is not modified.
     */
    public static AgentConfig merge(AgentConfig base, JsonNode patch) {
        AgentConfig next = base != null ? base.copy() : defaults();
        if (patch != null && patch.isObject()) {
            next.applyPatch(patch);
        }
        next.normalize();
        return next;
    }

    public AgentConfig copy() {
        return MAPPER.convertValue(this, AgentConfig.class);
    }

    private void applyPatch(JsonNode input) {
        ProviderType patchedProvider = null;
        if (input.path("provider").isTextual()) {
            patchedProvider = ProviderType.fromValue(input.get("provider").asText());
            provider = patchedProvider;
        }
        String baseUrl = trimmedText(input, "apiBaseUrl");
        if (baseUrl != null && !baseUrl.isEmpty()) {
            apiBaseUrl = baseUrl;
        }
        String liteKey = trimmedText(input, "apiKeyLiteLlm");
        if (liteKey != null) {
            apiKeyLiteLlm = liteKey;
        }
        String geminiKey = trimmedText(input, "apiKeyGemini");
        if (geminiKey != null) {
            apiKeyGemini = geminiKey;
        }
        String legacyKey = trimmedText(input, "apiKey");
        if (legacyKey != null) {
            if (provider == ProviderType.GEMINI_DIRECT) {
                apiKeyGemini = legacyKey;
            } else {
                apiKeyLiteLlm = legacyKey;
            }
        }
        String geminiBase = trimmedText(input, "geminiBaseUrl");
        if (geminiBase != null && !geminiBase.isEmpty()) {
            geminiBaseUrl = geminiBase;
        }
        String region = trimmedText(input, "bedrockRegion");
        if (region != null && !region.isEmpty()) {
            bedrockRegion = region.toLowerCase(Locale.ROOT);
        }
        String accessKeyId = trimmedText(input, "bedrockAccessKeyId");
        if (accessKeyId != null) {
            bedrockAccessKeyId = accessKeyId;
        }
        String secret = trimmedText(input, "bedrockSecretAccessKey");
        if (secret != null) {
            bedrockSecretAccessKey = secret;
        }
        String sessionToken = trimmedText(input, "bedrockSessionToken");
        if (sessionToken != null) {
            bedrockSessionToken = sessionToken;
        }
        String endpoint = trimmedText(input, "bedrockEndpoint");
        if (endpoint != null) {
            bedrockEndpoint = endpoint;
        }

        JsonNode modelsNode = input.get("providerModels");
        if (modelsNode != null && modelsNode.isObject()) {
            providerModels = normalizeProviderModels(MAPPER.convertValue(modelsNode, Map.class));
        }
        String model = trimmedText(input, "model");
        if (model != null && !model.isEmpty()) {
            ProviderType active = patchedProvider != null ? patchedProvider : provider;
            providerModels = normalizeProviderModels(providerModels);
            providerModels.put(active.getId(), model);
        }

        String language = trimmedText(input, "responseLanguage");
        if (language != null) {
            responseLanguage = language;
        }
        String domains = trimmedText(input, "allowedDomains");
        if (domains != null) {
            allowedDomains = domains;
        }
        if (input.path("includeScreenshotsInPrompt").isBoolean()) {
            includeScreenshotsInPrompt = input.get("includeScreenshotsInPrompt").asBoolean();
        }
        if (input.path("blockHighRisk").isBoolean()) {
            blockHighRisk = input.get("blockHighRisk").asBoolean();
        }
        JsonNode keywords = input.get("highRiskKeywords");
        if (keywords != null && keywords.isArray()) {
            List<String> parsed = new ArrayList<>();
            keywords.forEach(k -> {
                if (k.isTextual()) {
                    parsed.add(k.asText());
                }
            });
            highRiskKeywords = parsed;
        }

        if (hasValue(input, "maxSteps")) {
            maxSteps = (int) Values.clamp(input.get("maxSteps"), 1, 100, maxSteps);
        }
        if (hasValue(input, "settleDelayMs")) {
            settleDelayMs = (int) Values.clamp(input.get("settleDelayMs"), 200, 10_000, settleDelayMs);
        }
        if (hasValue(input, "maxStagnationSteps")) {
            maxStagnationSteps = (int) Values.clamp(input.get("maxStagnationSteps"), 1, 20, maxStagnationSteps);
        }
        if (hasValue(input, "temperature")) {
            temperature = Values.clamp(input.get("temperature"), 0, 1.5, temperature);
        }
        if (hasValue(input, "maxTokens")) {
            maxTokens = (int) Values.clamp(input.get("maxTokens"), 200, 4000, maxTokens);
        }
        if (hasValue(input, "approvalTimeoutMs")) {
            approvalTimeoutMs = (int) Values.clamp(input.get("approvalTimeoutMs"), 1000, 600_000, approvalTimeoutMs);
        }
        if (hasValue(input, "requestTimeoutMs")) {
            requestTimeoutMs = (int) Values.clamp(input.get("requestTimeoutMs"), 1000, 600_000, requestTimeoutMs);
        }
        if (hasValue(input, "transportRetries")) {
            transportRetries = (int) Values.clamp(input.get("transportRetries"), 0, 5, transportRetries);
        }
    }

    /**
     * Clamp and default every field in place.
     */
    public void normalize() {
        if (provider == null) {
            provider = ProviderType.LITELLM;
        }
        providerModels = normalizeProviderModels(providerModels);
        apiBaseUrl = stripTrailingSlash(isBlank(apiBaseUrl) ? DEFAULT_API_BASE_URL : apiBaseUrl.trim());
        geminiBaseUrl = stripTrailingSlash(isBlank(geminiBaseUrl) ? DEFAULT_GEMINI_BASE_URL : geminiBaseUrl.trim());
        apiKeyLiteLlm = trimmed(apiKeyLiteLlm);
        apiKeyGemini = trimmed(apiKeyGemini);
        bedrockRegion = isBlank(bedrockRegion) ? DEFAULT_BEDROCK_REGION : bedrockRegion.trim().toLowerCase(Locale.ROOT);
        bedrockAccessKeyId = trimmed(bedrockAccessKeyId);
        bedrockSecretAccessKey = trimmed(bedrockSecretAccessKey);
        bedrockSessionToken = trimmed(bedrockSessionToken);
        bedrockEndpoint = stripTrailingSlash(trimmed(bedrockEndpoint));
        responseLanguage = isBlank(responseLanguage)
            ? DEFAULT_RESPONSE_LANGUAGE
            : Values.truncate(responseLanguage.trim(), 40);
        allowedDomains = trimmed(allowedDomains);
        maxSteps = (int) Values.clamp(maxSteps, 1, 100, 20);
        settleDelayMs = (int) Values.clamp(settleDelayMs, 200, 10_000, 1200);
        maxStagnationSteps = (int) Values.clamp(maxStagnationSteps, 1, 20, 3);
        temperature = Values.clamp(temperature, 0, 1.5, 0.2);
        maxTokens = (int) Values.clamp(maxTokens, 200, 4000, 900);
        approvalTimeoutMs = (int) Values.clamp(approvalTimeoutMs, 1000, 600_000, 120_000);
        requestTimeoutMs = (int) Values.clamp(requestTimeoutMs, 1000, 600_000, 120_000);
        transportRetries = (int) Values.clamp(transportRetries, 0, 5, 0);

        List<String> keywords = new ArrayList<>();
        if (highRiskKeywords != null) {
            for (String keyword : highRiskKeywords) {
                if (keyword != null && !keyword.isBlank()) {
                    keywords.add(keyword.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        highRiskKeywords = keywords;
    }

    /**
     * Model configured for the active provider.
     */
    @JsonIgnore
    public String getModel() {
        String model = providerModels != null ? providerModels.get(provider.getId()) : null;
        return isBlank(model) ? provider.getDefaultModel() : model;
    }

    private static Map<String, String> defaultProviderModels() {
        Map<String, String> models = new LinkedHashMap<>();
        for (ProviderType type : ProviderType.values()) {
            models.put(type.getId(), type.getDefaultModel());
        }
        return models;
    }

    private static Map<String, String> normalizeProviderModels(Map<?, ?> input) {
        Map<String, String> normalized = defaultProviderModels();
        if (input == null) {
            return normalized;
        }
        for (ProviderType type : ProviderType.values()) {
            Object raw = input.get(type.getId());
            if (raw instanceof String && !((String) raw).isBlank()) {
                normalized.put(type.getId(), ((String) raw).trim());
            }
        }
        return normalized;
    }

    private static String trimmedText(JsonNode input, String field) {
        JsonNode node = input.get(field);
        return node != null && node.isTextual() ? node.asText().trim() : null;
    }

    private static boolean hasValue(JsonNode input, String field) {
        JsonNode node = input.get(field);
        return node != null && !node.isNull() && !(node.isTextual() && node.asText().isEmpty());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String trimmed(String value) {
        return value == null ? "" : value.trim();
    }

    private static String stripTrailingSlash(String value) {
        String url = value;
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    public ProviderType getProvider() {
        return provider;
    }

    public void setProvider(ProviderType provider) {
        this.provider = provider;
    }

    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public void setApiBaseUrl(String apiBaseUrl) {
        this.apiBaseUrl = apiBaseUrl;
    }

    public String getApiKeyLiteLlm() {
        return apiKeyLiteLlm;
    }

    public void setApiKeyLiteLlm(String apiKeyLiteLlm) {
        this.apiKeyLiteLlm = apiKeyLiteLlm;
    }

    public String getApiKeyGemini() {
        return apiKeyGemini;
    }

    public void setApiKeyGemini(String apiKeyGemini) {
        this.apiKeyGemini = apiKeyGemini;
    }

    public String getGeminiBaseUrl() {
        return geminiBaseUrl;
    }

    public void setGeminiBaseUrl(String geminiBaseUrl) {
        this.geminiBaseUrl = geminiBaseUrl;
    }

    public String getBedrockRegion() {
        return bedrockRegion;
    }

    public void setBedrockRegion(String bedrockRegion) {
        this.bedrockRegion = bedrockRegion;
    }

    public String getBedrockAccessKeyId() {
        return bedrockAccessKeyId;
    }

    public void setBedrockAccessKeyId(String bedrockAccessKeyId) {
        this.bedrockAccessKeyId = bedrockAccessKeyId;
    }

    public String getBedrockSecretAccessKey() {
        return bedrockSecretAccessKey;
    }

    public void setBedrockSecretAccessKey(String bedrockSecretAccessKey) {
        this.bedrockSecretAccessKey = bedrockSecretAccessKey;
    }

    public String getBedrockSessionToken() {
        return bedrockSessionToken;
    }

    public void setBedrockSessionToken(String bedrockSessionToken) {
        this.bedrockSessionToken = bedrockSessionToken;
    }

    public String getBedrockEndpoint() {
        return bedrockEndpoint;
    }

    public void setBedrockEndpoint(String bedrockEndpoint) {
        this.bedrockEndpoint = bedrockEndpoint;
    }

    public Map<String, String> getProviderModels() {
        return providerModels;
    }

    public void setProviderModels(Map<String, String> providerModels) {
        this.providerModels = providerModels;
    }

    public String getResponseLanguage() {
        return responseLanguage;
    }

    public void setResponseLanguage(String responseLanguage) {
        this.responseLanguage = responseLanguage;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    public void setMaxSteps(int maxSteps) {
        this.maxSteps = maxSteps;
    }

    public int getSettleDelayMs() {
        return settleDelayMs;
    }

    public void setSettleDelayMs(int settleDelayMs) {
        this.settleDelayMs = settleDelayMs;
    }

    public int getMaxStagnationSteps() {
        return maxStagnationSteps;
    }

    public void setMaxStagnationSteps(int maxStagnationSteps) {
        this.maxStagnationSteps = maxStagnationSteps;
    }

    public boolean isIncludeScreenshotsInPrompt() {
        return includeScreenshotsInPrompt;
    }

    public void setIncludeScreenshotsInPrompt(boolean includeScreenshotsInPrompt) {
        this.includeScreenshotsInPrompt = includeScreenshotsInPrompt;
    }

    public String getAllowedDomains() {
        return allowedDomains;
    }

    public void setAllowedDomains(String allowedDomains) {
        this.allowedDomains = allowedDomains;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public boolean isBlockHighRisk() {
        return blockHighRisk;
    }

    public void setBlockHighRisk(boolean blockHighRisk) {
        this.blockHighRisk = blockHighRisk;
    }

    public int getApprovalTimeoutMs() {
        return approvalTimeoutMs;
    }

    public void setApprovalTimeoutMs(int approvalTimeoutMs) {
        this.approvalTimeoutMs = approvalTimeoutMs;
    }

    public List<String> getHighRiskKeywords() {
        return highRiskKeywords;
    }

    public void setHighRiskKeywords(List<String> highRiskKeywords) {
        this.highRiskKeywords = highRiskKeywords;
    }

    public int getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(int requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public int getTransportRetries() {
        return transportRetries;
    }

    public void setTransportRetries(int transportRetries) {
        this.transportRetries = transportRetries;
    }
}
