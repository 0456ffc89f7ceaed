package com.pagepilot.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ProviderType {
    LITELLM("litellm", "LiteLLM", "gemini/gemini-1.5-pro"),
    GEMINI_DIRECT("gemini_direct", "Gemini", "gemini-2.5-flash"),
    BEDROCK_DIRECT("bedrock_direct", "Bedrock", "us.anthropic.claude-3-5-sonnet-20241022-v2:0");

    private final String id;
    private final String label;
    private final String defaultModel;

    ProviderType(String id, String label, String defaultModel) {
        this.id = id;
        this.label = label;
        this.defaultModel = defaultModel;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    /**
     * Lenient lookup: {@code bedrock} is accepted as an alias, unknown values fall back to LiteLLM.
     */
    @JsonCreator
    public static ProviderType fromValue(String value) {
        String provider = value == null ? "" : value.trim().toLowerCase();
        if (GEMINI_DIRECT.id.equals(provider)) {
            return GEMINI_DIRECT;
        }
        if (BEDROCK_DIRECT.id.equals(provider) || "bedrock".equals(provider)) {
            return BEDROCK_DIRECT;
        }
        return LITELLM;
    }
}
