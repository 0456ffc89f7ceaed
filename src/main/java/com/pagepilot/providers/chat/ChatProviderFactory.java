package com.pagepilot.providers.chat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagepilot.models.ProviderType;
import com.pagepilot.util.SessionClock;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out one provider per {@link ProviderType}, all sharing a single HTTP client.
 */
public class ChatProviderFactory {

    private final ObjectMapper mapper;
    private final HttpClient httpClient;
    private final SessionClock clock;
    private final Map<ProviderType, ChatProvider> providerCache = new ConcurrentHashMap<>();

    public ChatProviderFactory(ObjectMapper mapper) {
        this(mapper, SessionClock.system());
    }

    public ChatProviderFactory(ObjectMapper mapper, SessionClock clock) {
        this(mapper, HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(10))
            .build(), clock);
    }

    public ChatProviderFactory(ObjectMapper mapper, HttpClient httpClient, SessionClock clock) {
        this.mapper = mapper;
        this.httpClient = httpClient;
        this.clock = clock;
    }

    /**
     * A null type resolves to LiteLLM, the default provider.
     */
    public ChatProvider getProvider(ProviderType providerType) {
        ProviderType type = providerType != null ? providerType : ProviderType.LITELLM;
        return providerCache.computeIfAbsent(type, t -> {
            AbstractChatProvider provider = createProvider(t);
            provider.useClock(clock);
            return provider;
        });
    }

    private AbstractChatProvider createProvider(ProviderType providerType) {
        switch (providerType) {
            case GEMINI_DIRECT:
                return new GeminiChatProvider(mapper, httpClient);
            case BEDROCK_DIRECT:
                return new BedrockChatProvider(mapper, httpClient);
            case LITELLM:
            default:
                return new LiteLlmChatProvider(mapper, httpClient);
        }
    }
}
