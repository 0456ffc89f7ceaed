package com.pagepilot.providers.chat;

import com.pagepilot.models.AgentConfig;
import com.pagepilot.models.Observation;
import com.pagepilot.models.ProviderType;
import java.io.IOException;
import java.util.function.BooleanSupplier;

/**
 * Interface for model providers that plan browser actions.
 * Each implementation handles the specific wire format for that service and returns the raw text reply.
 */
public interface ChatProvider {

    /**
     * Get the provider this implementation handles.
     */
    ProviderType getProviderType();

    /**
     * Send one planning turn and get the assistant text back.
     *
     * @param promptText The observation prompt, including schema and rules
     * @param systemPrompt The planner system prompt
     * @param observation The current observation; its screenshot is attached when the config allows it
     * @param config Credentials, model and sampling settings
     * @return The assistant's response text, possibly empty
     */
    default String chat(String promptText, String systemPrompt, Observation observation, AgentConfig config)
        throws IOException, InterruptedException {
        return chat(promptText, systemPrompt, observation, config, () -> true);
    }

    /**
     * Same as {@link #chat(String, String, Observation, AgentConfig)}, but transport retries stop as soon as
     * {@code keepRetrying} turns false, for example because the session was stopped.
     */
    String chat(String promptText, String systemPrompt, Observation observation, AgentConfig config,
                BooleanSupplier keepRetrying) throws IOException, InterruptedException;
}
