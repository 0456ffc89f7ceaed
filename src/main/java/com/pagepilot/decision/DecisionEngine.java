package com.pagepilot.decision;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pagepilot.AppLogger;
import com.pagepilot.models.AgentConfig;
import com.pagepilot.models.Decision;
import com.pagepilot.models.Observation;
import com.pagepilot.models.Session;
import com.pagepilot.providers.chat.ChatProvider;
import com.pagepilot.providers.chat.ChatProviderFactory;
import com.pagepilot.storage.ChatLog;
import com.pagepilot.util.SessionClock;

import java.io.IOException;
import java.util.List;

/**
 * One decision cycle: build the prompt, call the configured provider and validate the reply.
 * Malformed replies are retried with a correction hint; provider failures are not.
 */
public class DecisionEngine {

    public static final int MAX_RETRIES = 2;
    public static final long RETRY_DELAY_MS = 600;

    private final ChatProviderFactory providerFactory;
    private final DecisionPromptBuilder promptBuilder;
    private final DecisionParser parser;
    private final ChatLog chatLog;
    private final SessionClock clock;

    public DecisionEngine(ChatProviderFactory providerFactory, DecisionPromptBuilder promptBuilder,
                          DecisionParser parser, ChatLog chatLog, SessionClock clock) {
        this.providerFactory = providerFactory;
        this.promptBuilder = promptBuilder;
        this.parser = parser;
        this.chatLog = chatLog;
        this.clock = clock;
    }

    /**
     * Consumes up to three queued user instructions from the session.
     *
     * @throws DecisionParseException when every attempt returned unusable output
     * @throws IOException when the provider call itself fails
     */
    public Decision requestDecision(Session session, Observation observation)
        throws IOException, InterruptedException, DecisionParseException {
        AgentConfig config = session.getConfig();
        List<String> instructions = session.drainInstructions(Session.MAX_INSTRUCTIONS_PER_STEP);
        ObjectNode promptData = promptBuilder.buildPromptData(session, observation, instructions);
        String systemPrompt = promptBuilder.systemPrompt(config.getResponseLanguage());
        ChatProvider provider = providerFactory.getProvider(config.getProvider());
        String label = provider.getProviderType().getLabel();

        int totalAttempts = MAX_RETRIES + 1;
        String retryHint = "";
        for (int attempt = 1; ; attempt++) {
            String promptText = promptBuilder.buildPromptText(promptData, config.getResponseLanguage(), retryHint);
            String raw = provider.chat(promptText, systemPrompt, observation, config, session::isRunning);
            try {
                return parser.parse(raw, label);
            } catch (DecisionParseException e) {
                if (!e.isRetryable() || attempt >= totalAttempts || !session.isRunning()) {
                    throw e;
                }
                AppLogger.get().warn("[DecisionEngine] " + e.getMessage() + " Attempt " + attempt + "/" + totalAttempts);
                chatLog.system("Planner response was invalid JSON. Retrying (" + (attempt + 1) + "/" + totalAttempts + ")...");
                retryHint = promptBuilder.retryHint(e);
                clock.sleep(RETRY_DELAY_MS * attempt);
            }
        }
    }
}
