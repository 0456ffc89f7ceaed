package com.pagepilot.decision;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagepilot.models.AgentConfig;
import com.pagepilot.models.ChatMessage;
import com.pagepilot.models.Decision;
import com.pagepilot.models.Observation;
import com.pagepilot.models.Session;
import com.pagepilot.models.StopReason;
import com.pagepilot.storage.ChatLog;
import com.pagepilot.support.FakeClock;
import com.pagepilot.support.FixedProviderFactory;
import com.pagepilot.support.InMemoryStateStore;
import com.pagepilot.support.ScriptedChatProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DecisionEngineTest {

    private static final String VALID = "{\"reasoning\":\"go\",\"action\":{\"type\":\"finish\"}}";

    private final ObjectMapper mapper = new ObjectMapper();
    private ScriptedChatProvider provider;
    private FakeClock clock;
    private ChatLog chatLog;
    private DecisionEngine engine;
    private Session session;
    private final Observation observation = Observation.builder().url("https://example.com/").title("Example").build();

    @BeforeEach
    void setUp() {
        provider = new ScriptedChatProvider();
        clock = new FakeClock();
        chatLog = new ChatLog(new InMemoryStateStore(), clock);
        engine = new DecisionEngine(new FixedProviderFactory(provider), new DecisionPromptBuilder(mapper),
            new DecisionParser(mapper), chatLog, clock);
        session = new Session("s-1", "find shoes", AgentConfig.defaults(), "https://example.com/", clock.now());
    }

    private List<String> chatTexts() {
        return chatLog.list().stream().map(ChatMessage::getText).collect(Collectors.toList());
    }

    @Test
    void returnsFirstValidDecision() throws Exception {
        provider.reply(VALID);

        Decision decision = engine.requestDecision(session, observation);

        assertEquals("go", decision.getReasoning());
        assertEquals(1, provider.getCallCount());
        assertTrue(clock.getSleeps().isEmpty());
        assertTrue(chatLog.list().isEmpty());
    }

    @Test
    void retriesMalformedReplyWithCorrectionHint() throws Exception {
        provider.reply("not json at all").reply(VALID);

        Decision decision = engine.requestDecision(session, observation);

        assertEquals("finish", decision.getAction().path("type").asText());
        assertEquals(2, provider.getCallCount());
        assertEquals(List.of(600L), clock.getSleeps());
        assertEquals(List.of("Planner response was invalid JSON. Retrying (2/3)..."), chatTexts());
        assertFalse(provider.getPrompts().get(0).contains("Retry correction:"));
        String retried = provider.getPrompts().get(1);
        assertTrue(retried.contains("Retry correction:"));
        assertTrue(retried.contains("Previous invalid output (truncated): not json at all"));
    }

    @Test
    void givesUpAfterThreeMalformedReplies() {
        provider.reply("{\"reasoning\":\"no action\"}");

        DecisionParseException error = assertThrows(DecisionParseException.class,
            () -> engine.requestDecision(session, observation));

        assertEquals(DecisionParseException.INVALID_ACTION_JSON, error.getCode());
        assertEquals(3, provider.getCallCount());
        assertEquals(List.of(600L, 1200L), clock.getSleeps());
        assertEquals(2, chatLog.size());
    }

    @Test
    void providerFailuresAreNotRetried() {
        provider.fail(new IOException("LiteLLM request failed (401): unauthorized"));

        IOException error = assertThrows(IOException.class, () -> engine.requestDecision(session, observation));

        assertEquals("LiteLLM request failed (401): unauthorized", error.getMessage());
        assertEquals(1, provider.getCallCount());
    }

    @Test
    void stopsRetryingOnceSessionStopped() {
        provider.reply("garbage");
        session.markStopped(StopReason.USER_STOP, clock.now());

        assertThrows(DecisionParseException.class, () -> engine.requestDecision(session, observation));
        assertEquals(1, provider.getCallCount());
    }

    @Test
    void consumesAtMostThreeInstructionsPerDecision() throws Exception {
        provider.reply(VALID);
        for (int i = 1; i <= 4; i++) {
            session.enqueueInstruction("instruction " + i);
        }

        engine.requestDecision(session, observation);

        String prompt = provider.getPrompts().get(0);
        assertTrue(prompt.contains("instruction 1"));
        assertTrue(prompt.contains("instruction 3"));
        assertFalse(prompt.contains("instruction 4"));
        assertEquals(1, session.getPendingInstructionCount());
    }
}
