package com.pagepilot.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.pagepilot.AgentConfigStore;
import com.pagepilot.AppLogger;
import com.pagepilot.decision.ActionDescriber;
import com.pagepilot.decision.ActionNormalizer;
import com.pagepilot.decision.DecisionEngine;
import com.pagepilot.decision.DecisionParseException;
import com.pagepilot.executor.ExecutionResult;
import com.pagepilot.executor.PageExecutor;
import com.pagepilot.models.ActionType;
import com.pagepilot.models.AgentConfig;
import com.pagepilot.models.ApprovalDecision;
import com.pagepilot.models.BrowserAction;
import com.pagepilot.models.ChatMessage;
import com.pagepilot.models.Decision;
import com.pagepilot.models.Observation;
import com.pagepilot.models.PageState;
import com.pagepilot.models.Screenshot;
import com.pagepilot.models.Session;
import com.pagepilot.models.SessionStatus;
import com.pagepilot.models.StopReason;
import com.pagepilot.storage.ChatLog;
import com.pagepilot.util.SessionClock;
import com.pagepilot.util.UrlPolicy;
import com.pagepilot.util.Values;

import java.io.IOException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Owns the single agent session and runs its observe/decide/act loop on the loop executor.
 */
public class SessionController {

    public static final int MAX_SCROLL_STALLS = 2;
    static final long LOOP_EXIT_TIMEOUT_MS = 45_000;
    static final String DEFAULT_FINAL_ANSWER = "Model decided the task is complete.";
    static final String UNPARSEABLE_MESSAGE = "Stopped: model response could not be parsed as an action.";

    private static final DateTimeFormatter SESSION_STAMP =
        DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    private final PageExecutor pageExecutor;
    private final DecisionEngine decisionEngine;
    private final ActionNormalizer normalizer;
    private final RiskGate riskGate;
    private final ChangeEvaluator changeEvaluator;
    private final ChatLog chatLog;
    private final AgentConfigStore configStore;
    private final SessionClock clock;
    private final Executor loopExecutor;

    private volatile Session current;

    public SessionController(PageExecutor pageExecutor, DecisionEngine decisionEngine, ActionNormalizer normalizer,
                             RiskGate riskGate, ChangeEvaluator changeEvaluator, ChatLog chatLog,
                             AgentConfigStore configStore, SessionClock clock, Executor loopExecutor) {
        this.pageExecutor = pageExecutor;
        this.decisionEngine = decisionEngine;
        this.normalizer = normalizer;
        this.riskGate = riskGate;
        this.changeEvaluator = changeEvaluator;
        this.chatLog = chatLog;
        this.configStore = configStore;
        this.clock = clock;
        this.loopExecutor = loopExecutor;
    }

    /**
     * Start a new session toward {@code goal}, stopping any running one first.
     *
     * @param configPatch optional partial config merged into the stored config before starting
     * @throws IllegalArgumentException for an empty goal, a non-http(s) page or a page outside the allow-list
     * @throws IllegalStateException when the page executor cannot be reached, or the previous loop does not exit
     */
    public synchronized SessionStatus start(String goal, JsonNode configPatch) throws IOException {
        String cleanGoal = goal == null ? "" : goal.trim();
        if (cleanGoal.isEmpty()) {
            throw new IllegalArgumentException("Goal is empty.");
        }

        Session previous = current;
        if (previous != null) {
            if (previous.isRunning()) {
                stopSession(previous, StopReason.REPLACED, "Previous session was stopped before starting a new one.");
            }
            awaitLoopExit(previous);
        }

        AgentConfig config = configPatch != null && !configPatch.isNull()
            ? configStore.update(configPatch)
            : configStore.get();

        String url = currentPageUrl();
        if (!UrlPolicy.isAutomatable(url)) {
            throw new IllegalArgumentException("This page cannot be automated.");
        }
        if (!UrlPolicy.isAllowedDomain(url, config.getAllowedDomains())) {
            throw new IllegalArgumentException("Current domain is not in the allowlist.");
        }

        Session session = new Session(newSessionId(), cleanGoal, config.copy(), url, clock.now());
        current = session;
        updateIndicator(true, 0);

        chatLog.system("Session " + session.getId() + " started on " + Values.safeUrl(url) + ".");
        chatLog.push("user", cleanGoal, Map.of(ChatMessage.META_KIND, "goal"));
        chatLog.assistant("Agent started.");
        AppLogger.get().info("[SessionController] Session " + session.getId() + " started ("
            + config.getProvider().getId() + ", " + config.getModel() + ")");

        try {
            loopExecutor.execute(() -> runLoop(session));
        } catch (RejectedExecutionException e) {
            stopSession(session, StopReason.RUNTIME_ERROR, "Agent loop could not be scheduled.");
            session.markLoopExited();
            throw new IllegalStateException("Agent loop could not be scheduled.", e);
        }
        return SessionStatus.of(session);
    }

    // The old loop may still be inside a page call; the next session must not talk to the page until it returns.
    private void awaitLoopExit(Session previous) {
        try {
            if (!previous.awaitLoopExit(LOOP_EXIT_TIMEOUT_MS)) {
                AppLogger.get().warn("[SessionController] Session " + previous.getId() + " loop did not exit in time");
                throw new IllegalStateException("Previous session is still shutting down.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the previous session to stop.", e);
        }
    }

    /**
     * Stop the running session. Calling it again, or with nothing running, has no further effect.
     */
    public SessionStatus stop() {
        Session session = current;
        if (session != null) {
            stopSession(session, StopReason.USER_STOP, "Stopped by user.");
        }
        return getStatus();
    }

    /**
     * Queue a user instruction for the next decision.
     */
    public void submitInstruction(String text) {
        String clean = text == null ? "" : text.trim();
        if (clean.isEmpty()) {
            throw new IllegalArgumentException("Instruction is empty.");
        }
        Session session = current;
        if (session == null || !session.isRunning()) {
            throw new IllegalStateException("Agent is not running.");
        }
        session.enqueueInstruction(clean);
        session.touch(clock.now());
        chatLog.push("user", clean, Map.of(ChatMessage.META_KIND, "instruction"));
    }

    /**
     * @param decision {@code approve} or {@code reject}
     */
    public void resolveApproval(String approvalId, String decision) {
        riskGate.resolve(current, approvalId, ApprovalDecision.fromVerb(decision));
    }

    public SessionStatus getStatus() {
        Session session = current;
        return session != null ? SessionStatus.of(session) : SessionStatus.idle(clock.now());
    }

    Session getCurrentSession() {
        return current;
    }

    private void runLoop(Session session) {
        AppLogger.bindSession(session.getId());
        StopReason reason = null;
        try {
            reason = loop(session);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            reason = StopReason.USER_STOP;
        } catch (Exception e) {
            AppLogger.get().error("[SessionController] Agent loop failed", e);
            if (session.isRunning()) {
                chatLog.system("Agent runtime error: " + e.getMessage());
            }
            reason = StopReason.RUNTIME_ERROR;
        } finally {
            try {
                session.markStopped(reason != null ? reason : StopReason.USER_STOP, clock.now());
                cleanup(session);
            } finally {
                AppLogger.clearSession();
                session.markLoopExited();
            }
        }
    }

    /**
     * @return the reason the loop ended on its own, or null when the session was stopped from outside
     */
    private StopReason loop(Session session) throws InterruptedException {
        AgentConfig config = session.getConfig();
        while (session.isRunning()) {
            if (session.getStep() >= config.getMaxSteps()) {
                chatLog.assistant("Stopped: reached max steps (" + config.getMaxSteps() + ").");
                return StopReason.STEP_LIMIT;
            }

            int step = session.nextStep();
            session.touch(clock.now());
            updateIndicator(true, step);

            Observation before;
            try {
                before = observe(session, null);
            } catch (IOException e) {
                chatLog.system("Stopped: " + e.getMessage());
                return StopReason.EXECUTOR_ERROR;
            }
            if (!session.isRunning()) {
                return null;
            }

            Decision decision;
            try {
                decision = decisionEngine.requestDecision(session, before);
            } catch (DecisionParseException e) {
                if (!session.isRunning()) {
                    return null;
                }
                AppLogger.get().warn("[SessionController] " + e.getMessage() + " Raw: " + e.getRawSnippet());
                chatLog.system(UNPARSEABLE_MESSAGE);
                return StopReason.UNPARSEABLE_RESPONSE;
            } catch (IOException e) {
                if (!session.isRunning()) {
                    return null;
                }
                AppLogger.get().warn("[SessionController] Provider call failed: " + e.getMessage());
                chatLog.system("Stopped: " + e.getMessage());
                return StopReason.PROVIDER_ERROR;
            }
            if (!session.isRunning()) {
                return null;
            }

            BrowserAction action = normalizer.normalize(decision.getAction(), before);
            AppLogger.get().debug("[SessionController] Step " + step + " on " + Values.safeUrl(before.getUrl())
                + ": " + (action != null ? ActionDescriber.describe(action) : "invalid action"));
            if (action == null) {
                chatLog.system(UNPARSEABLE_MESSAGE);
                return StopReason.UNPARSEABLE_RESPONSE;
            }
            chatLog.assistant(ActionDescriber.announce(step, action, decision.getReasoning()));

            if (action.is(ActionType.FINISH)) {
                String finalAnswer = decision.getFinalAnswer();
                chatLog.assistant(finalAnswer != null && !finalAnswer.isEmpty() ? finalAnswer : DEFAULT_FINAL_ANSWER);
                return StopReason.GOAL_COMPLETE;
            }

            String riskReason = riskGate.assess(action, before, config);
            if (riskReason != null) {
                boolean approved = riskGate.requestApproval(session, action, before, riskReason);
                if (!session.isRunning()) {
                    return null;
                }
                if (!approved) {
                    chatLog.assistant("High-risk action was not approved, so I stopped.");
                    return StopReason.NOT_APPROVED;
                }
            }

            ExecutionResult execution = execute(action);
            if (!execution.isOk()) {
                chatLog.system("Action failed: " + execution.getMessage());
            }
            if (!session.isRunning()) {
                return null;
            }

            session.setLastAction(action);
            if (!action.is(ActionType.WAIT)) {
                clock.sleep(config.getSettleDelayMs());
            }
            if (!session.isRunning()) {
                return null;
            }

            Observation after;
            try {
                after = observe(session, "Step " + step + " screenshot after " + action.getType().getWireName());
            } catch (IOException e) {
                chatLog.system("Stopped: " + e.getMessage());
                return StopReason.EXECUTOR_ERROR;
            }
            if (!session.isRunning()) {
                return null;
            }

            ChangeResult change = changeEvaluator.diff(before, after);
            session.setLastChangeSummary(change.getSummary());
            chatLog.system(change.getSummary());

            ScrollGuardResult guard = changeEvaluator.scrollGuard(action, before, after);
            if (guard.isChecked()) {
                if (guard.isStuck()) {
                    int stalls = session.incrementScrollStall();
                    chatLog.system("Scroll progress is too small (moved " + guard.getDeltaY() + "px). stall=" + stalls);
                } else {
                    session.resetScrollStall();
                }
                if (session.getScrollStallCount() >= MAX_SCROLL_STALLS) {
                    chatLog.assistant("Scroll no longer makes progress, so the agent stopped to avoid an infinite scroll loop.");
                    return StopReason.SCROLL_STALL;
                }
            } else {
                session.resetScrollStall();
            }

            if (!change.isChanged()) {
                int stagnation = session.incrementStagnation();
                if (decision.hasFallbackAction()) {
                    runFallback(session, decision, before);
                    if (!session.isRunning()) {
                        return null;
                    }
                }
                if (stagnation >= config.getMaxStagnationSteps()) {
                    chatLog.assistant("Stopped: no meaningful state change for " + stagnation + " consecutive steps.");
                    return StopReason.STAGNATION;
                }
            } else {
                session.resetStagnation();
            }
        }
        return null;
    }

    private void runFallback(Session session, Decision decision, Observation before) throws InterruptedException {
        BrowserAction fallback = normalizer.normalize(decision.getFallbackAction(), before);
        if (fallback == null || fallback.is(ActionType.FINISH)) {
            return;
        }
        String description = ActionDescriber.describe(fallback);
        if (riskGate.assess(fallback, before, session.getConfig()) != null) {
            chatLog.system("Skipped fallback that needs manual approval: " + description);
            return;
        }
        chatLog.assistant("Low change detected; running fallback: " + description);
        ExecutionResult result = execute(fallback);
        if (!result.isOk()) {
            chatLog.system("Fallback failed: " + result.getMessage());
        }
        clock.sleep(session.getConfig().getSettleDelayMs());
    }

    private ExecutionResult execute(BrowserAction action) throws InterruptedException {
        if (action.is(ActionType.WAIT)) {
            int ms = action.getArgs().getMs() != null ? action.getArgs().getMs() : ActionNormalizer.DEFAULT_WAIT_MS;
            clock.sleep(ms);
            return ExecutionResult.ok("Waited for " + ms + " ms");
        }
        try {
            ExecutionResult result = pageExecutor.performAction(action);
            return result != null ? result : ExecutionResult.failed("Action failed.");
        } catch (IOException e) {
            return ExecutionResult.failed(e.getMessage());
        }
    }

    /**
     * Snapshot the page. A non-null {@code screenshotLabel} also echoes the screenshot to the chat.
     *
     * @throws IOException when the page is unreachable, not http(s), or outside the allow-list
     */
    private Observation observe(Session session, String screenshotLabel) throws IOException, InterruptedException {
        if (!pageExecutor.ping()) {
            throw new IOException("Page executor is not reachable.");
        }
        PageState state = pageExecutor.getPageState();
        if (state == null) {
            throw new IOException("Failed to collect page state.");
        }
        String url = state.getUrl() != null && !state.getUrl().isBlank() ? state.getUrl() : session.getTargetUrl();
        if (!UrlPolicy.isAutomatable(url)) {
            throw new IOException("Current URL is not automatable.");
        }
        if (!UrlPolicy.isAllowedDomain(url, session.getConfig().getAllowedDomains())) {
            throw new IOException("Current domain is not in the allowlist.");
        }
        session.setTargetUrl(url);

        Screenshot screenshot = null;
        try {
            screenshot = pageExecutor.captureScreenshot();
            if (screenshot != null && screenshotLabel != null) {
                chatLog.screenshot(screenshot.getDataUrl(), screenshotLabel);
            }
        } catch (IOException e) {
            chatLog.system("Screenshot capture failed: " + e.getMessage());
        }
        return Observation.from(state, url, screenshot, clock.now());
    }

    private String currentPageUrl() {
        if (!pageExecutor.ping()) {
            throw new IllegalStateException("No active page was found.");
        }
        try {
            PageState state = pageExecutor.getPageState();
            return state != null ? state.getUrl() : null;
        } catch (IOException e) {
            throw new IllegalStateException("No active page was found: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while reading the active page.", e);
        }
    }

    private void stopSession(Session session, StopReason reason, String message) {
        if (session.markStopped(reason, clock.now())) {
            if (message != null) {
                chatLog.system(message);
            }
            cleanup(session);
        }
    }

    /**
     * Runs once per session whichever path ends it.
     */
    private void cleanup(Session session) {
        if (!session.claimCleanup()) {
            return;
        }
        session.setPendingApproval(null);
        session.resetScrollStall();
        session.touch(clock.now());
        if (current == session) {
            updateIndicator(false, session.getStep());
        }
        chatLog.flush();
        AppLogger.get().info("[SessionController] Session " + session.getId() + " ended: "
            + session.getStopReason().getWireName() + " after " + session.getStep() + " step(s)");
    }

    private void updateIndicator(boolean active, int step) {
        try {
            pageExecutor.setRunningIndicator(active, step);
        } catch (IOException e) {
            AppLogger.get().warn("[SessionController] Running indicator update failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private String newSessionId() {
        StringBuilder suffix = new StringBuilder();
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < 4; i++) {
            suffix.append(Character.forDigit(random.nextInt(36), 36));
        }
        return "s-" + SESSION_STAMP.format(Instant.ofEpochMilli(clock.now())) + "-" + suffix;
    }
}
