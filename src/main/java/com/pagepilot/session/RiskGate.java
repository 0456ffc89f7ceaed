package com.pagepilot.session;

import com.pagepilot.AppLogger;
import com.pagepilot.decision.ActionDescriber;
import com.pagepilot.models.ActionType;
import com.pagepilot.models.AgentConfig;
import com.pagepilot.models.Approval;
import com.pagepilot.models.ApprovalDecision;
import com.pagepilot.models.BrowserAction;
import com.pagepilot.models.Observation;
import com.pagepilot.models.PageElement;
import com.pagepilot.models.Session;
import com.pagepilot.storage.ChatLog;
import com.pagepilot.util.SessionClock;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Flags actions that need a human decision and blocks the loop until one arrives.
 */
public class RiskGate {

    public static final long POLL_INTERVAL_MS = 250;

    private final ChatLog chatLog;
    private final SessionClock clock;

    public RiskGate(ChatLog chatLog, SessionClock clock) {
        this.chatLog = chatLog;
        this.clock = clock;
    }

    /**
     * @return why the action needs approval, or null when it may run unattended
     */
    public String assess(BrowserAction action, Observation observation, AgentConfig config) {
        if (action == null || !config.isBlockHighRisk()) {
            return null;
        }
        if (action.is(ActionType.CLICK_AT)) {
            return "Coordinate click requires manual confirmation because element semantics are ambiguous.";
        }
        List<String> keywords = config.getHighRiskKeywords();
        if (action.is(ActionType.TYPE)) {
            String typed = action.getArgs().getText() == null ? "" : action.getArgs().getText().toLowerCase(Locale.ROOT);
            String matched = firstMatch(typed, keywords);
            if (matched != null) {
                return "Typed text matched high-risk keyword \"" + matched + "\".";
            }
        }
        if (!action.is(ActionType.CLICK) && !action.is(ActionType.KEYPRESS)) {
            return null;
        }

        StringBuilder context = new StringBuilder();
        PageElement element = observation != null ? observation.findElement(action.getTarget().getElementId()) : null;
        if (element != null) {
            context.append(nullToEmpty(element.getLabel())).append(' ').append(nullToEmpty(element.getText()));
        }
        if (action.getTarget().getSelector() != null) {
            context.append(' ').append(action.getTarget().getSelector());
        }
        String matched = firstMatch(context.toString().toLowerCase(Locale.ROOT), keywords);
        if (matched == null) {
            return null;
        }
        return "Element context matched high-risk keyword \"" + matched + "\".";
    }

    /**
     * Publish a pending approval on the session and wait for it to be resolved, to time out,
     * or for the session to stop.
     *
     * @return true only for an explicit approval
     */
    public boolean requestApproval(Session session, BrowserAction action, Observation observation, String reason)
        throws InterruptedException {
        Approval approval = new Approval(
            "a-" + UUID.randomUUID(),
            session.getStep(),
            action,
            ActionDescriber.describe(action),
            reason != null && !reason.isBlank() ? reason : "High-risk operation detected.",
            ActionDescriber.targetText(action, observation),
            clock.now());
        session.setPendingApproval(approval);
        session.touch(clock.now());
        chatLog.system("Manual approval required before executing: " + approval.getActionText()
            + "\nReason: " + approval.getReason());

        ApprovalDecision decision = awaitDecision(session, approval);
        clearPending(session, approval);

        if (decision == ApprovalDecision.APPROVED) {
            chatLog.system("Manual approval granted.");
            return true;
        }
        if (decision == ApprovalDecision.REJECTED) {
            chatLog.system("Manual approval rejected.");
            return false;
        }
        if (decision == ApprovalDecision.TIMEOUT) {
            chatLog.system("Manual approval timed out.");
        }
        return false;
    }

    /**
     * Resolve the session's pending approval. The id must match the pending one.
     *
     * @throws IllegalArgumentException for an empty or unknown id, or a decision other than approve/reject
     */
    public void resolve(Session session, String approvalId, ApprovalDecision decision) {
        String id = approvalId == null ? "" : approvalId.trim();
        if (id.isEmpty()) {
            throw new IllegalArgumentException("approvalId is empty.");
        }
        Approval pending = session != null ? session.getPendingApproval() : null;
        if (pending == null || !pending.getId().equals(id)) {
            throw new IllegalArgumentException("No pending approval matches approvalId.");
        }
        if (decision != ApprovalDecision.APPROVED && decision != ApprovalDecision.REJECTED) {
            throw new IllegalArgumentException("Decision must be approve or reject.");
        }
        if (pending.resolve(decision, clock.now())) {
            session.touch(clock.now());
            AppLogger.get().info("[RiskGate] Approval " + id + " " + decision.getWireName());
        }
    }

    private ApprovalDecision awaitDecision(Session session, Approval approval) throws InterruptedException {
        long timeoutMs = session.getConfig().getApprovalTimeoutMs();
        long startedAt = clock.now();
        while (session.isRunning() && session.getPendingApproval() == approval && !approval.isResolved()) {
            if (clock.now() - startedAt > timeoutMs) {
                approval.resolve(ApprovalDecision.TIMEOUT, clock.now());
                break;
            }
            clock.sleep(POLL_INTERVAL_MS);
        }
        return approval.getDecision();
    }

    private void clearPending(Session session, Approval approval) {
        if (session.getPendingApproval() == approval) {
            session.setPendingApproval(null);
            session.touch(clock.now());
        }
    }

    private static String firstMatch(String haystack, List<String> keywords) {
        if (keywords == null) {
            return null;
        }
        for (String keyword : keywords) {
            if (!keyword.isEmpty() && haystack.contains(keyword)) {
                return keyword;
            }
        }
        return null;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
