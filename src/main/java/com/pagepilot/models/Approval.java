package com.pagepilot.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Human-in-the-loop gate for one flagged action. Decision fields are written by the
 * control surface thread and read by the waiting session loop.
 */
public class Approval {

    private final String id;
    private final int step;
    private final BrowserAction action;
    private final String actionText;
    private final String reason;
    private final String targetText;
    private final long requestedAt;
    private volatile ApprovalDecision decision;
    private volatile long decidedAt;

    public Approval(String id, int step, BrowserAction action, String actionText,
                    String reason, String targetText, long requestedAt) {
        this.id = id;
        this.step = step;
        this.action = action;
        this.actionText = actionText;
        this.reason = reason;
        this.targetText = targetText;
        this.requestedAt = requestedAt;
    }

    public String getId() {
        return id;
    }

    public int getStep() {
        return step;
    }

    @JsonIgnore
    public BrowserAction getAction() {
        return action;
    }

    public String getActionText() {
        return actionText;
    }

    public String getReason() {
        return reason;
    }

    public String getTargetText() {
        return targetText;
    }

    public long getRequestedAt() {
        return requestedAt;
    }

    @JsonIgnore
    public ApprovalDecision getDecision() {
        return decision;
    }

    @JsonIgnore
    public long getDecidedAt() {
        return decidedAt;
    }

    @JsonIgnore
    public boolean isResolved() {
        return decision != null;
    }

    /**
     * First resolution wins; later calls are ignored.
     */
    public synchronized boolean resolve(ApprovalDecision value, long at) {
        if (decision != null || value == null) {
            return false;
        }
        this.decidedAt = at;
        this.decision = value;
        return true;
    }
}
