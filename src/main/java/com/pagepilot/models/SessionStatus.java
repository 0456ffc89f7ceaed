package com.pagepilot.models;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Snapshot of the controller state for the control surface.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionStatus {

    private final boolean running;
    private final String sessionId;
    private final String goal;
    private final int step;
    private final int maxSteps;
    private final Approval pendingApproval;
    private final StopReason stopReason;
    private final long updatedAt;

    private SessionStatus(boolean running, String sessionId, String goal, int step, int maxSteps,
                          Approval pendingApproval, StopReason stopReason, long updatedAt) {
        this.running = running;
        this.sessionId = sessionId;
        this.goal = goal;
        this.step = step;
        this.maxSteps = maxSteps;
        this.pendingApproval = pendingApproval;
        this.stopReason = stopReason;
        this.updatedAt = updatedAt;
    }

    public static SessionStatus of(Session session) {
        return new SessionStatus(
            session.isRunning(),
            session.getId(),
            session.getGoal(),
            session.getStep(),
            session.getMaxSteps(),
            session.getPendingApproval(),
            session.getStopReason(),
            session.getUpdatedAt()
        );
    }

    public static SessionStatus idle(long now) {
        return new SessionStatus(false, null, null, 0, 0, null, null, now);
    }

    public boolean isRunning() {
        return running;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getGoal() {
        return goal;
    }

    public int getStep() {
        return step;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    public Approval getPendingApproval() {
        return pendingApproval;
    }

    public StopReason getStopReason() {
        return stopReason;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }
}
