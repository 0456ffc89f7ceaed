package com.pagepilot.models;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One agent run toward a goal. Counters are written by the loop thread only; the
 * running flag, instruction queue and approval slot are shared with control threads.
 */
public class Session {

    public static final int MAX_INSTRUCTIONS_PER_STEP = 3;

    private final String id;
    private final String goal;
    private final AgentConfig config;
    private final long startedAt;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicBoolean cleanedUp = new AtomicBoolean(false);
    private final CountDownLatch loopExited = new CountDownLatch(1);
    private final Deque<String> pendingInstructions = new ArrayDeque<>();

    private String targetUrl;
    private volatile int step;
    private int stagnationCount;
    private int scrollStallCount;
    private BrowserAction lastAction;
    private String lastChangeSummary = "";
    private volatile Approval pendingApproval;
    private volatile StopReason stopReason;
    private volatile long updatedAt;

    public Session(String id, String goal, AgentConfig config, String targetUrl, long startedAt) {
        this.id = id;
        this.goal = goal;
        this.config = config;
        this.targetUrl = targetUrl;
        this.startedAt = startedAt;
        this.updatedAt = startedAt;
    }

    public String getId() {
        return id;
    }

    public String getGoal() {
        return goal;
    }

    public AgentConfig getConfig() {
        return config;
    }

    public long getStartedAt() {
        return startedAt;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Flip the session to stopped. Only the first call records a reason and returns true.
     */
    public boolean markStopped(StopReason reason, long at) {
        if (!running.compareAndSet(true, false)) {
            return false;
        }
        this.stopReason = reason;
        this.updatedAt = at;
        return true;
    }

    /**
     * Claims the one-time cleanup. Returns true for the first caller.
     */
    public boolean claimCleanup() {
        return cleanedUp.compareAndSet(false, true);
    }

    /**
     * Called by the loop thread as its very last step.
     */
    public void markLoopExited() {
        loopExited.countDown();
    }

    /**
     * @return true once the loop has exited, false if it is still running after {@code timeoutMs}
     */
    public boolean awaitLoopExit(long timeoutMs) throws InterruptedException {
        return loopExited.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    public StopReason getStopReason() {
        return stopReason;
    }

    public String getTargetUrl() {
        return targetUrl;
    }

    public void setTargetUrl(String targetUrl) {
        this.targetUrl = targetUrl;
    }

    public int getStep() {
        return step;
    }

    public int nextStep() {
        return ++step;
    }

    public int getMaxSteps() {
        return config.getMaxSteps();
    }

    public int getStagnationCount() {
        return stagnationCount;
    }

    public int incrementStagnation() {
        return ++stagnationCount;
    }

    public void resetStagnation() {
        stagnationCount = 0;
    }

    public int getMaxStagnationSteps() {
        return config.getMaxStagnationSteps();
    }

    public int getScrollStallCount() {
        return scrollStallCount;
    }

    public int incrementScrollStall() {
        return ++scrollStallCount;
    }

    public void resetScrollStall() {
        scrollStallCount = 0;
    }

    public BrowserAction getLastAction() {
        return lastAction;
    }

    public void setLastAction(BrowserAction lastAction) {
        this.lastAction = lastAction;
    }

    public String getLastChangeSummary() {
        return lastChangeSummary;
    }

    public void setLastChangeSummary(String lastChangeSummary) {
        this.lastChangeSummary = lastChangeSummary != null ? lastChangeSummary : "";
    }

    public Approval getPendingApproval() {
        return pendingApproval;
    }

    public void setPendingApproval(Approval pendingApproval) {
        this.pendingApproval = pendingApproval;
    }

    public synchronized void enqueueInstruction(String text) {
        pendingInstructions.addLast(text);
    }

    /**
     * Remove and return up to {@code max} queued instructions, oldest first.
     */
    public synchronized List<String> drainInstructions(int max) {
        List<String> drained = new ArrayList<>();
        while (drained.size() < max && !pendingInstructions.isEmpty()) {
            drained.add(pendingInstructions.pollFirst());
        }
        return drained;
    }

    public synchronized int getPendingInstructionCount() {
        return pendingInstructions.size();
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    public void touch(long at) {
        this.updatedAt = at;
    }
}
