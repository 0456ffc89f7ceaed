package com.pagepilot.executor;

import com.pagepilot.models.BrowserAction;
import com.pagepilot.models.PageState;
import com.pagepilot.models.Screenshot;

import java.io.IOException;

/**
 * The in-page automation side: reads page state and performs normalized actions.
 * {@code wait} actions never reach an executor.
 */
public interface PageExecutor {

    /**
     * Current page state of the controlled tab.
     *
     * @throws IOException if the page cannot be reached
     */
    PageState getPageState() throws IOException, InterruptedException;

    ExecutionResult performAction(BrowserAction action) throws IOException, InterruptedException;

    /**
     * @return true when the executor answers
     */
    boolean ping();

    void setRunningIndicator(boolean active, int step) throws IOException, InterruptedException;

    /**
     * @return the visible viewport as a data URL screenshot, or null when capture is unavailable
     */
    Screenshot captureScreenshot() throws IOException, InterruptedException;
}
