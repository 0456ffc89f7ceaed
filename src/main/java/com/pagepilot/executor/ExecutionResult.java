package com.pagepilot.executor;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ExecutionResult {

    private boolean ok;
    private String message;

    public ExecutionResult() {
    }

    public ExecutionResult(boolean ok, String message) {
        this.ok = ok;
        this.message = message;
    }

    public static ExecutionResult ok(String message) {
        return new ExecutionResult(true, message);
    }

    public static ExecutionResult failed(String message) {
        return new ExecutionResult(false, message);
    }

    public boolean isOk() {
        return ok;
    }

    public void setOk(boolean ok) {
        this.ok = ok;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
