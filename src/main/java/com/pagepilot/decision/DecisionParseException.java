package com.pagepilot.decision;

/**
 * Provider text that does not contain a usable decision object.
 */
public class DecisionParseException extends Exception {

    public static final String INVALID_ACTION_JSON = "INVALID_ACTION_JSON";

    private final String code;
    private final String rawSnippet;

    public DecisionParseException(String message, String code, String rawSnippet) {
        super(message);
        this.code = code;
        this.rawSnippet = rawSnippet;
    }

    public String getCode() {
        return code;
    }

    /**
     * The offending provider output, already truncated.
     */
    public String getRawSnippet() {
        return rawSnippet;
    }

    public boolean isRetryable() {
        return INVALID_ACTION_JSON.equals(code);
    }
}
