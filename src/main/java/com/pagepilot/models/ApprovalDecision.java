package com.pagepilot.models;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ApprovalDecision {
    APPROVED("approved"),
    REJECTED("rejected"),
    TIMEOUT("timeout");

    private final String wireName;

    ApprovalDecision(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Maps the control-surface verbs ({@code approve} / {@code reject}); anything else is null.
     */
    public static ApprovalDecision fromVerb(String verb) {
        if (verb == null) {
            return null;
        }
        switch (verb.trim().toLowerCase()) {
            case "approve":
                return APPROVED;
            case "reject":
                return REJECTED;
            default:
                return null;
        }
    }
}
