package com.pagepilot.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a session ended.
 */
public enum StopReason {
    GOAL_COMPLETE("goal_complete"),
    STEP_LIMIT("step_limit"),
    STAGNATION("stagnation"),
    SCROLL_STALL("scroll_stall"),
    NOT_APPROVED("not_approved"),
    UNPARSEABLE_RESPONSE("unparseable_response"),
    PROVIDER_ERROR("provider_error"),
    EXECUTOR_ERROR("executor_error"),
    RUNTIME_ERROR("runtime_error"),
    USER_STOP("user_stop"),
    REPLACED("replaced");

    private final String wireName;

    StopReason(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
