package com.pagepilot.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ActionType {
    CLICK("click"),
    CLICK_AT("click_at"),
    TYPE("type"),
    SCROLL("scroll"),
    KEYPRESS("keypress"),
    NAVIGATE("navigate"),
    NEW_TAB("new_tab"),
    WAIT("wait"),
    FINISH("finish");

    private final String wireName;

    ActionType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Case-insensitive lookup; returns null for anything outside the allow-list.
     */
    @JsonCreator
    public static ActionType fromWire(String value) {
        if (value == null) {
            return null;
        }
        String key = value.trim().toLowerCase(Locale.ROOT);
        for (ActionType type : values()) {
            if (type.wireName.equals(key)) {
                return type;
            }
        }
        return null;
    }
}
