package com.pagepilot.session;

import java.util.Collections;
import java.util.List;

public class ChangeResult {

    private final List<String> reasons;
    private final String summary;

    ChangeResult(List<String> reasons) {
        this.reasons = Collections.unmodifiableList(reasons);
        this.summary = reasons.isEmpty() ? "State change: none" : "State change: " + String.join(" / ", reasons);
    }

    public boolean isChanged() {
        return !reasons.isEmpty();
    }

    public List<String> getReasons() {
        return reasons;
    }

    public String getSummary() {
        return summary;
    }
}
