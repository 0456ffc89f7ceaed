package com.pagepilot.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A normalized, executable page action. Serializes as {@code {type, target, args}} for the executor.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BrowserAction {

    private ActionType type;
    private ActionTarget target = new ActionTarget();
    private ActionArgs args = new ActionArgs();

    public BrowserAction() {
    }

    public BrowserAction(ActionType type) {
        this.type = type;
    }

    public ActionType getType() {
        return type;
    }

    public void setType(ActionType type) {
        this.type = type;
    }

    public ActionTarget getTarget() {
        return target;
    }

    public void setTarget(ActionTarget target) {
        this.target = target != null ? target : new ActionTarget();
    }

    public ActionArgs getArgs() {
        return args;
    }

    public void setArgs(ActionArgs args) {
        this.args = args != null ? args : new ActionArgs();
    }

    public boolean is(ActionType candidate) {
        return type == candidate;
    }
}
