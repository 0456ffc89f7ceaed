package com.pagepilot.decision;

import com.pagepilot.models.ActionArgs;
import com.pagepilot.models.BrowserAction;
import com.pagepilot.models.Observation;
import com.pagepilot.models.PageElement;
import com.pagepilot.util.Values;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Short human-readable forms of actions for chat messages and approval prompts.
 */
public final class ActionDescriber {

    public static final int TARGET_TEXT_LIMIT = 140;

    private ActionDescriber() {
    }

    public static String describe(BrowserAction action) {
        if (action == null || action.getType() == null) {
            return "invalid action";
        }
        String elementId = action.getTarget().getElementId();
        String idPart = elementId != null && !elementId.isEmpty() ? " " + elementId : "";
        ActionArgs args = action.getArgs();
        switch (action.getType()) {
            case CLICK:
                return "click" + idPart;
            case CLICK_AT: {
                double x = args.getX() != null ? args.getX() : 0;
                double y = args.getY() != null ? args.getY() : 0;
                if (Boolean.TRUE.equals(args.getNormalized())) {
                    return String.format(Locale.ROOT, "click_at (%.3f, %.3f)", x, y);
                }
                return "click_at (" + Math.round(x) + ", " + Math.round(y) + ")";
            }
            case TYPE:
                return "type" + idPart + " \"" + Values.truncate(args.getText(), 40) + "\"";
            case SCROLL:
                return "scroll dy=" + args.getDy();
            case KEYPRESS:
                return "keypress \"" + args.getKey() + "\"";
            case NAVIGATE:
                return "navigate " + Values.safeUrl(args.getUrl());
            case NEW_TAB:
                return "new_tab " + Values.safeUrl(args.getUrl());
            case WAIT:
                return "wait " + args.getMs() + "ms";
            case FINISH:
                return "finish";
            default:
                return action.getType().getWireName();
        }
    }

    public static String announce(int step, BrowserAction action, String reasoning) {
        if (reasoning != null && !reasoning.isEmpty()) {
            return "Step " + step + ": " + describe(action) + "\nReason: " + reasoning;
        }
        return "Step " + step + ": " + describe(action);
    }

    /**
     * Label, text, placeholder and aria label of the targeted element, joined with " | ".
     */
    public static String targetText(BrowserAction action, Observation observation) {
        if (action == null || observation == null) {
            return "";
        }
        PageElement element = observation.findElement(action.getTarget().getElementId());
        if (element == null) {
            return "";
        }
        List<String> pieces = new ArrayList<>();
        for (String value : new String[] {element.getLabel(), element.getText(), element.getPlaceholder(), element.getAriaLabel()}) {
            if (value != null && !value.trim().isEmpty()) {
                pieces.add(value.trim());
            }
        }
        return Values.truncate(String.join(" | ", pieces), TARGET_TEXT_LIMIT);
    }
}
