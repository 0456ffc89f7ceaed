package com.pagepilot.decision;

import com.fasterxml.jackson.databind.JsonNode;
import com.pagepilot.models.ActionArgs;
import com.pagepilot.models.ActionTarget;
import com.pagepilot.models.ActionType;
import com.pagepilot.models.BrowserAction;
import com.pagepilot.models.Observation;
import com.pagepilot.models.PageElement;
import com.pagepilot.util.UrlPolicy;
import com.pagepilot.util.Values;

/**
 * Turns a loosely-typed proposed action into an executable one grounded in the current observation.
 * Anything that cannot be made safe to execute comes back as null.
 */
public class ActionNormalizer {

    public static final int MAX_SCROLL = 4000;
    public static final int DEFAULT_WAIT_MS = 1000;

    public BrowserAction normalize(JsonNode rawAction, Observation observation) {
        if (rawAction == null || !rawAction.isObject()) {
            return null;
        }
        JsonNode typeNode = rawAction.get("type");
        ActionType type = ActionType.fromWire(typeNode != null && typeNode.isValueNode() ? typeNode.asText() : null);
        if (type == null) {
            return null;
        }

        JsonNode target = rawAction.path("target");
        JsonNode args = rawAction.path("args").isObject() ? rawAction.get("args") : null;

        BrowserAction action = new BrowserAction(type);
        action.setTarget(resolveTarget(target, observation));
        ActionArgs out = action.getArgs();

        switch (type) {
            case CLICK:
                return action.getTarget().hasSelector() ? action : null;
            case CLICK_AT:
                return normalizeClickAt(action, rawAction, args, observation) ? action : null;
            case TYPE: {
                if (!action.getTarget().hasSelector()) {
                    return null;
                }
                JsonNode text = arg(args, "text");
                if (text == null || !text.isTextual() || text.asText().isEmpty()) {
                    return null;
                }
                out.setText(text.asText());
                out.setPressEnter(isTruthy(arg(args, "pressEnter")));
                return action;
            }
            case SCROLL:
                out.setDy((int) Math.round(Values.clamp(suggestScrollDy(arg(args, "dy"), observation),
                    -MAX_SCROLL, MAX_SCROLL, 900)));
                out.setDx((int) Math.round(Values.clamp(arg(args, "dx"), -MAX_SCROLL, MAX_SCROLL, 0)));
                return action;
            case KEYPRESS: {
                JsonNode key = arg(args, "key");
                out.setKey(key != null && key.isTextual() && !key.asText().isBlank() ? key.asText().trim() : "Enter");
                if (!action.getTarget().hasSelector()) {
                    action.setTarget(new ActionTarget());
                }
                return action;
            }
            case NAVIGATE:
            case NEW_TAB: {
                String url = UrlPolicy.normalizeNavigationUrl(urlCandidate(rawAction, args));
                if (url == null) {
                    return null;
                }
                out.setUrl(url);
                action.setTarget(new ActionTarget());
                return action;
            }
            case WAIT:
                out.setMs((int) Math.round(Values.clamp(arg(args, "ms"), 200, 10_000, DEFAULT_WAIT_MS)));
                action.setTarget(new ActionTarget());
                return action;
            case FINISH:
            default:
                return action;
        }
    }

    private ActionTarget resolveTarget(JsonNode target, Observation observation) {
        ActionTarget resolved = new ActionTarget();
        if (target == null || !target.isObject()) {
            return resolved;
        }
        JsonNode idNode = target.get("element_id");
        String elementId = idNode != null && idNode.isTextual() && !idNode.asText().isBlank()
            ? idNode.asText().trim()
            : null;
        if (elementId != null) {
            resolved.setElementId(elementId);
        }
        PageElement element = elementId != null && observation != null ? observation.findElement(elementId) : null;
        if (element != null && element.getSelector() != null && !element.getSelector().isBlank()) {
            resolved.setSelector(element.getSelector());
        } else {
            JsonNode selector = target.get("selector");
            if (selector != null && selector.isTextual() && !selector.asText().isBlank()) {
                resolved.setSelector(selector.asText().trim());
            }
        }
        return resolved;
    }

    private boolean normalizeClickAt(BrowserAction action, JsonNode rawAction, JsonNode args, Observation observation) {
        double x = firstFinite(arg(args, "x"), rawAction.get("x"), arg(args, "normalized_x"));
        double y = firstFinite(arg(args, "y"), rawAction.get("y"), arg(args, "normalized_y"));
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            return false;
        }

        JsonNode flag = arg(args, "normalized");
        boolean normalized = flag != null && flag.isBoolean()
            ? flag.booleanValue()
            : x >= 0 && x <= 1 && y >= 0 && y <= 1;

        ActionArgs out = action.getArgs();
        if (normalized) {
            out.setX(Values.clamp(x, 0, 1, 0.5));
            out.setY(Values.clamp(y, 0, 1, 0.5));
        } else {
            int width = observation != null ? observation.getViewportWidth() : 0;
            int height = observation != null ? observation.getViewportHeight() : 0;
            double maxX = Math.max(1, width - 1);
            double maxY = Math.max(1, height - 1);
            out.setX(Values.clamp(x, 0, maxX, Math.floor(maxX / 2)));
            out.setY(Values.clamp(y, 0, maxY, Math.floor(maxY / 2)));
        }
        out.setNormalized(normalized);
        out.setMoveMs((int) Math.round(Values.clamp(firstFinite(arg(args, "moveMs"), arg(args, "move_ms")), 80, 3000, 420)));
        out.setMoveSteps((int) Math.round(Values.clamp(firstFinite(arg(args, "moveSteps"), arg(args, "move_steps")), 2, 40, 14)));
        return true;
    }

    /**
     * Scrolls smaller than 65% of the preferred distance are bumped up to it, keeping direction.
     * The preferred distance is 82% of the viewport height (900 when unknown), at least 320.
     */
    static double suggestScrollDy(JsonNode rawDy, Observation observation) {
        int viewportHeight = observation != null ? observation.getViewportHeight() : 0;
        long preferred = Math.max(320, Math.round((viewportHeight > 0 ? viewportHeight : 900) * 0.82));
        double parsed = Values.number(rawDy);
        if (!Double.isFinite(parsed) || parsed == 0) {
            return preferred;
        }
        int sign = parsed >= 0 ? 1 : -1;
        double magnitude = Math.abs(parsed);
        long minMagnitude = Math.round(preferred * 0.65);
        if (magnitude < minMagnitude) {
            return sign * (double) preferred;
        }
        return sign * magnitude;
    }

    private static String urlCandidate(JsonNode rawAction, JsonNode args) {
        JsonNode fromArgs = arg(args, "url");
        if (fromArgs != null && fromArgs.isTextual()) {
            return fromArgs.asText();
        }
        JsonNode topLevel = rawAction.get("url");
        return topLevel != null && topLevel.isTextual() ? topLevel.asText() : "";
    }

    private static JsonNode arg(JsonNode args, String name) {
        if (args == null) {
            return null;
        }
        JsonNode value = args.get(name);
        return value == null || value.isNull() ? null : value;
    }

    private static double firstFinite(JsonNode... candidates) {
        for (JsonNode candidate : candidates) {
            double value = Values.number(candidate);
            if (Double.isFinite(value)) {
                return value;
            }
        }
        return Double.NaN;
    }

    private static boolean isTruthy(JsonNode node) {
        if (node == null) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.doubleValue() != 0;
        }
        if (node.isTextual()) {
            return !node.asText().isEmpty();
        }
        return true;
    }
}
