package com.pagepilot.models;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Parsed provider output for one iteration. The actions stay loosely typed until
 * the normalizer grounds them against an observation.
 */
public class Decision {

    private final String reasoning;
    private final JsonNode action;
    private final JsonNode successCriteria;
    private final JsonNode fallbackAction;
    private final String finalAnswer;

    public Decision(String reasoning, JsonNode action, JsonNode successCriteria,
                    JsonNode fallbackAction, String finalAnswer) {
        this.reasoning = reasoning;
        this.action = action;
        this.successCriteria = successCriteria;
        this.fallbackAction = fallbackAction;
        this.finalAnswer = finalAnswer;
    }

    public static Decision fromJson(JsonNode node) {
        JsonNode reasoning = node.path("reasoning");
        JsonNode finalAnswer = node.path("final_answer");
        JsonNode criteria = node.get("success_criteria");
        JsonNode fallback = node.get("fallback_action");
        return new Decision(
            reasoning.isTextual() ? reasoning.asText().trim() : "",
            node.get("action"),
            criteria != null && criteria.isArray() ? criteria : null,
            fallback != null && fallback.isObject() ? fallback : null,
            finalAnswer.isTextual() ? finalAnswer.asText().trim() : null
        );
    }

    public String getReasoning() {
        return reasoning;
    }

    public JsonNode getAction() {
        return action;
    }

    public JsonNode getSuccessCriteria() {
        return successCriteria;
    }

    public JsonNode getFallbackAction() {
        return fallbackAction;
    }

    public boolean hasFallbackAction() {
        return fallbackAction != null;
    }

    public String getFinalAnswer() {
        return finalAnswer;
    }
}
