package com.pagepilot.decision;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.pagepilot.models.Decision;
import com.pagepilot.util.Values;

public class DecisionParser {

    public static final int SNIPPET_LIMIT = 320;

    private final ObjectReader strictReader;

    public DecisionParser(ObjectMapper objectMapper) {
        ObjectMapper mapper = objectMapper != null ? objectMapper : new ObjectMapper();
        this.strictReader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Extract a decision from raw provider text. Prose and code fences around the object are tolerated.
     *
     * @throws DecisionParseException with {@link DecisionParseException#INVALID_ACTION_JSON} when no object
     *                                carrying an {@code action} can be recovered
     */
    public Decision parse(String rawContent, String providerLabel) throws DecisionParseException {
        JsonNode parsed = parseLoose(rawContent);
        if (parsed != null && parsed.isObject() && isTruthy(parsed.get("action"))) {
            return Decision.fromJson(parsed);
        }
        throw new DecisionParseException(
            providerLabel + " response did not contain a valid action JSON.",
            DecisionParseException.INVALID_ACTION_JSON,
            Values.truncate(rawContent, SNIPPET_LIMIT));
    }

    /**
     * Strict parse of the whole text, then the first balanced {@code {...}} block.
     *
     * @return the parsed node, or null
     */
    public JsonNode parseLoose(String raw) {
        if (raw == null) {
            return null;
        }
        String content = raw.trim();
        if (content.isEmpty()) {
            return null;
        }
        JsonNode whole = tryRead(content);
        if (whole != null) {
            return whole;
        }
        String block = extractFirstObject(content);
        return block != null ? tryRead(block) : null;
    }

    private JsonNode tryRead(String text) {
        try {
            return strictReader.readTree(text);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    /**
     * Scan from the first '{' tracking string and escape state; return the text up to the
     * brace that closes it, or null if it never closes.
     */
    static String extractFirstObject(String content) {
        int start = content.indexOf('{');
        if (start < 0) {
            return null;
        }
        int depth = 0;
        boolean inString = false;
        boolean escape = false;
        for (int i = start; i < content.length(); i++) {
            char c = content.charAt(i);
            if (escape) {
                escape = false;
                continue;
            }
            if (c == '\\') {
                escape = true;
                continue;
            }
            if (c == '"') {
                inString = !inString;
                continue;
            }
            if (inString) {
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return content.substring(start, i + 1);
                }
            }
        }
        return null;
    }

    private static boolean isTruthy(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            return !node.asText().isEmpty();
        }
        if (node.isNumber()) {
            return node.doubleValue() != 0;
        }
        return true;
    }
}
