package com.pagepilot.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;

/**
 * Small value helpers shared by the normalizer, the config sanitizer and chat formatting.
 */
public final class Values {

    private Values() {
    }

    /**
     * Reads a number from a loosely-typed node: numbers as-is, numeric strings parsed.
     * Returns NaN when the node holds nothing usable.
     */
    public static double number(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Double.NaN;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue() ? 1 : 0;
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            if (text.isEmpty()) {
                return 0;
            }
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }

    public static double clamp(double value, double min, double max, double fallback) {
        if (!Double.isFinite(value)) {
            return fallback;
        }
        return Math.max(min, Math.min(max, value));
    }

    public static double clamp(JsonNode node, double min, double max, double fallback) {
        return clamp(number(node), min, max, fallback);
    }

    public static String text(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        return node.asText();
    }

    public static String truncate(String value, int maxLen) {
        String text = value == null ? "" : value;
        if (text.length() <= maxLen) {
            return text;
        }
        return text.substring(0, Math.max(0, maxLen - 1)) + "...";
    }

    /**
     * Origin and path only, so query strings never end up in chat or logs.
     */
    public static String safeUrl(String url) {
        if (url == null || url.isEmpty()) {
            return "(no-url)";
        }
        try {
            URI parsed = new URI(url);
            if (parsed.getScheme() == null || parsed.getHost() == null) {
                return url;
            }
            String port = parsed.getPort() >= 0 ? ":" + parsed.getPort() : "";
            String path = parsed.getRawPath() == null || parsed.getRawPath().isEmpty() ? "/" : parsed.getRawPath();
            return parsed.getScheme() + "://" + parsed.getHost() + port + path;
        } catch (Exception e) {
            return url;
        }
    }
}
