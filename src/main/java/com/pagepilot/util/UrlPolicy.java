package com.pagepilot.util;

import java.net.URI;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * URL checks applied to observed pages and to navigation targets.
 */
public final class UrlPolicy {

    private UrlPolicy() {
    }

    public static boolean isAutomatable(String url) {
        return url != null && (url.startsWith("http://") || url.startsWith("https://"));
    }

    /**
     * An empty allow-list allows everything; otherwise the host must equal an entry or be a subdomain of one.
     */
    public static boolean isAllowedDomain(String url, String allowlistRaw) {
        List<String> allowlist = Arrays.stream(String.valueOf(allowlistRaw == null ? "" : allowlistRaw).split(","))
            .map(entry -> entry.trim().toLowerCase(Locale.ROOT))
            .filter(entry -> !entry.isEmpty())
            .collect(Collectors.toList());
        if (allowlist.isEmpty()) {
            return true;
        }
        try {
            String host = URI.create(url).getHost();
            if (host == null) {
                return false;
            }
            String normalizedHost = host.toLowerCase(Locale.ROOT);
            return allowlist.stream()
                .anyMatch(domain -> normalizedHost.equals(domain) || normalizedHost.endsWith("." + domain));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Returns the URL when it parses with an http/https scheme and a host, otherwise null.
     */
    public static String normalizeNavigationUrl(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        try {
            URI parsed = new URI(candidate.trim());
            String scheme = parsed.getScheme();
            if (scheme == null) {
                return null;
            }
            String lower = scheme.toLowerCase(Locale.ROOT);
            if (!"http".equals(lower) && !"https".equals(lower)) {
                return null;
            }
            if (parsed.getHost() == null || parsed.getHost().isBlank()) {
                return null;
            }
            return parsed.toString();
        } catch (Exception e) {
            return null;
        }
    }
}
