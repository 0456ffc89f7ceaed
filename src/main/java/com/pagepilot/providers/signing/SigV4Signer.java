package com.pagepilot.providers.signing;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * AWS Signature Version 4 for JSON POST requests with an empty query string.
 * Pure: the signing time is passed in, nothing is read from the environment.
 */
public final class SigV4Signer {

    public static final String ALGORITHM = "AWS4-HMAC-SHA256";
    private static final String TERMINATOR = "aws4_request";
    private static final String CONTENT_TYPE = "application/json";
    private static final DateTimeFormatter AMZ_DATE =
        DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private final String accessKeyId;
    private final String secretAccessKey;
    private final String sessionToken;
    private final String region;
    private final String service;

    public SigV4Signer(String accessKeyId, String secretAccessKey, String sessionToken,
                       String region, String service) {
        if (accessKeyId == null || accessKeyId.isBlank() || secretAccessKey == null || secretAccessKey.isBlank()) {
            throw new IllegalArgumentException("Access key ID and secret access key are required");
        }
        if (region == null || region.isBlank() || service == null || service.isBlank()) {
            throw new IllegalArgumentException("Region and service are required");
        }
        this.accessKeyId = accessKeyId.trim();
        this.secretAccessKey = secretAccessKey.trim();
        this.sessionToken = sessionToken == null ? "" : sessionToken.trim();
        this.region = region.trim();
        this.service = service.trim();
    }

    public SignedRequest sign(String method, String host, String rawPath, String body, Instant now) {
        String amzDate = AMZ_DATE.format(now);
        String dateStamp = amzDate.substring(0, 8);
        String payloadHash = sha256Hex(body == null ? "" : body);

        Map<String, String> canonicalHeaders = new TreeMap<>();
        canonicalHeaders.put("content-type", CONTENT_TYPE);
        canonicalHeaders.put("host", host);
        canonicalHeaders.put("x-amz-content-sha256", payloadHash);
        canonicalHeaders.put("x-amz-date", amzDate);
        if (!sessionToken.isEmpty()) {
            canonicalHeaders.put("x-amz-security-token", sessionToken);
        }

        StringBuilder headerBlock = new StringBuilder();
        for (Map.Entry<String, String> entry : canonicalHeaders.entrySet()) {
            headerBlock.append(entry.getKey()).append(':').append(normalizeHeaderValue(entry.getValue())).append('\n');
        }
        String signedHeaders = String.join(";", canonicalHeaders.keySet());

        String canonicalRequest = String.join("\n",
            method.toUpperCase(),
            canonicalUri(rawPath),
            "",
            headerBlock.toString(),
            signedHeaders,
            payloadHash);

        String scope = dateStamp + "/" + region + "/" + service + "/" + TERMINATOR;
        String stringToSign = String.join("\n",
            ALGORITHM,
            amzDate,
            scope,
            sha256Hex(canonicalRequest));

        byte[] signingKey = deriveSigningKey(secretAccessKey, dateStamp, region, service);
        String signature = toHex(hmacSha256(signingKey, stringToSign));

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", CONTENT_TYPE);
        headers.put("X-Amz-Date", amzDate);
        headers.put("X-Amz-Content-Sha256", payloadHash);
        headers.put("Authorization", ALGORITHM
            + " Credential=" + accessKeyId + "/" + scope
            + ", SignedHeaders=" + signedHeaders
            + ", Signature=" + signature);
        if (!sessionToken.isEmpty()) {
            headers.put("X-Amz-Security-Token", sessionToken);
        }
        return new SignedRequest(canonicalRequest, stringToSign, signature, headers);
    }

    /**
     * URI-encode every path segment once more, as services other than S3 expect.
     * Unreserved characters are kept; everything else is percent-encoded with uppercase hex.
     */
    public static String canonicalUri(String rawPath) {
        if (rawPath == null || rawPath.isEmpty()) {
            return "/";
        }
        String[] segments = rawPath.split("/", -1);
        List<String> encoded = new ArrayList<>(segments.length);
        for (String segment : segments) {
            encoded.add(uriEncode(segment));
        }
        String path = String.join("/", encoded);
        return path.startsWith("/") ? path : "/" + path;
    }

    static String uriEncode(String value) {
        StringBuilder sb = new StringBuilder();
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            char c = (char) (b & 0xff);
            if ((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                || c == '-' || c == '_' || c == '.' || c == '~') {
                sb.append(c);
            } else {
                sb.append('%').append(String.format("%02X", b & 0xff));
            }
        }
        return sb.toString();
    }

    static String normalizeHeaderValue(String value) {
        return value == null ? "" : value.trim().replaceAll("\\s+", " ");
    }

    public static byte[] deriveSigningKey(String secretAccessKey, String dateStamp, String region, String service) {
        byte[] kDate = hmacSha256(("AWS4" + secretAccessKey).getBytes(StandardCharsets.UTF_8), dateStamp);
        byte[] kRegion = hmacSha256(kDate, region);
        byte[] kService = hmacSha256(kRegion, service);
        return hmacSha256(kService, TERMINATOR);
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return toHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    static byte[] hmacSha256(byte[] key, String message) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(key, "HmacSHA256"));
            return mac.doFinal(message.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    public static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
