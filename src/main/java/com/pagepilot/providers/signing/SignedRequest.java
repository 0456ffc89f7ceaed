package com.pagepilot.providers.signing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of signing one request: the headers to send plus the intermediate artifacts.
 */
public class SignedRequest {

    private final String canonicalRequest;
    private final String stringToSign;
    private final String signature;
    private final Map<String, String> headers;

    public SignedRequest(String canonicalRequest, String stringToSign, String signature, Map<String, String> headers) {
        this.canonicalRequest = canonicalRequest;
        this.stringToSign = stringToSign;
        this.signature = signature;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public String getCanonicalRequest() {
        return canonicalRequest;
    }

    public String getStringToSign() {
        return stringToSign;
    }

    public String getSignature() {
        return signature;
    }

    /**
     * Headers to attach to the outgoing request. Host is not included; the HTTP client sets it.
     */
    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getAuthorization() {
        return headers.get("Authorization");
    }
}
