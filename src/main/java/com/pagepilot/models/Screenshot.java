package com.pagepilot.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Captured viewport image as a data URL, plus a cheap hash used to tell two captures apart.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Screenshot {

    private String dataUrl;
    private String hash;

    public Screenshot() {
    }

    public Screenshot(String dataUrl, String hash) {
        this.dataUrl = dataUrl;
        this.hash = hash;
    }

    public static Screenshot of(String dataUrl) {
        if (dataUrl == null || dataUrl.isBlank()) {
            return null;
        }
        return new Screenshot(dataUrl, hash(dataUrl));
    }

    /**
     * 32-bit djb2-xor over the UTF-16 units, rendered as unsigned hex.
     */
    public static String hash(String value) {
        int hash = 5381;
        String text = value == null ? "" : value;
        for (int i = 0; i < text.length(); i++) {
            hash = (hash * 33) ^ text.charAt(i);
        }
        return Long.toHexString(hash & 0xffffffffL);
    }

    public String getDataUrl() {
        return dataUrl;
    }

    public void setDataUrl(String dataUrl) {
        this.dataUrl = dataUrl;
    }

    public String getHash() {
        return hash;
    }

    public void setHash(String hash) {
        this.hash = hash;
    }
}
