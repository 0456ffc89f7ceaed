package com.pagepilot.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatMessage {

    public static final String META_KIND = "kind";
    public static final String META_IMAGE = "imageDataUrl";

    private String id;
    private String role; // system, user, assistant
    private String text;
    private long at;
    private Map<String, Object> meta = new LinkedHashMap<>();

    public ChatMessage() {
    }

    public ChatMessage(String id, String role, String text, long at, Map<String, Object> meta) {
        this.id = id;
        this.role = normalizeRole(role);
        this.text = text != null ? text : "";
        this.at = at;
        if (meta != null) {
            this.meta.putAll(meta);
        }
    }

    public static String normalizeRole(String role) {
        if ("assistant".equals(role) || "user".equals(role) || "system".equals(role)) {
            return role;
        }
        return "system";
    }

    /**
     * Copy without transient image payloads, for persistence.
     */
    public ChatMessage withoutImage() {
        Map<String, Object> stripped = new LinkedHashMap<>(meta);
        stripped.remove(META_IMAGE);
        return new ChatMessage(id, role, text, at, stripped);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getRole() {
        return role;
    }

    public void setRole(String role) {
        this.role = normalizeRole(role);
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public long getAt() {
        return at;
    }

    public void setAt(long at) {
        this.at = at;
    }

    public Map<String, Object> getMeta() {
        return meta;
    }

    public void setMeta(Map<String, Object> meta) {
        this.meta = meta != null ? meta : new LinkedHashMap<>();
    }

    @Override
    public String toString() {
        return "ChatMessage{" +
            "role='" + role + '\'' +
            ", text='" + text + '\'' +
            ", at=" + at +
            '}';
    }
}
