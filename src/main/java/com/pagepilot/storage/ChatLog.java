package com.pagepilot.storage;

import com.pagepilot.AppLogger;
import com.pagepilot.models.ChatMessage;
import com.pagepilot.util.SessionClock;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Ring buffer of the most recent chat messages, persisted through a {@link StateStore}.
 */
public class ChatLog {

    public static final int MAX_MESSAGES = 400;

    private final StateStore store;
    private final SessionClock clock;
    private final Deque<ChatMessage> messages = new ArrayDeque<>();

    public ChatLog(StateStore store, SessionClock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Replace the in-memory log with the persisted one, keeping only the newest entries.
     */
    public synchronized void load() {
        messages.clear();
        try {
            List<ChatMessage> stored = store.loadChat();
            int skip = Math.max(0, stored.size() - MAX_MESSAGES);
            for (int i = skip; i < stored.size(); i++) {
                messages.addLast(stored.get(i));
            }
            log("Loaded " + messages.size() + " chat message(s).");
        } catch (Exception e) {
            logWarning("Failed to load chat history: " + e.getMessage());
        }
    }

    public ChatMessage push(String role, String text, Map<String, Object> meta) {
        ChatMessage message = new ChatMessage(UUID.randomUUID().toString(), role, text, clock.now(), meta);
        synchronized (this) {
            messages.addLast(message);
            while (messages.size() > MAX_MESSAGES) {
                messages.pollFirst();
            }
        }
        flush();
        return message;
    }

    public ChatMessage system(String text) {
        return push("system", text, null);
    }

    public ChatMessage user(String text) {
        return push("user", text, null);
    }

    public ChatMessage assistant(String text) {
        return push("assistant", text, null);
    }

    /**
     * Append a screenshot entry. Ignored unless the value is an image data URL.
     */
    public ChatMessage screenshot(String dataUrl, String label) {
        if (dataUrl == null || !dataUrl.startsWith("data:image/")) {
            return null;
        }
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(ChatMessage.META_KIND, "screenshot");
        meta.put(ChatMessage.META_IMAGE, dataUrl);
        return push("system", label != null && !label.isBlank() ? label : "Screenshot captured.", meta);
    }

    public synchronized List<ChatMessage> list() {
        return new ArrayList<>(messages);
    }

    public synchronized int size() {
        return messages.size();
    }

    public synchronized void clear() {
        messages.clear();
        flush();
    }

    /**
     * Persist the current log; image payloads are stripped by the store. Snapshot and save happen
     * under the log's lock so an older snapshot can never overwrite a newer one.
     */
    public synchronized void flush() {
        try {
            store.saveChat(list());
        } catch (Exception e) {
            logWarning("Failed to save chat history: " + e.getMessage());
        }
    }

    private void log(String message) {
        AppLogger.get().info("[ChatLog] " + message);
    }

    private void logWarning(String message) {
        AppLogger.get().warn("[ChatLog] " + message);
    }
}
