package com.pagepilot.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.pagepilot.models.AgentConfig;
import com.pagepilot.models.ChatMessage;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Stores {@code agent-config.json} and {@code agent-chat.json} under the data directory.
 */
public class JsonStateStore implements StateStore {

    static final String CONFIG_FILE = "agent-config.json";
    static final String CHAT_FILE = "agent-chat.json";

    private final Path configPath;
    private final Path chatPath;

    public JsonStateStore(Path dataDir) {
        this.configPath = dataDir.resolve(CONFIG_FILE);
        this.chatPath = dataDir.resolve(CHAT_FILE);
    }

    @Override
    public AgentConfig loadConfig() throws IOException {
        JsonNode stored = JsonStorage.readJson(configPath, JsonNode.class);
        return AgentConfig.merge(AgentConfig.defaults(), stored);
    }

    @Override
    public synchronized void saveConfig(AgentConfig config) throws IOException {
        JsonStorage.writeJson(configPath, config);
    }

    @Override
    public List<ChatMessage> loadChat() throws IOException {
        return new ArrayList<>(JsonStorage.readJsonList(chatPath, ChatMessage[].class));
    }

    @Override
    public synchronized void saveChat(List<ChatMessage> messages) throws IOException {
        List<ChatMessage> stripped = new ArrayList<>(messages.size());
        for (ChatMessage message : messages) {
            stripped.add(message.withoutImage());
        }
        JsonStorage.writeJson(chatPath, stripped);
    }
}
