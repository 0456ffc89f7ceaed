package com.pagepilot.storage;

import com.pagepilot.models.AgentConfig;
import com.pagepilot.models.ChatMessage;

import java.io.IOException;
import java.util.List;

/**
 * Persistence for the agent configuration and the chat history.
 */
public interface StateStore {

    /**
     * @return the stored configuration, sanitized; defaults when nothing is stored
     */
    AgentConfig loadConfig() throws IOException;

    void saveConfig(AgentConfig config) throws IOException;

    List<ChatMessage> loadChat() throws IOException;

    void saveChat(List<ChatMessage> messages) throws IOException;
}
