package com.pagepilot;

import com.fasterxml.jackson.databind.JsonNode;
import com.pagepilot.models.AgentConfig;
import com.pagepilot.storage.StateStore;

import java.io.IOException;

/**
 * Holds the current agent configuration and writes every accepted change through to the state store.
 */
public class AgentConfigStore {

    private final StateStore stateStore;
    private volatile AgentConfig current = AgentConfig.defaults();

    public AgentConfigStore(StateStore stateStore) {
        this.stateStore = stateStore;
    }

    public void load() {
        try {
            current = stateStore.loadConfig();
            AppLogger.get().info("[AgentConfigStore] Loaded agent config (provider " + current.getProvider().getId() + ").");
        } catch (IOException e) {
            AppLogger.get().warn("[AgentConfigStore] Failed to load agent config, using defaults: " + e.getMessage());
            current = AgentConfig.defaults();
        }
    }

    public AgentConfig get() {
        return current;
    }

    /**
     * Merge a partial update into the current config and persist it.
     *
     * @return the sanitized config now in effect
     */
    public synchronized AgentConfig update(JsonNode patch) throws IOException {
        AgentConfig next = AgentConfig.merge(current, patch);
        stateStore.saveConfig(next);
        current = next;
        return next;
    }
}
