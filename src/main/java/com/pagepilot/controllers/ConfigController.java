package com.pagepilot.controllers;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagepilot.AgentConfigStore;
import com.pagepilot.AppLogger;
import com.pagepilot.models.AgentConfig;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;

/**
 * Controller for reading and saving the agent configuration.
 */
public class ConfigController implements Controller {

    private final AgentConfigStore configStore;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public ConfigController(AgentConfigStore configStore, ObjectMapper objectMapper) {
        this.configStore = configStore;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/config", this::getConfig);
        app.put("/api/config", this::saveConfig);
    }

    private void getConfig(Context ctx) {
        ctx.json(Map.of("ok", true, "config", configStore.get()));
    }

    private void saveConfig(Context ctx) {
        try {
            if (ctx.body().isBlank()) {
                throw new IllegalArgumentException("Config must be a JSON object");
            }
            AgentConfig saved = configStore.update(Controller.readObject(ctx, objectMapper));
            logger.info("Agent config saved (provider " + saved.getProvider().getId() + ")");
            ctx.json(Map.of("ok", true, "config", saved));
        } catch (Exception e) {
            int status = Controller.statusFor(e);
            if (status >= 500) {
                logger.error("Error saving config: " + e.getMessage());
            }
            ctx.status(status).json(Controller.errorBody(e));
        }
    }
}
