package com.pagepilot.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagepilot.AppLogger;
import com.pagepilot.models.SessionStatus;
import com.pagepilot.session.SessionController;
import com.pagepilot.storage.ChatLog;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;

/**
 * Controller for the agent session: start, stop, instructions, approvals, and the chat log.
 */
public class AgentController implements Controller {

    private final SessionController sessionController;
    private final ChatLog chatLog;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public AgentController(SessionController sessionController, ChatLog chatLog, ObjectMapper objectMapper) {
        this.sessionController = sessionController;
        this.chatLog = chatLog;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/agent/status", this::getStatus);
        app.post("/api/agent/start", this::start);
        app.post("/api/agent/stop", this::stop);
        app.post("/api/agent/instruction", this::submitInstruction);
        app.post("/api/agent/approval", this::resolveApproval);
        app.get("/api/chat", this::getChat);
    }

    private void getStatus(Context ctx) {
        ctx.json(sessionController.getStatus());
    }

    private void start(Context ctx) {
        try {
            JsonNode json = readBody(ctx);
            String goal = json.path("goal").isTextual() ? json.get("goal").asText() : null;
            SessionStatus status = sessionController.start(goal, json.get("config"));
            ctx.json(Map.of("ok", true, "status", status));
        } catch (Exception e) {
            respondError(ctx, "Error starting agent", e);
        }
    }

    private void stop(Context ctx) {
        ctx.json(Map.of("ok", true, "status", sessionController.stop()));
    }

    private void submitInstruction(Context ctx) {
        try {
            JsonNode json = readBody(ctx);
            sessionController.submitInstruction(json.path("text").isTextual() ? json.get("text").asText() : null);
            ctx.json(Map.of("ok", true));
        } catch (Exception e) {
            respondError(ctx, "Error queuing instruction", e);
        }
    }

    private void resolveApproval(Context ctx) {
        try {
            JsonNode json = readBody(ctx);
            String approvalId = json.path("approvalId").isTextual() ? json.get("approvalId").asText() : null;
            String decision = json.path("decision").isTextual() ? json.get("decision").asText() : null;
            sessionController.resolveApproval(approvalId, decision);
            ctx.json(Map.of("ok", true));
        } catch (Exception e) {
            respondError(ctx, "Error resolving approval", e);
        }
    }

    private void getChat(Context ctx) {
        ctx.json(chatLog.list());
    }

    private JsonNode readBody(Context ctx) throws Exception {
        return Controller.readObject(ctx, objectMapper);
    }

    private void respondError(Context ctx, String action, Exception e) {
        int status = Controller.statusFor(e);
        if (status >= 500) {
            logger.error(action + ": " + e.getMessage());
        }
        ctx.status(status).json(Controller.errorBody(e));
    }
}
