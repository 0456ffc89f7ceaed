package com.pagepilot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagepilot.controllers.AgentController;
import com.pagepilot.controllers.ConfigController;
import com.pagepilot.controllers.Controller;
import com.pagepilot.decision.ActionNormalizer;
import com.pagepilot.decision.DecisionEngine;
import com.pagepilot.decision.DecisionParser;
import com.pagepilot.decision.DecisionPromptBuilder;
import com.pagepilot.executor.HttpPageExecutor;
import com.pagepilot.providers.chat.ChatProviderFactory;
import com.pagepilot.session.ChangeEvaluator;
import com.pagepilot.session.RiskGate;
import com.pagepilot.session.SessionController;
import com.pagepilot.storage.ChatLog;
import com.pagepilot.storage.JsonStateStore;
import com.pagepilot.util.SessionClock;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final Duration EXECUTOR_TIMEOUT = Duration.ofSeconds(30);
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            AppConfig config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();

            AppLogger.initialize(config.getLogPath(), true, config.isDevMode());
            logger = AppLogger.get();

            printBanner(config);

            SessionClock clock = SessionClock.system();
            JsonStateStore stateStore = new JsonStateStore(config.getDataDir());

            ChatLog chatLog = new ChatLog(stateStore, clock);
            chatLog.load();
            AgentConfigStore configStore = new AgentConfigStore(stateStore);
            configStore.load();
            logger.info("State loaded from " + config.getDataDir());

            DecisionEngine decisionEngine = new DecisionEngine(
                    new ChatProviderFactory(objectMapper, clock),
                    new DecisionPromptBuilder(objectMapper),
                    new DecisionParser(objectMapper),
                    chatLog,
                    clock);
            HttpPageExecutor pageExecutor = new HttpPageExecutor(objectMapper, config.getExecutorUrl(), EXECUTOR_TIMEOUT);

            SessionController sessionController = new SessionController(
                    pageExecutor,
                    decisionEngine,
                    new ActionNormalizer(),
                    new RiskGate(chatLog, clock),
                    new ChangeEvaluator(),
                    chatLog,
                    configStore,
                    clock,
                    agentLoopExecutor());

            Javalin app = Javalin.create(cfg -> {
                cfg.jsonMapper(new JavalinJackson(objectMapper));
                cfg.http.defaultContentType = "application/json";
            });

            List<Controller> controllers = List.of(
                    new AgentController(sessionController, chatLog, objectMapper),
                    new ConfigController(configStore, objectMapper));
            for (Controller controller : controllers) {
                controller.registerRoutes(app);
            }

            app.exception(Exception.class, (e, ctx) -> {
                logger.error("Unhandled exception: " + e.getMessage(), e);
                ctx.status(500).json(Map.of("ok", false, "error", String.valueOf(e.getMessage())));
            });

            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Page executor: " + config.getExecutorUrl());
            logger.console("  Data dir: " + config.getDataDir());
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                sessionController.stop();
                app.stop();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start Page Pilot: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static Executor agentLoopExecutor() {
        return runnable -> {
            Thread thread = new Thread(runnable, "agent-loop");
            thread.setDaemon(true);
            thread.start();
        };
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  Page Pilot v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }
}
