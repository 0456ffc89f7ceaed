package com.pagepilot;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Application log written to the console and to {@code <dataDir>/logs/page-pilot.log}.
 * Lines logged from the agent loop carry the session id, so interleaved runs can be told apart.
 * Until {@link #initialize} is called, {@link #get()} hands out a console-only logger.
 */
public class AppLogger {

    static final long ROTATE_BYTES = 5L * 1024 * 1024;

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final AppLogger CONSOLE_ONLY = new AppLogger();
    private static final ThreadLocal<String> SESSION_TAG = new ThreadLocal<>();

    private final PrintStream fileOutput;
    private final PrintStream consoleOutput;
    private final boolean consoleEnabled;
    private final boolean debugEnabled;

    private static AppLogger instance;

    private AppLogger() {
        this.fileOutput = null;
        this.consoleOutput = System.out;
        this.consoleEnabled = true;
        this.debugEnabled = false;
    }

    private AppLogger(Path logFile, boolean consoleEnabled, boolean debugEnabled) throws IOException {
        this.consoleOutput = System.out;
        this.consoleEnabled = consoleEnabled;
        this.debugEnabled = debugEnabled;

        rotateIfLarge(logFile, ROTATE_BYTES);
        this.fileOutput = new PrintStream(new FileOutputStream(logFile.toFile(), true), true, StandardCharsets.UTF_8);

        String separator = "=".repeat(60);
        fileOutput.println();
        fileOutput.println(separator);
        fileOutput.println("Page Pilot started at " + LocalDateTime.now().format(TIME_FORMAT));
        fileOutput.println(separator);
    }

    /**
     * @param debugEnabled emit {@link #debug} lines (per-step detail of the agent loop)
     */
    public static synchronized void initialize(Path logFile, boolean consoleEnabled, boolean debugEnabled)
            throws IOException {
        if (instance == null) {
            instance = new AppLogger(logFile, consoleEnabled, debugEnabled);
        }
    }

    public static synchronized AppLogger get() {
        return instance != null ? instance : CONSOLE_ONLY;
    }

    /**
     * Tag every line logged from the current thread with a session id until {@link #clearSession()}.
     */
    public static void bindSession(String sessionId) {
        SESSION_TAG.set(sessionId);
    }

    public static void clearSession() {
        SESSION_TAG.remove();
    }

    // Keeps one previous generation as page-pilot.log.1.
    static void rotateIfLarge(Path logFile, long limitBytes) throws IOException {
        if (Files.exists(logFile) && Files.size(logFile) > limitBytes) {
            Path previous = logFile.resolveSibling(logFile.getFileName() + ".1");
            Files.move(logFile, previous, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public boolean isDebugEnabled() {
        return debugEnabled;
    }

    public void debug(String message) {
        if (debugEnabled) {
            log("DEBUG", message);
        }
    }

    public void info(String message) {
        log("INFO", message);
    }

    public void warn(String message) {
        log("WARN", message);
    }

    public void error(String message) {
        log("ERROR", message);
    }

    public void error(String message, Throwable t) {
        log("ERROR", message);
        if (fileOutput != null) {
            t.printStackTrace(fileOutput);
        }
        if (consoleEnabled) {
            t.printStackTrace(consoleOutput);
        }
    }

    static String format(String timestamp, String level, String sessionId, String message) {
        if (sessionId == null) {
            return "[" + timestamp + "] [" + level + "] " + message;
        }
        return "[" + timestamp + "] [" + level + "] [" + sessionId + "] " + message;
    }

    private void log(String level, String message) {
        String line = format(LocalDateTime.now().format(TIME_FORMAT), level, SESSION_TAG.get(), message);
        if (fileOutput != null) {
            fileOutput.println(line);
        }
        if (consoleEnabled) {
            consoleOutput.println(line);
        }
    }

    /**
     * Untimestamped output for the startup banner; also copied to the log file.
     */
    public void console(String message) {
        if (consoleEnabled) {
            consoleOutput.println(message);
        }
        if (fileOutput != null) {
            fileOutput.println(message);
        }
    }

    public void close() {
        if (fileOutput != null) {
            fileOutput.close();
        }
    }
}
