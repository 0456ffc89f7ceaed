package com.pagepilot;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Process-level settings: where state and logs live, which port to serve on, and where the page executor listens.
 */
public class AppConfig {

    private static final String APP_NAME = "PagePilot";
    public static final String DEFAULT_EXECUTOR_URL = "http://localhost:9222/pagepilot";
    public static final int DEFAULT_PORT = 8765;

    private final Path dataDir;
    private final Path logPath;
    private final String executorUrl;
    private final int port;
    private final boolean devMode;

    private AppConfig(Path dataDir, Path logPath, String executorUrl, int port, boolean devMode) {
        this.dataDir = dataDir;
        this.logPath = logPath;
        this.executorUrl = executorUrl;
        this.port = port;
        this.devMode = devMode;
    }

    public Path getDataDir() {
        return dataDir;
    }

    public Path getLogPath() {
        return logPath;
    }

    public String getExecutorUrl() {
        return executorUrl;
    }

    public int getPort() {
        return port;
    }

    public boolean isDevMode() {
        return devMode;
    }

    /**
     * Default directory for persisted config and chat history.
     * Windows: %APPDATA%\PagePilot
     * macOS: ~/Library/Application Support/PagePilot
     * Linux: ~/.local/share/PagePilot
     */
    public static Path getDefaultDataDir() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME);
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Application Support", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME);
        }
    }

    /**
     * Find an available port, starting with the preferred port.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }
        for (int port = preferredPort + 1; port < preferredPort + 100; port++) {
            if (isPortAvailable(port)) {
                return port;
            }
        }
        // Let the server fail with a clear bind error.
        return preferredPort;
    }

    public static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket(port)) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public static class Builder {
        private Path dataDir = null;
        private String executorUrl = DEFAULT_EXECUTOR_URL;
        private int preferredPort = DEFAULT_PORT;
        private boolean devMode = false;

        public Builder dataDir(String path) {
            if (path != null && !path.isEmpty()) {
                this.dataDir = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder executorUrl(String url) {
            if (url != null && !url.isBlank()) {
                this.executorUrl = url.trim();
            }
            return this;
        }

        public Builder port(int port) {
            this.preferredPort = port;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        /**
         * Accepts {@code --name=value} and {@code --name value}. Unparseable ports are ignored.
         */
        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                if (arg.startsWith("--data-dir=")) {
                    dataDir(arg.substring("--data-dir=".length()));
                } else if ("--data-dir".equals(arg) && i + 1 < args.length) {
                    dataDir(args[++i]);
                } else if (arg.startsWith("--executor-url=")) {
                    executorUrl(arg.substring("--executor-url=".length()));
                } else if ("--executor-url".equals(arg) && i + 1 < args.length) {
                    executorUrl(args[++i]);
                } else if (arg.startsWith("--port=")) {
                    parsePort(arg.substring("--port=".length()));
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    parsePort(args[++i]);
                } else if ("--dev".equals(arg)) {
                    this.devMode = true;
                }
            }
            return this;
        }

        private void parsePort(String value) {
            try {
                this.preferredPort = Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                System.err.println("Ignoring invalid port: " + value);
            }
        }

        /**
         * Resolve directories and pick a free port. Creates the data and log directories.
         */
        public AppConfig build() throws IOException {
            Path dir = dataDir != null ? dataDir : getDefaultDataDir();
            Files.createDirectories(dir);
            Path logDir = dir.resolve("logs");
            Files.createDirectories(logDir);
            int port = findAvailablePort(preferredPort);
            return new AppConfig(dir, logDir.resolve("page-pilot.log"), executorUrl, port, devMode);
        }

        AppConfig buildUnresolved() {
            Path dir = dataDir != null ? dataDir : getDefaultDataDir();
            return new AppConfig(dir, dir.resolve("logs").resolve("page-pilot.log"), executorUrl, preferredPort, devMode);
        }
    }
}
