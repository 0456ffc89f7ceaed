package com.pagepilot;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsApplyWithoutArgs() {
        AppConfig config = new AppConfig.Builder().parseArgs(new String[0]).buildUnresolved();

        assertEquals(AppConfig.DEFAULT_PORT, config.getPort());
        assertEquals(AppConfig.DEFAULT_EXECUTOR_URL, config.getExecutorUrl());
        assertEquals(AppConfig.getDefaultDataDir(), config.getDataDir());
        assertFalse(config.isDevMode());
    }

    @Test
    void parsesBothArgumentForms() {
        AppConfig config = new AppConfig.Builder().parseArgs(new String[] {
            "--port=9100",
            "--executor-url", "http://127.0.0.1:7000/bridge",
            "--data-dir=" + tempDir,
            "--dev"
        }).buildUnresolved();

        assertEquals(9100, config.getPort());
        assertEquals("http://127.0.0.1:7000/bridge", config.getExecutorUrl());
        assertEquals(tempDir.toAbsolutePath().normalize(), config.getDataDir());
        assertEquals(tempDir.resolve("logs").resolve("page-pilot.log"), config.getLogPath());
        assertTrue(config.isDevMode());
    }

    @Test
    void invalidPortIsIgnored() {
        AppConfig config = new AppConfig.Builder().parseArgs(new String[] {"--port", "abc"}).buildUnresolved();

        assertEquals(AppConfig.DEFAULT_PORT, config.getPort());
    }

    @Test
    void buildCreatesDirectories() throws Exception {
        Path dataDir = tempDir.resolve("state");

        AppConfig config = new AppConfig.Builder()
            .dataDir(dataDir.toString())
            .port(0)
            .build();

        assertTrue(Files.isDirectory(dataDir));
        assertTrue(Files.isDirectory(dataDir.resolve("logs")));
        assertEquals(0, config.getPort());
    }
}
