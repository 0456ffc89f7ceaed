package com.pagepilot;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AppLoggerTest {

    @TempDir
    Path tempDir;

    @Test
    void formatAddsSessionTagWhenBound() {
        assertEquals("[t] [INFO] hello", AppLogger.format("t", "INFO", null, "hello"));
        assertEquals("[t] [WARN] [s-1] hello", AppLogger.format("t", "WARN", "s-1", "hello"));
    }

    @Test
    void largeLogIsRotated() throws Exception {
        Path log = tempDir.resolve("page-pilot.log");
        Files.writeString(log, "x".repeat(64));

        AppLogger.rotateIfLarge(log, 10);

        assertFalse(Files.exists(log));
        assertEquals(64, Files.size(tempDir.resolve("page-pilot.log.1")));
    }

    @Test
    void smallLogIsKept() throws Exception {
        Path log = tempDir.resolve("page-pilot.log");
        Files.writeString(log, "short");

        AppLogger.rotateIfLarge(log, 10);
        AppLogger.rotateIfLarge(tempDir.resolve("missing.log"), 10);

        assertTrue(Files.exists(log));
        assertFalse(Files.exists(tempDir.resolve("page-pilot.log.1")));
    }

    @Test
    void uninitializedLoggerIsConsoleOnlyWithoutDebug() {
        AppLogger logger = AppLogger.get();

        assertFalse(logger.isDebugEnabled());
        logger.debug("ignored");
        logger.info("console line");
    }
}
