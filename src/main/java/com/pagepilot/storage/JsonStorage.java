package com.pagepilot.storage;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * File helpers for the JSON state files. Writes go to a sibling temp file first and are then
 * moved over the target, so a crash never leaves a half-written file behind.
 */
public final class JsonStorage {

    private static final ObjectMapper mapper = new ObjectMapper();

    private JsonStorage() {
    }

    public static <T> List<T> readJsonList(Path filePath, Class<T[]> clazz) throws IOException {
        if (!Files.exists(filePath)) {
            return Collections.emptyList();
        }
        T[] items = mapper.readValue(filePath.toFile(), clazz);
        return items == null ? Collections.emptyList() : Arrays.asList(items);
    }

    /**
     * @return the parsed file, or null when it does not exist
     */
    public static <T> T readJson(Path filePath, Class<T> clazz) throws IOException {
        if (!Files.exists(filePath)) {
            return null;
        }
        return mapper.readValue(filePath.toFile(), clazz);
    }

    public static void writeJson(Path filePath, Object data) throws IOException {
        Path parent = filePath.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = parent.resolve(filePath.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), data);
        try {
            Files.move(temp, filePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, filePath, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
