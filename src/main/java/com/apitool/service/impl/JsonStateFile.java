package com.apitool.service.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * A JSON document on disk holding one service's state.
 * <p>
 * Reads and writes are synchronized. A file that cannot be parsed is renamed with a
 * {@code .corrupted.<timestamp>} suffix so that the next start begins from a clean state
 * while the data stays available for manual inspection.
 */
@Slf4j
class JsonStateFile {

    private final File file;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    JsonStateFile(File file) {
        this.file = file;
    }

    /**
     * @throws UncheckedIOException if the parent directory cannot be created or the file cannot be written.
     */
    synchronized void write(Object state) {
        try {
            File parentDir = file.getAbsoluteFile().getParentFile();
            if (!parentDir.exists() && !parentDir.mkdirs()) {
                throw new IOException("Failed to create parent directories at: " + parentDir.getAbsolutePath());
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file, state);
        } catch (IOException e) {
            log.error("CRITICAL: Failed to save state to {}", file.getAbsolutePath(), e);
            throw new UncheckedIOException("Failed to save state to " + file.getAbsolutePath(), e);
        }
    }

    synchronized <T> Optional<T> read(TypeReference<T> type) {
        if (!file.exists() || file.length() == 0) {
            log.info("No state file found at {}, starting with a clean state.", file.getAbsolutePath());
            return Optional.empty();
        }
        try {
            T state = objectMapper.readValue(file, type);
            log.info("Successfully loaded state from {}", file.getAbsolutePath());
            return Optional.ofNullable(state);
        } catch (IOException e) {
            log.warn("Could not load or parse state file at {}. A backup will be created and a fresh state used. Error: {}",
                    file.getAbsolutePath(), e.getMessage());
            backupCorrupted();
            return Optional.empty();
        }
    }

    private void backupCorrupted() {
        File backupFile = new File(file.getAbsolutePath() + ".corrupted." + System.currentTimeMillis());
        try {
            Files.move(file.toPath(), backupFile.toPath(), StandardCopyOption.REPLACE_EXISTING);
            log.info("Backed up corrupted state file to {}", backupFile.getAbsolutePath());
        } catch (IOException e) {
            log.error("CRITICAL: Failed to back up corrupted state file from {} to {}",
                    file.getAbsolutePath(), backupFile.getAbsolutePath(), e);
        }
    }
}
