package com.instorm.scorecard.storage;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.Properties;

/**
 * {@link KeyValueStore} backed by a properties file. Every mutation rewrites the
 * whole file through a temporary sibling that is then moved into place.
 */
@Slf4j
public class FileKeyValueStore implements KeyValueStore {

    private final Path file;

    public FileKeyValueStore(Path file) {
        this.file = file;
    }

    @Override
    public synchronized Optional<String> get(String key) {
        try {
            return Optional.ofNullable(load().getProperty(key));
        } catch (IOException e) {
            log.warn("Could not read key-value store {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public synchronized void put(String key, String value) {
        try {
            Properties properties = load();
            properties.setProperty(key, value);
            store(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write key '" + key + "' to " + file, e);
        }
    }

    @Override
    public synchronized void remove(String key) {
        try {
            Properties properties = load();
            if (properties.remove(key) == null) {
                return;
            }
            store(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to remove key '" + key + "' from " + file, e);
        }
    }

    private Properties load() throws IOException {
        Properties properties = new Properties();
        if (Files.exists(file)) {
            try (InputStream in = Files.newInputStream(file)) {
                properties.load(in);
            }
        }
        return properties;
    }

    private void store(Properties properties) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(tmp)) {
                properties.store(out, null);
            }
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to replace", file);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
