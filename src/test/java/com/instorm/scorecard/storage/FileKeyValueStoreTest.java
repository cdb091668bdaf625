package com.instorm.scorecard.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FileKeyValueStoreTest {

    @TempDir
    Path tempDir;

    private Path file;
    private FileKeyValueStore store;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("nested").resolve("session.properties");
        store = new FileKeyValueStore(file);
    }

    @Test
    void missingFileReadsAsEmpty() {
        assertThat(store.get("anything")).isEmpty();
        assertThat(file).doesNotExist();
    }

    @Test
    void putIsVisibleToAFreshStoreOnTheSameFile() {
        store.put("scorecard.session", "{\"token\":\"abc\"}");

        FileKeyValueStore reopened = new FileKeyValueStore(file);
        assertThat(reopened.get("scorecard.session")).contains("{\"token\":\"abc\"}");
    }

    @Test
    void putOverwritesAndKeepsOtherKeys() {
        store.put("a", "1");
        store.put("b", "2");
        store.put("a", "3");

        assertThat(store.get("a")).contains("3");
        assertThat(store.get("b")).contains("2");
    }

    @Test
    void removeDeletesOnlyThatKey() {
        store.put("a", "1");
        store.put("b", "2");

        store.remove("a");

        assertThat(store.get("a")).isEmpty();
        assertThat(store.get("b")).contains("2");
    }

    @Test
    void removingAnAbsentKeyDoesNotCreateTheFile() {
        store.remove("a");

        assertThat(file).doesNotExist();
    }

    @Test
    void noTemporaryFilesAreLeftBehind() throws IOException {
        store.put("a", "1");
        store.put("a", "2");

        try (var files = Files.list(file.getParent())) {
            assertThat(files).containsExactly(file);
        }
    }
}
