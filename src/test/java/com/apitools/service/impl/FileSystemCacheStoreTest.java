package com.apitools.service.impl;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

class FileSystemCacheStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void get_shouldReturnEmptyForUnknownKey() {
        FileSystemCacheStore store = new FileSystemCacheStore(tempDir.resolve("cache").toString());

        assertThat(store.get("missing")).isEmpty();
    }

    @Test
    void put_shouldCreateDirectoryAndStoreEntry() throws Exception {
        Path directory = tempDir.resolve("nested").resolve("cache");
        FileSystemCacheStore store = new FileSystemCacheStore(directory.toString());

        store.put("abc123", "{\"paths\":[]}".getBytes(StandardCharsets.UTF_8));

        assertThat(directory.resolve("abc123.json")).exists();
        assertThat(store.get("abc123")).hasValueSatisfying(bytes ->
                assertThat(new String(bytes, StandardCharsets.UTF_8)).isEqualTo("{\"paths\":[]}"));
        try (Stream<Path> files = Files.list(directory)) {
            assertThat(files).extracting(file -> file.getFileName().toString()).containsExactly("abc123.json");
        }
    }

    @Test
    void put_shouldReplaceExistingEntry() {
        FileSystemCacheStore store = new FileSystemCacheStore(tempDir.toString());

        store.put("key", "first".getBytes(StandardCharsets.UTF_8));
        store.put("key", "second".getBytes(StandardCharsets.UTF_8));

        assertThat(store.get("key")).hasValueSatisfying(bytes ->
                assertThat(new String(bytes, StandardCharsets.UTF_8)).isEqualTo("second"));
    }

    @Test
    void constructor_shouldFallBackToDefaultDirectoryWhenBlank() {
        FileSystemCacheStore store = new FileSystemCacheStore(" ");

        assertThat(store.getDirectory()).isEqualTo(FileSystemCacheStore.defaultDirectory());
        assertThat(store.getDirectory().endsWith(Path.of(".openapi-tools", "cache"))).isTrue();
    }
}
