package com.apitools.service.impl;

import com.apitools.exception.ApiToolsException;
import com.apitools.service.api.CacheStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * A {@link CacheStore} keeping one {@code <key>.json} file per entry.
 * <p>
 * The directory defaults to {@code ~/.openapi-tools/cache}, with the home directory taken from the
 * {@code APITOOLS_HOME} environment variable when set. Entries are written to a temporary file and
 * moved into place, so a reader never sees a partially written entry.
 */
@Service
@Slf4j
public class FileSystemCacheStore implements CacheStore {

    private static final String EXTENSION = ".json";

    private final Path directory;

    public FileSystemCacheStore(@Value("${apitools.cache.directory:}") String configuredDirectory) {
        this.directory = configuredDirectory == null || configuredDirectory.isBlank()
                ? defaultDirectory()
                : Path.of(configuredDirectory);
    }

    static Path defaultDirectory() {
        String home = System.getenv("APITOOLS_HOME") != null
                ? System.getenv("APITOOLS_HOME")
                : System.getProperty("user.home");
        return Path.of(home, ".openapi-tools", "cache");
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public Optional<byte[]> get(String key) {
        Path file = directory.resolve(key + EXTENSION);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (IOException e) {
            log.warn("Could not read cache entry {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public synchronized void put(String key, byte[] value) {
        Path file = directory.resolve(key + EXTENSION);
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, key, ".tmp");
            Files.write(temp, value);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Cached {} bytes at {}", value.length, file);
        } catch (IOException e) {
            throw new ApiToolsException("Failed to write cache entry " + file, e);
        }
    }
}
