package com.apitools.service.impl;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigFileWatcherTest {

    @TempDir
    Path tempDir;

    private final ConfigFileWatcher watcher = new ConfigFileWatcher();

    @AfterEach
    void tearDown() {
        watcher.stop();
    }

    @Test
    void shouldTrigger_shouldIgnoreEventsWithinDebounceWindow() {
        assertThat(watcher.shouldTrigger(10_000)).isTrue();
        assertThat(watcher.shouldTrigger(10_400)).isFalse();
        assertThat(watcher.shouldTrigger(10_999)).isFalse();
        assertThat(watcher.shouldTrigger(11_000)).isTrue();
        assertThat(watcher.shouldTrigger(11_500)).isFalse();
    }

    @Test
    void start_shouldRunCallbackWhenFileChanges() throws Exception {
        Path config = tempDir.resolve("servers.yaml");
        Files.writeString(config, "servers: []\n");
        CountDownLatch reloaded = new CountDownLatch(1);

        watcher.start(config, reloaded::countDown);
        Files.writeString(config, "servers: []\n# edited\n");

        assertThat(reloaded.await(10, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void start_shouldIgnoreOtherFilesInDirectory() throws Exception {
        Path config = tempDir.resolve("servers.yaml");
        Files.writeString(config, "servers: []\n");
        CountDownLatch reloaded = new CountDownLatch(1);

        watcher.start(config, reloaded::countDown);
        Files.writeString(tempDir.resolve("other.yaml"), "unrelated\n");

        assertThat(reloaded.await(2, TimeUnit.SECONDS)).isFalse();
    }
}
