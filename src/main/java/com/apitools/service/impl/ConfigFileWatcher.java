package com.apitools.service.impl;

import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Watches the servers configuration file and runs a callback when it changes.
 * Change events arriving within one second of the last handled event are ignored.
 */
@Component
@Slf4j
public class ConfigFileWatcher {

    static final Duration DEBOUNCE = Duration.ofSeconds(1);

    private WatchService watchService;
    private Thread thread;
    private long lastTriggered = Long.MIN_VALUE;

    public synchronized void start(Path configFile, Runnable onChange) throws IOException {
        stop();
        Path absolute = configFile.toAbsolutePath();
        Path folder = absolute.getParent();
        Path fileName = absolute.getFileName();
        watchService = FileSystems.getDefault().newWatchService();
        folder.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY, StandardWatchEventKinds.ENTRY_CREATE);
        WatchService service = watchService;
        thread = new Thread(() -> watch(service, fileName, onChange), "config-watcher");
        thread.setDaemon(true);
        thread.start();
        log.info("Watching {} for changes", absolute);
    }

    private void watch(WatchService service, Path fileName, Runnable onChange) {
        try {
            while (true) {
                WatchKey key = service.take();
                boolean changed = false;
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (fileName.equals(event.context())) {
                        changed = true;
                    }
                }
                key.reset();
                if (changed && shouldTrigger(System.currentTimeMillis())) {
                    log.info("Configuration changed, reloading servers");
                    try {
                        onChange.run();
                    } catch (RuntimeException e) {
                        log.error("Reload after configuration change failed: {}", e.getMessage(), e);
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ClosedWatchServiceException e) {
            log.debug("Configuration watcher stopped");
        }
    }

    /**
     * Records a change event at {@code nowMillis} and tells whether it falls outside the debounce window.
     */
    synchronized boolean shouldTrigger(long nowMillis) {
        if (lastTriggered != Long.MIN_VALUE && nowMillis - lastTriggered < DEBOUNCE.toMillis()) {
            return false;
        }
        lastTriggered = nowMillis;
        return true;
    }

    @PreDestroy
    public synchronized void stop() {
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Could not close configuration watcher: {}", e.getMessage());
            }
            watchService = null;
        }
        if (thread != null) {
            thread.interrupt();
            thread = null;
        }
    }
}
