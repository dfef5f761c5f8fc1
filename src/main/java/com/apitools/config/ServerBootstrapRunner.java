package com.apitools.config;

import com.apitools.service.api.ToolRegistry;
import com.apitools.service.impl.ConfigFileWatcher;
import com.apitools.service.impl.ServerConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Starts the servers listed in the servers configuration file when the application starts,
 * then reloads them whenever the file changes. Runs before the interactive shell takes over.
 */
@Component
@Profile("!test")
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class ServerBootstrapRunner implements CommandLineRunner {

    private final ServerConfigLoader serverConfigLoader;
    private final ToolRegistry toolRegistry;
    private final ConfigFileWatcher configFileWatcher;
    private final boolean watch;

    public ServerBootstrapRunner(ServerConfigLoader serverConfigLoader, ToolRegistry toolRegistry,
                                 ConfigFileWatcher configFileWatcher,
                                 @Value("${apitools.servers.watch:true}") boolean watch) {
        this.serverConfigLoader = serverConfigLoader;
        this.toolRegistry = toolRegistry;
        this.configFileWatcher = configFileWatcher;
        this.watch = watch;
    }

    @Override
    public void run(String... args) {
        Path configFile = serverConfigLoader.getConfigFile();
        if (!Files.isRegularFile(configFile)) {
            log.info("No server configuration at {}. Skipping server startup.", configFile);
            return;
        }
        try {
            toolRegistry.reload(serverConfigLoader.load());
        } catch (RuntimeException e) {
            log.error("Could not start servers from {}: {}", configFile, e.getMessage());
        }
        if (watch) {
            try {
                configFileWatcher.start(configFile, () -> toolRegistry.reload(serverConfigLoader.load()));
            } catch (IOException e) {
                log.warn("Hot reload disabled, cannot watch {}: {}", configFile, e.getMessage());
            }
        }
    }
}
