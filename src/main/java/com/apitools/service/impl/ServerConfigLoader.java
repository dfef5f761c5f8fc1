package com.apitools.service.impl;

import com.apitools.exception.ApiToolsException;
import com.apitools.model.ServerDefinition;
import com.apitools.model.ServersConfig;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Reads the YAML file listing the servers to expose.
 */
@Component
@Slf4j
public class ServerConfigLoader {

    private final Path configFile;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public ServerConfigLoader(@Value("${apitools.servers.config:servers.yaml}") String configFile) {
        this.configFile = Path.of(configFile);
    }

    public Path getConfigFile() {
        return configFile;
    }

    public ServersConfig load() {
        return load(configFile);
    }

    /**
     * @throws ApiToolsException if the file is missing, malformed, or an entry lacks a namespace,
     *                           url or base_url, or repeats a namespace.
     */
    public ServersConfig load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ApiToolsException("Server configuration not found: " + file);
        }
        ServersConfig config;
        try {
            config = yamlMapper.readValue(file.toFile(), ServersConfig.class);
        } catch (IOException e) {
            throw new ApiToolsException("Failed to read server configuration " + file + ": " + e.getMessage(), e);
        }
        if (config == null) {
            return new ServersConfig(null);
        }
        Set<String> namespaces = new HashSet<>();
        for (ServerDefinition server : config.servers()) {
            if (isBlank(server.namespace()) || isBlank(server.url()) || isBlank(server.baseUrl())) {
                throw new ApiToolsException("Every server in " + file + " needs namespace, url and base_url");
            }
            if (!namespaces.add(server.namespace())) {
                throw new ApiToolsException("Duplicate server namespace '" + server.namespace() + "' in " + file);
            }
        }
        log.debug("Read {} server definitions from {}", config.servers().size(), file);
        return config;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
