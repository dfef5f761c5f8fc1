package com.apitools.service.impl;

import com.apitools.model.ApiSpecification;
import com.apitools.model.RegisteredServer;
import com.apitools.model.ServerDefinition;
import com.apitools.model.ServersConfig;
import com.apitools.model.Tool;
import com.apitools.service.api.OpenApiService;
import com.apitools.service.api.ToolCompiler;
import com.apitools.service.api.ToolRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Holds the compiled tools of every configured server. Readers always see one complete,
 * immutable snapshot.
 */
@Service
@Slf4j
public class ToolRegistryImpl implements ToolRegistry {

    private final OpenApiService openApiService;
    private final ToolCompiler toolCompiler;
    private final boolean useCache;
    private final AtomicReference<Map<String, RegisteredServer>> servers = new AtomicReference<>(Map.of());

    public ToolRegistryImpl(OpenApiService openApiService, ToolCompiler toolCompiler,
                            @Value("${apitools.cache.enabled:true}") boolean useCache) {
        this.openApiService = openApiService;
        this.toolCompiler = toolCompiler;
        this.useCache = useCache;
    }

    /**
     * {@inheritDoc}
     * Reloads are serialized; the new set is published with a single reference swap.
     */
    @Override
    public synchronized void reload(ServersConfig config) {
        Map<String, RegisteredServer> next = new LinkedHashMap<>();
        for (ServerDefinition definition : config.servers()) {
            try {
                ApiSpecification specification = openApiService.loadAndParseSpec(definition.source(),
                        definition.paths(), useCache);
                List<Tool> tools = toolCompiler.compileAll(specification, definition.excludedParameters());
                next.put(definition.namespace(), new RegisteredServer(definition, tools));
                for (Tool tool : tools) {
                    log.info("{} - tool: {} - {}", definition.name(), tool.name(), tool.description());
                }
                log.info("Started server for {} with {} tools", definition.name(), tools.size());
            } catch (RuntimeException e) {
                log.error("Failed to start server for {}: {}", definition.name(), e.getMessage(), e);
            }
        }
        servers.set(Collections.unmodifiableMap(next));
    }

    @Override
    public List<RegisteredServer> servers() {
        return new ArrayList<>(servers.get().values());
    }

    @Override
    public Optional<RegisteredServer> server(String namespace) {
        return Optional.ofNullable(servers.get().get(namespace));
    }
}
