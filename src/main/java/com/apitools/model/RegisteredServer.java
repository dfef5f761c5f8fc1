package com.apitools.model;

import java.util.List;
import java.util.Optional;

/**
 * A configured server together with the tools compiled for it.
 */
public record RegisteredServer(ServerDefinition definition, List<Tool> tools) {

    public RegisteredServer {
        tools = List.copyOf(tools);
    }

    public Optional<Tool> tool(String toolName) {
        return tools.stream().filter(tool -> tool.name().equals(toolName)).findFirst();
    }
}
