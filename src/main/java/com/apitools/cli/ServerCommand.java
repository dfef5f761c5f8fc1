package com.apitools.cli;

import com.apitools.dto.response.CommandResponse;
import com.apitools.model.CassetteMode;
import com.apitools.model.RegisteredServer;
import com.apitools.model.ServerDefinition;
import com.apitools.model.ToolResult;
import com.apitools.service.api.ToolInvoker;
import com.apitools.service.api.ToolRegistry;
import com.apitools.service.impl.ServerConfigLoader;
import com.apitools.service.impl.ToolManifestBuilder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Commands for the servers declared in the servers configuration file.
 */
@ShellComponent
public class ServerCommand {

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final ToolRegistry toolRegistry;
    private final ToolInvoker toolInvoker;
    private final ServerConfigLoader serverConfigLoader;
    private final ToolManifestBuilder manifestBuilder;
    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public ServerCommand(ToolRegistry toolRegistry, ToolInvoker toolInvoker, ServerConfigLoader serverConfigLoader,
                         ToolManifestBuilder manifestBuilder) {
        this.toolRegistry = toolRegistry;
        this.toolInvoker = toolInvoker;
        this.serverConfigLoader = serverConfigLoader;
        this.manifestBuilder = manifestBuilder;
    }

    @ShellMethod(key = "servers", value = "List the running servers and their tool counts.")
    public String servers() {
        List<RegisteredServer> servers = toolRegistry.servers();
        if (servers.isEmpty()) {
            return CommandResponse.error("No servers are running. Check " + serverConfigLoader.getConfigFile()
                    + " and run 'reload'.").toAnsiString();
        }
        StringBuilder out = new StringBuilder();
        for (RegisteredServer server : servers) {
            ServerDefinition definition = server.definition();
            out.append(definition.namespace()).append(" (").append(definition.name()).append(") -> ")
                    .append(definition.baseUrl()).append(", ").append(server.tools().size()).append(" tools");
            if (definition.cassettes() != CassetteMode.OFF) {
                out.append(", cassettes ").append(definition.cassettes().name().toLowerCase(Locale.ROOT));
            }
            out.append('\n');
        }
        return out.toString().stripTrailing();
    }

    @ShellMethod(key = "server-tools", value = "Print the tool manifests of a server as JSON.")
    public String serverTools(@ShellOption(help = "The server namespace.") String namespace) {
        Optional<RegisteredServer> server = toolRegistry.server(namespace);
        if (server.isEmpty()) {
            return CommandResponse.error("Unknown server namespace: " + namespace).toAnsiString();
        }
        try {
            return objectMapper.writeValueAsString(manifestBuilder.buildAll(server.get().tools()));
        } catch (JsonProcessingException e) {
            return CommandResponse.error("Failed to render tools: " + e.getMessage()).toAnsiString();
        }
    }

    /**
     * Calls one tool and prints the upstream response body.
     *
     * @param namespace The server namespace.
     * @param tool      The tool name.
     * @param args      The arguments as a JSON object.
     * @param headers   Caller headers as {@code Name=Value} pairs, subject to the server's forwarding rules.
     */
    @ShellMethod(key = "invoke", value = "Call a tool of a running server.")
    public String invoke(
            @ShellOption(help = "The server namespace.") String namespace,
            @ShellOption(help = "The tool name.") String tool,
            @ShellOption(help = "Arguments as a JSON object.", defaultValue = "{}") String args,
            @ShellOption(help = "Caller headers as Name=Value pairs.", arity = Integer.MAX_VALUE,
                    defaultValue = ShellOption.NULL) String[] headers
    ) {
        Optional<RegisteredServer> server = toolRegistry.server(namespace);
        if (server.isEmpty()) {
            return CommandResponse.error("Unknown server namespace: " + namespace).toAnsiString();
        }
        Map<String, Object> arguments;
        try {
            arguments = objectMapper.readValue(args, ARGUMENTS_TYPE);
        } catch (JsonProcessingException e) {
            return CommandResponse.error("Arguments must be a JSON object: " + e.getOriginalMessage()).toAnsiString();
        }
        Map<String, String> incomingHeaders = new LinkedHashMap<>();
        if (headers != null) {
            for (String header : headers) {
                int separator = header.indexOf('=');
                if (separator <= 0) {
                    return CommandResponse.error("Headers must be given as Name=Value: " + header).toAnsiString();
                }
                incomingHeaders.put(header.substring(0, separator).trim(), header.substring(separator + 1).trim());
            }
        }
        ToolResult result = toolInvoker.invoke(server.get(), tool, arguments, incomingHeaders);
        String status = result.statusCode() > 0 ? "[" + result.statusCode() + "] " : "";
        return new CommandResponse(result.success(), status + result.body()).toAnsiString();
    }

    @ShellMethod(key = "reload", value = "Reload the servers configuration and recompile all tools.")
    public String reload() {
        try {
            toolRegistry.reload(serverConfigLoader.load());
            return CommandResponse.ok("Reloaded " + toolRegistry.servers().size() + " server(s) from "
                    + serverConfigLoader.getConfigFile()).toAnsiString();
        } catch (Exception e) {
            return CommandResponse.error("Failed to reload servers: " + e.getMessage()).toAnsiString();
        }
    }
}
