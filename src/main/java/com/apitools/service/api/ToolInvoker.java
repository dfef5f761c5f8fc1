package com.apitools.service.api;

import com.apitools.model.RegisteredServer;
import com.apitools.model.ToolResult;
import java.util.Map;

/**
 * Serves a call to one tool of a registered server.
 */
public interface ToolInvoker {

    /**
     * Validates and defaults {@code arguments} against the tool's parameters, builds the upstream
     * request and forwards it.
     *
     * @param server          The server owning the tool.
     * @param toolName        The tool to call.
     * @param arguments       Argument values keyed by tool parameter name.
     * @param incomingHeaders Headers of the caller's request, used for forwarding.
     * @return The upstream result, or a failure result describing what went wrong.
     */
    ToolResult invoke(RegisteredServer server, String toolName, Map<String, Object> arguments,
                      Map<String, String> incomingHeaders);
}
