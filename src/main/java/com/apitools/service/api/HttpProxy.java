package com.apitools.service.api;

import com.apitools.model.ProxyRequest;
import com.apitools.model.ServerDefinition;
import com.apitools.model.ToolResult;
import java.util.Map;

/**
 * Sends assembled requests to the upstream API of a server.
 */
public interface HttpProxy {

    /**
     * Adds the forwarded headers and header-sourced query parameters of {@code server}, drops
     * {@code null} values and sends the request with the server's timeout.
     *
     * @return The upstream result. Transport failures and timeouts yield a failure result.
     */
    ToolResult execute(ServerDefinition server, ProxyRequest request, Map<String, String> incomingHeaders);
}
