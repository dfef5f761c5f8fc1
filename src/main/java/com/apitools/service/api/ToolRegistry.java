package com.apitools.service.api;

import com.apitools.model.RegisteredServer;
import com.apitools.model.ServersConfig;
import java.util.List;
import java.util.Optional;

/**
 * Holds the tools of every configured server.
 * <p>
 * A reload builds the complete new set before publishing it, so readers always observe either
 * the previous or the new set, never a mix.
 */
public interface ToolRegistry {

    /**
     * Rebuilds all servers from {@code config}. A server whose document fails to load is logged
     * and left out; the others are still published.
     */
    void reload(ServersConfig config);

    /**
     * @return The currently published servers in configuration order.
     */
    List<RegisteredServer> servers();

    Optional<RegisteredServer> server(String namespace);
}
