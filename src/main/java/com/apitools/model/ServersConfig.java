package com.apitools.model;

import java.util.List;

/**
 * The root of the servers configuration file.
 */
public record ServersConfig(List<ServerDefinition> servers) {

    public ServersConfig {
        servers = servers == null ? List.of() : List.copyOf(servers);
    }
}
