package com.apitools.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One entry of the servers configuration file.
 *
 * @param namespace          Unique key of the server.
 * @param name               Display name.
 * @param url                Location of the OpenAPI document ({@code file://} or http(s)).
 * @param baseUrl            Base URL that tool paths are appended to.
 * @param paths              Route patterns selecting the exposed paths.
 * @param headers            Incoming header names forwarded to the upstream API.
 * @param forwardQueryParams Incoming header name to upstream query parameter name.
 * @param timeout            Upstream timeout in seconds, {@code null} for the default.
 * @param cassettes          Cassette mode of the server.
 */
public record ServerDefinition(String namespace,
                               String name,
                               String url,
                               @JsonProperty("base_url") String baseUrl,
                               List<String> paths,
                               List<String> headers,
                               @JsonProperty("forward_query_params") Map<String, String> forwardQueryParams,
                               Double timeout,
                               CassetteMode cassettes) {

    public ServerDefinition {
        paths = paths == null ? List.of() : List.copyOf(paths);
        headers = headers == null ? List.of() : List.copyOf(headers);
        forwardQueryParams = forwardQueryParams == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(forwardQueryParams));
        cassettes = cassettes == null ? CassetteMode.OFF : cassettes;
        if (name == null) {
            name = namespace;
        }
    }

    public SpecSource source() {
        return SpecSource.parse(url);
    }

    /**
     * Parameters supplied by the proxy rather than by the caller: the forwarded header names
     * and the query parameters filled from headers.
     */
    public List<String> excludedParameters() {
        List<String> excluded = new ArrayList<>(headers);
        excluded.addAll(forwardQueryParams.values());
        return excluded;
    }
}
