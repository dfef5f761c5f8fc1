package com.apitools.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A path template together with the operations declared on it.
 */
public record ApiPath(@JsonProperty("path") String path,
                      @JsonProperty("get") ApiOperation get,
                      @JsonProperty("post") ApiOperation post,
                      @JsonProperty("put") ApiOperation put,
                      @JsonProperty("delete") ApiOperation delete,
                      @JsonProperty("patch") ApiOperation patch) {

    /**
     * The declared operations keyed by upper-case HTTP method, in GET, POST, PUT, DELETE, PATCH order.
     */
    @JsonIgnore
    public Map<String, ApiOperation> operations() {
        Map<String, ApiOperation> operations = new LinkedHashMap<>();
        putIfPresent(operations, "GET", get);
        putIfPresent(operations, "POST", post);
        putIfPresent(operations, "PUT", put);
        putIfPresent(operations, "DELETE", delete);
        putIfPresent(operations, "PATCH", patch);
        return Collections.unmodifiableMap(operations);
    }

    private static void putIfPresent(Map<String, ApiOperation> operations, String method, ApiOperation operation) {
        if (operation != null) {
            operations.put(method, operation);
        }
    }
}
