package com.apitools.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Map;

/**
 * The upstream answer to a {@link ProxyRequest}.
 */
public record ProxyResponse(int statusCode, Map<String, String> headers, String body) {

    public ProxyResponse {
        headers = headers == null ? Map.of() : headers;
        body = body == null ? "" : body;
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
