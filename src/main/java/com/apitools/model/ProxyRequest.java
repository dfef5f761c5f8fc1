package com.apitools.model;

import java.util.Map;

/**
 * An outgoing upstream request assembled from a tool call.
 *
 * @param method      The upper-case HTTP method.
 * @param url         The absolute URL without query string.
 * @param queryParams Query parameters; collection values repeat the key.
 * @param headers     Request headers.
 * @param jsonBody    The JSON body, {@code null} when absent.
 * @param formData    Flattened form fields, {@code null} when absent.
 */
public record ProxyRequest(String method, String url, Map<String, Object> queryParams, Map<String, String> headers,
                           Object jsonBody, Map<String, Object> formData) {

    public ProxyRequest {
        queryParams = queryParams == null ? Map.of() : queryParams;
        headers = headers == null ? Map.of() : headers;
    }
}
