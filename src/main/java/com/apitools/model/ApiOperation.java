package com.apitools.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single HTTP operation extracted from an OpenAPI document.
 *
 * @param id          The operationId, or the path when the document declares none.
 * @param summary     The operation summary, may be {@code null}.
 * @param description The operation description, may be {@code null}.
 * @param parameters  Non-body parameters, in document order.
 * @param requestBody The request body, may be {@code null}.
 * @param responses   Responses keyed by status code, in document order.
 */
public record ApiOperation(String id, String summary, String description, List<ApiParameter> parameters,
                           ApiRequestBody requestBody, Map<String, ApiResponse> responses) {

    public ApiOperation {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        responses = responses == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(responses));
    }
}
