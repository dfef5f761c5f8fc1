package com.apitools.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The request body of an operation.
 *
 * @param required    Whether the body is required.
 * @param contentType {@code application/x-www-form-urlencoded} or {@code application/json}.
 * @param description The body description, may be {@code null}.
 * @param schema      The resolved body schema, may be {@code null}.
 * @param encoding    Per-property encoding hints, empty for JSON bodies.
 */
public record ApiRequestBody(boolean required, String contentType, String description, ApiSchema schema,
                             Map<String, ApiEncoding> encoding) {

    public ApiRequestBody {
        encoding = encoding == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(encoding));
    }
}
