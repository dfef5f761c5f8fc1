package com.apitools.model;

/**
 * One declared response of an operation.
 *
 * @param description The response description.
 * @param schema      The resolved {@code application/json} schema, {@code null} otherwise.
 * @param format      {@code application/json} or {@code text/plain}.
 */
public record ApiResponse(String description, ApiSchema schema, String format) {
}
