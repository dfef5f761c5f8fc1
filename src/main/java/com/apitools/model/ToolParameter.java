package com.apitools.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A parameter of a compiled tool.
 *
 * @param name             The normalized identifier.
 * @param type             One of {@code string}, {@code integer}, {@code float}, {@code bool},
 *                         {@code list[T]}, {@code union[T1, T2]} or {@code any}.
 * @param defaultValue     The default value, may be {@code null}.
 * @param description      Single-line description, enum options appended.
 * @param required         Whether a value must be supplied.
 * @param location         {@code path}, {@code query}, {@code header}, {@code cookie} or {@code body}.
 * @param sourceName       The name used on the wire.
 * @param requestBodyField The dotted body field this parameter fills, {@code null} outside the body.
 */
public record ToolParameter(String name, String type, Object defaultValue, String description, boolean required,
                            String location, String sourceName, String requestBodyField) {

    public static final String BODY = "body";

    @JsonIgnore
    public boolean isBodyField() {
        return requestBodyField != null;
    }
}
