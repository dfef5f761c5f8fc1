package com.apitools.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A path, query, header or cookie parameter of an operation.
 *
 * @param name         The parameter name as written in the document, e.g. {@code expand[]}.
 * @param in           The parameter location.
 * @param required     Whether the parameter must be supplied. Forced to {@code true} when an enum is present.
 * @param type         The primitive type name of the parameter schema.
 * @param itemType     The element type when {@code type} is {@code array}.
 * @param unionTypes   Branch types of a {@code oneOf} or {@code anyOf} schema, {@code null} when absent.
 * @param enumValues   Allowed values, {@code null} when the schema has no enum.
 * @param defaultValue The schema default, may be {@code null}.
 * @param description  The parameter description, may be {@code null}.
 */
public record ApiParameter(String name, String in, boolean required, String type, String itemType,
                           List<String> unionTypes, List<Object> enumValues, Object defaultValue,
                           String description) {

    public ApiParameter {
        unionTypes = unionTypes == null ? null : List.copyOf(unionTypes);
        // enums may legitimately contain null
        enumValues = enumValues == null ? null : Collections.unmodifiableList(new ArrayList<>(enumValues));
        if (enumValues != null) {
            required = true;
        }
    }
}
