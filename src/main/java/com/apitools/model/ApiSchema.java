package com.apitools.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;

/**
 * A node of a resolved schema tree.
 * <p>
 * Composition keywords are represented by a wrapper node: an {@code allOf} schema carries a
 * single synthetic child named {@value #ALL_OF} holding the concatenated properties of every
 * branch, an {@code anyOf} schema a single child named {@value #ANY_OF}. The original branches
 * stay available through {@link #allOf()} and {@link #anyOf()}.
 *
 * @param name        The property name, the referenced component name, or {@code inline}.
 * @param type        One or more type names; more than one means a union.
 * @param description The schema description, may be {@code null}.
 * @param properties  Child schemas, in document order.
 * @param items       The element schema of an array.
 * @param anyOf       The resolved {@code anyOf} branches, {@code null} when absent.
 * @param allOf       The resolved {@code allOf} branches, {@code null} when absent.
 */
public record ApiSchema(String name, List<String> type, String description, List<ApiSchema> properties,
                        ApiSchema items, List<ApiSchema> anyOf, List<ApiSchema> allOf) {

    public static final String ALL_OF = "all_of";
    public static final String ANY_OF = "any_of";
    public static final String OBJECT = "object";
    public static final String ARRAY = "array";

    public ApiSchema {
        type = type == null || type.isEmpty() ? List.of(OBJECT) : List.copyOf(type);
        properties = properties == null ? List.of() : List.copyOf(properties);
        anyOf = anyOf == null ? null : List.copyOf(anyOf);
        allOf = allOf == null ? null : List.copyOf(allOf);
    }

    /**
     * Creates a schema without children.
     */
    public static ApiSchema leaf(String name, String type, String description) {
        return new ApiSchema(name, List.of(type), description, List.of(), null, null, null);
    }

    public ApiSchema withName(String newName) {
        return new ApiSchema(newName, type, description, properties, items, anyOf, allOf);
    }

    public String primaryType() {
        return type.get(0);
    }

    @JsonIgnore
    public boolean isUnion() {
        return anyOf != null || type.size() > 1;
    }

    /**
     * Whether this node is a composition wrapper holding one synthetic child.
     */
    @JsonIgnore
    public boolean isCompositionWrapper() {
        return (allOf != null || anyOf != null)
                && properties.size() == 1
                && (ALL_OF.equals(properties.get(0).name()) || ANY_OF.equals(properties.get(0).name()));
    }

    /**
     * The properties a consumer sees, looking through a composition wrapper.
     */
    public List<ApiSchema> memberProperties() {
        return isCompositionWrapper() ? properties.get(0).properties() : properties;
    }
}
