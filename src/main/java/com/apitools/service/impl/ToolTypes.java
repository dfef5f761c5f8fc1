package com.apitools.service.impl;

import com.apitools.model.ApiParameter;
import com.apitools.model.ApiSchema;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Maps OpenAPI types onto tool parameter types.
 */
final class ToolTypes {

    static final String STRING = "string";
    static final String INTEGER = "integer";
    static final String FLOAT = "float";
    static final String BOOL = "bool";
    static final String ANY = "any";

    private ToolTypes() {
    }

    static String primitive(String openApiType) {
        if (openApiType == null) {
            return STRING;
        }
        switch (openApiType) {
            case "integer":
                return INTEGER;
            case "number":
                return FLOAT;
            case "boolean":
                return BOOL;
            default:
                return STRING;
        }
    }

    static String list(String elementType) {
        return "list[" + elementType + "]";
    }

    static String union(Collection<String> types) {
        return "union[" + String.join(", ", types) + "]";
    }

    static String parameterType(ApiParameter parameter) {
        String type;
        if (parameter.unionTypes() != null && !parameter.unionTypes().isEmpty()) {
            Set<String> branches = new LinkedHashSet<>();
            parameter.unionTypes().forEach(branch -> branches.add(branchType(branch)));
            type = union(branches);
        } else if (ApiSchema.ARRAY.equals(parameter.type())) {
            type = list(primitive(parameter.itemType()));
        } else {
            type = primitive(parameter.type());
        }
        if (ToolNames.isListName(parameter.name()) && !type.startsWith("list[")) {
            return list(type);
        }
        return type;
    }

    /**
     * The type of a resolved body property. Objects have no flat representation and become {@code any}.
     */
    static String schemaType(ApiSchema schema) {
        if (schema.anyOf() != null && !schema.anyOf().isEmpty()) {
            Set<String> branches = new LinkedHashSet<>();
            schema.anyOf().forEach(branch -> branches.add(schemaType(branch)));
            return union(branches);
        }
        if (schema.type().size() > 1) {
            Set<String> branches = new LinkedHashSet<>();
            schema.type().forEach(branch -> branches.add(branchType(branch)));
            return union(branches);
        }
        String type = schema.primaryType();
        if (ApiSchema.ARRAY.equals(type)) {
            return list(schema.items() == null ? ANY : schemaType(schema.items()));
        }
        if (ApiSchema.OBJECT.equals(type)) {
            return ANY;
        }
        return primitive(type);
    }

    private static String branchType(String openApiType) {
        if (ApiSchema.ARRAY.equals(openApiType)) {
            return list(ANY);
        }
        if (openApiType == null || ApiSchema.OBJECT.equals(openApiType)) {
            return ANY;
        }
        return primitive(openApiType);
    }
}
