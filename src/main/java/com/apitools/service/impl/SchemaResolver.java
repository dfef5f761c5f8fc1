package com.apitools.service.impl;

import com.apitools.model.ApiSchema;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.media.Schema;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns swagger {@link Schema} nodes into {@link ApiSchema} trees.
 * <p>
 * References are followed through {@code components.schemas}. The set of references already
 * entered is tracked per path from the root, so a schema reached twice through independent
 * branches is resolved both times while a cycle yields {@code null} at the repeated reference.
 * Resolution also stops at {@code maxDepth}.
 */
@Component
@Slf4j
public class SchemaResolver {

    public static final String INLINE = "inline";
    static final String ITEM = "item";
    private static final String COMPONENTS_PREFIX = "#/components/schemas/";

    /**
     * Resolves {@code node} into a schema tree.
     *
     * @param node        The node to resolve, may be {@code null}.
     * @param name        The name to give the result when {@code node} is not a reference.
     * @param document    The document owning {@code node}.
     * @param depth       The current depth, {@code 0} at the root.
     * @param maxDepth    The depth at which resolution stops.
     * @param visitedRefs References entered on the way from the root to {@code node}.
     * @return The resolved schema, or {@code null} when the node is absent, too deep, cyclic or unresolvable.
     */
    public ApiSchema resolve(Schema<?> node, String name, OpenAPI document, int depth, int maxDepth,
                             Set<String> visitedRefs) {
        if (node == null || depth >= maxDepth) {
            return null;
        }
        Schema<?> target = node;
        String schemaName = name;
        Set<String> path = visitedRefs;
        if (node.get$ref() != null) {
            String ref = node.get$ref();
            if (visitedRefs.contains(ref)) {
                log.debug("Cycle detected at {}", ref);
                return null;
            }
            target = lookup(ref, document);
            if (target == null) {
                log.debug("Could not resolve reference {}", ref);
                return null;
            }
            schemaName = refName(ref);
            path = new HashSet<>(visitedRefs);
            path.add(ref);
            if (target.get$ref() != null) {
                return resolve(target, schemaName, document, depth + 1, maxDepth, path);
            }
        }

        if (hasEntries(target.getAllOf())) {
            return resolveAllOf(target, schemaName, document, depth, maxDepth, path);
        }
        if (hasEntries(target.getAnyOf())) {
            return resolveAnyOf(target, schemaName, document, depth, maxDepth, path);
        }
        if (ApiSchema.ARRAY.equals(typeOf(target))) {
            ApiSchema items = resolve(target.getItems(), ITEM, document, depth + 1, maxDepth, path);
            if (items == null && target.getItems() != null) {
                items = placeholder(itemName(target.getItems()), target.getItems());
            }
            return new ApiSchema(schemaName, List.of(ApiSchema.ARRAY), target.getDescription(), List.of(), items,
                    null, null);
        }
        if (target.getProperties() != null && !target.getProperties().isEmpty()) {
            List<ApiSchema> properties = new ArrayList<>();
            for (Map.Entry<String, Schema> entry : target.getProperties().entrySet()) {
                properties.add(resolveProperty(entry.getKey(), entry.getValue(), document, depth, maxDepth, path));
            }
            return new ApiSchema(schemaName, List.of(ApiSchema.OBJECT), target.getDescription(), properties, null,
                    null, null);
        }
        return ApiSchema.leaf(schemaName, typeOf(target), target.getDescription());
    }

    private ApiSchema resolveAllOf(Schema<?> target, String name, OpenAPI document, int depth, int maxDepth,
                                   Set<String> path) {
        List<ApiSchema> branches = new ArrayList<>();
        List<ApiSchema> merged = new ArrayList<>();
        for (Schema<?> branch : target.getAllOf()) {
            ApiSchema resolved = resolve(branch, INLINE, document, depth + 1, maxDepth, path);
            if (resolved != null) {
                branches.add(resolved);
                merged.addAll(resolved.memberProperties());
            }
        }
        ApiSchema child = new ApiSchema(ApiSchema.ALL_OF, List.of(ApiSchema.OBJECT), null, merged, null, null, null);
        return new ApiSchema(name, List.of(ApiSchema.OBJECT), target.getDescription(), List.of(child), null, null,
                branches);
    }

    private ApiSchema resolveAnyOf(Schema<?> target, String name, OpenAPI document, int depth, int maxDepth,
                                   Set<String> path) {
        List<ApiSchema> branches = new ArrayList<>();
        List<String> types = new ArrayList<>();
        List<ApiSchema> merged = new ArrayList<>();
        for (Schema<?> branch : target.getAnyOf()) {
            ApiSchema resolved = resolve(branch, INLINE, document, depth + 1, maxDepth, path);
            if (resolved != null) {
                branches.add(resolved);
                types.addAll(resolved.type());
                merged.addAll(resolved.memberProperties());
            }
        }
        ApiSchema child = new ApiSchema(ApiSchema.ANY_OF, types, target.getDescription(), merged, null, null, null);
        return new ApiSchema(name, types, target.getDescription(), List.of(child), null, branches, null);
    }

    /**
     * Resolves one object property. A property written as a reference or a composition takes the
     * shape of the first nested property of its resolved schema, keeping its own name, its own
     * description when it has one, and the composition branches.
     */
    private ApiSchema resolveProperty(String propertyName, Schema<?> raw, OpenAPI document, int depth, int maxDepth,
                                      Set<String> path) {
        ApiSchema resolved = resolve(raw, propertyName, document, depth + 1, maxDepth, path);
        if (resolved == null) {
            return placeholder(propertyName, raw);
        }
        if (raw.get$ref() == null && !hasEntries(raw.getAnyOf()) && !hasEntries(raw.getAllOf())) {
            return resolved.withName(propertyName);
        }
        ApiSchema shape = resolved.properties().isEmpty() ? resolved : resolved.properties().get(0);
        String description = raw.getDescription() != null ? raw.getDescription() : resolved.description();
        return new ApiSchema(propertyName, shape.type(), description, shape.properties(), shape.items(),
                resolved.anyOf() != null ? resolved.anyOf() : shape.anyOf(),
                resolved.allOf() != null ? resolved.allOf() : shape.allOf());
    }

    private static ApiSchema placeholder(String name, Schema<?> raw) {
        String type = raw.get$ref() != null ? ApiSchema.OBJECT : typeOf(raw);
        return ApiSchema.leaf(name, type, raw.getDescription());
    }

    private static Schema<?> lookup(String ref, OpenAPI document) {
        if (!ref.startsWith(COMPONENTS_PREFIX)
                || document.getComponents() == null
                || document.getComponents().getSchemas() == null) {
            return null;
        }
        return document.getComponents().getSchemas().get(ref.substring(COMPONENTS_PREFIX.length()));
    }

    static String refName(String ref) {
        return ref.substring(ref.lastIndexOf('/') + 1);
    }

    private static String itemName(Schema<?> items) {
        return items.get$ref() != null ? refName(items.get$ref()) : ITEM;
    }

    /**
     * The declared type, looking at the 3.1 type set when the 3.0 field is empty.
     */
    static String typeOf(Schema<?> schema) {
        if (schema.getType() != null) {
            return schema.getType();
        }
        if (schema.getTypes() != null) {
            for (String type : schema.getTypes()) {
                if (!"null".equals(type)) {
                    return type;
                }
            }
        }
        return ApiSchema.OBJECT;
    }

    private static boolean hasEntries(List<?> list) {
        return list != null && !list.isEmpty();
    }
}
