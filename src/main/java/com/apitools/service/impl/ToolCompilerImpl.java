package com.apitools.service.impl;

import com.apitools.model.ApiOperation;
import com.apitools.model.ApiParameter;
import com.apitools.model.ApiPath;
import com.apitools.model.ApiRequestBody;
import com.apitools.model.ApiSchema;
import com.apitools.model.ApiSpecification;
import com.apitools.model.Tool;
import com.apitools.model.ToolParameter;
import com.apitools.service.api.ToolCompiler;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Compiles operations into flat tool signatures.
 * <p>
 * Non-body parameters are emitted in reverse lexicographic order of their raw names, skipping
 * excluded names and names that collide after normalization. Request body properties follow:
 * {@code anyOf} properties become one union parameter, {@code allOf} properties one parameter per
 * leaf, scalars and arrays one parameter each. Plain nested objects are not exposed.
 */
@Service
@Slf4j
public class ToolCompilerImpl implements ToolCompiler {

    static final int DESCRIPTION_BUDGET = 100;
    static final int TRUNCATED_OPTIONS = 2;

    @Override
    public Tool compile(ApiOperation operation, String method, String path, Collection<String> excludedParams) {
        Set<String> excluded = excludedParams == null ? Set.of() : new HashSet<>(excludedParams);
        List<ToolParameter> parameters = new ArrayList<>();
        Set<String> dedupKeys = new HashSet<>();
        Set<String> names = new HashSet<>();

        List<ApiParameter> ordered = new ArrayList<>(operation.parameters());
        ordered.sort(Comparator.comparing(ApiParameter::name));
        Collections.reverse(ordered);
        for (ApiParameter parameter : ordered) {
            String name = ToolNames.normalize(parameter.name());
            if (excluded.contains(parameter.name()) || excluded.contains(name)) {
                continue;
            }
            if (!dedupKeys.add(ToolNames.dedupKey(parameter.name())) || !names.add(name)) {
                log.debug("Dropping duplicate parameter {} of {}", parameter.name(), operation.id());
                continue;
            }
            parameters.add(new ToolParameter(name, ToolTypes.parameterType(parameter), parameter.defaultValue(),
                    describeParameter(parameter), parameter.required(), parameter.in(), parameter.name(), null));
        }

        String bodyContentType = null;
        ApiRequestBody body = operation.requestBody();
        if (body != null && body.schema() != null) {
            for (ToolParameter parameter : flattenBody(body.schema())) {
                if (names.add(parameter.name())) {
                    parameters.add(parameter);
                    bodyContentType = body.contentType();
                } else {
                    log.debug("Body field {} of {} collides with an existing parameter", parameter.sourceName(),
                            operation.id());
                }
            }
        }

        return new Tool(ToolNames.normalize(operation.id()), toolDescription(operation), method, path, parameters,
                bodyContentType);
    }

    @Override
    public List<Tool> compileAll(ApiSpecification specification, Collection<String> excludedParams) {
        List<Tool> tools = new ArrayList<>();
        for (ApiPath path : specification.paths()) {
            path.operations().forEach((method, operation) ->
                    tools.add(compile(operation, method, path.path(), excludedParams)));
        }
        return tools;
    }

    private List<ToolParameter> flattenBody(ApiSchema root) {
        List<ToolParameter> parameters = new ArrayList<>();
        for (ApiSchema property : root.memberProperties()) {
            if (property.anyOf() != null) {
                parameters.add(bodyParameter(ToolNames.normalize(property.name()), ToolTypes.schemaType(property),
                        describeUnion(property), property.name()));
            } else if (property.allOf() != null) {
                for (ApiSchema leaf : property.properties()) {
                    parameters.add(bodyParameter(ToolNames.normalize(property.name() + "_" + leaf.name()),
                            ToolTypes.schemaType(leaf), ToolNames.sanitize(leaf.description()),
                            property.name() + "." + leaf.name()));
                }
            } else if (!property.isUnion() && ApiSchema.OBJECT.equals(property.primaryType())) {
                log.debug("Skipping nested object body field {}", property.name());
            } else {
                parameters.add(bodyParameter(ToolNames.normalize(property.name()), ToolTypes.schemaType(property),
                        ToolNames.sanitize(property.description()), property.name()));
            }
        }
        return parameters;
    }

    private static ToolParameter bodyParameter(String name, String type, String description, String field) {
        return new ToolParameter(name, type, null, description, false, ToolParameter.BODY, field, field);
    }

    /**
     * Appends enum options, keeping only the first two when the full list makes the text too long.
     */
    static String describeParameter(ApiParameter parameter) {
        String description = ToolNames.sanitize(parameter.description());
        if (parameter.enumValues() == null || parameter.enumValues().isEmpty()) {
            return description;
        }
        List<String> options = parameter.enumValues().stream().map(String::valueOf).collect(Collectors.toList());
        String full = withOptions(description, options);
        if (full.length() <= DESCRIPTION_BUDGET) {
            return full;
        }
        return withOptions(description, options.subList(0, Math.min(TRUNCATED_OPTIONS, options.size()))) + ", ...";
    }

    private static String withOptions(String description, List<String> options) {
        String listed = "Options: " + String.join(", ", options);
        return description.isEmpty() ? listed : description + " " + listed;
    }

    static String describeUnion(ApiSchema property) {
        String alternatives = property.anyOf().stream()
                .map(branch -> "(" + describeBranch(branch) + ")")
                .collect(Collectors.joining(" OR "));
        String description = ToolNames.sanitize(property.description());
        return description.isEmpty() ? "one of: " + alternatives : description + ", one of: " + alternatives;
    }

    private static String describeBranch(ApiSchema branch) {
        String description = ToolNames.sanitize(branch.description());
        if (!description.isEmpty()) {
            return description;
        }
        List<ApiSchema> members = branch.memberProperties();
        if (!members.isEmpty()) {
            return "Object with properties: "
                    + members.stream().map(ApiSchema::name).collect(Collectors.joining(", "));
        }
        return String.join(", ", branch.type());
    }

    private static String toolDescription(ApiOperation operation) {
        if (operation.summary() != null && !operation.summary().isEmpty()) {
            return ToolNames.sanitize(operation.summary());
        }
        return ToolNames.sanitize(operation.description());
    }
}
