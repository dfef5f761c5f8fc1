package com.apitools.service.impl;

import com.apitools.model.Tool;
import com.apitools.model.ToolParameter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Describes tools as JSON objects with a JSON Schema for their input, the shape tool-calling
 * clients expect.
 */
@Component
public class ToolManifestBuilder {

    private final ObjectMapper objectMapper = new ObjectMapper();

    public ObjectNode build(Tool tool) {
        ObjectNode manifest = objectMapper.createObjectNode();
        manifest.put("name", tool.name());
        manifest.put("description", tool.description());

        ObjectNode input = manifest.putObject("inputSchema");
        input.put("type", "object");
        ObjectNode properties = input.putObject("properties");
        ArrayNode required = objectMapper.createArrayNode();
        tool.queryParameters().forEach(parameter -> addProperty(properties, required, parameter));
        tool.bodyParametersByContentType().values()
                .forEach(body -> body.forEach(parameter -> addProperty(properties, required, parameter)));
        if (!required.isEmpty()) {
            input.set("required", required);
        }
        return manifest;
    }

    private void addProperty(ObjectNode properties, ArrayNode required, ToolParameter parameter) {
        ObjectNode property = typeSchema(parameter.type());
        if (parameter.description() != null && !parameter.description().isEmpty()) {
            property.put("description", parameter.description());
        }
        if (parameter.defaultValue() != null) {
            property.set("default", objectMapper.valueToTree(parameter.defaultValue()));
        }
        properties.set(parameter.name(), property);
        if (parameter.required()) {
            required.add(parameter.name());
        }
    }

    public ArrayNode buildAll(List<Tool> tools) {
        ArrayNode manifests = objectMapper.createArrayNode();
        tools.forEach(tool -> manifests.add(build(tool)));
        return manifests;
    }

    ObjectNode typeSchema(String type) {
        ObjectNode schema = objectMapper.createObjectNode();
        if (type.startsWith("list[") && type.endsWith("]")) {
            schema.put("type", "array");
            schema.set("items", typeSchema(type.substring("list[".length(), type.length() - 1)));
            return schema;
        }
        if (type.startsWith("union[") && type.endsWith("]")) {
            ArrayNode anyOf = schema.putArray("anyOf");
            splitTopLevel(type.substring("union[".length(), type.length() - 1)).forEach(branch -> anyOf.add(typeSchema(branch)));
            return schema;
        }
        switch (type) {
            case ToolTypes.STRING -> schema.put("type", "string");
            case ToolTypes.INTEGER -> schema.put("type", "integer");
            case ToolTypes.FLOAT -> schema.put("type", "number");
            case ToolTypes.BOOL -> schema.put("type", "boolean");
            default -> {
                // any: no constraint
            }
        }
        return schema;
    }

    private static List<String> splitTopLevel(String types) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < types.length(); i++) {
            char c = types.charAt(i);
            if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(types.substring(start, i).trim());
                start = i + 1;
            }
        }
        parts.add(types.substring(start).trim());
        return parts;
    }
}
