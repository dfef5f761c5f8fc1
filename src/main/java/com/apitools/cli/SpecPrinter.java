package com.apitools.cli;

import com.apitools.model.ApiOperation;
import com.apitools.model.ApiParameter;
import com.apitools.model.ApiPath;
import com.apitools.model.ApiSchema;
import com.apitools.model.ApiSpecification;
import com.apitools.model.Tool;
import com.apitools.model.ToolParameter;
import java.util.List;

/**
 * Plain-text rendering of specifications and tools for the shell.
 */
final class SpecPrinter {

    private static final String INDENT = "  ";

    private SpecPrinter() {
    }

    static String printSpecification(ApiSpecification specification) {
        StringBuilder out = new StringBuilder();
        out.append("Paths (").append(specification.paths().size()).append("):\n");
        for (ApiPath path : specification.paths()) {
            out.append(path.path()).append('\n');
            path.operations().forEach((method, operation) -> printOperation(out, method, operation));
        }
        return out.toString().stripTrailing();
    }

    private static void printOperation(StringBuilder out, String method, ApiOperation operation) {
        out.append(INDENT).append(method).append(' ').append(operation.id());
        if (operation.summary() != null) {
            out.append(" - ").append(operation.summary());
        }
        out.append('\n');
        if (!operation.parameters().isEmpty()) {
            out.append(INDENT.repeat(2)).append("parameters:\n");
            for (ApiParameter parameter : operation.parameters()) {
                out.append(INDENT.repeat(3)).append("- ").append(parameter.name())
                        .append(" (").append(parameter.in()).append(", ").append(parameter.type())
                        .append(parameter.required() ? ", required" : "").append(')');
                if (parameter.enumValues() != null) {
                    out.append(" enum ").append(parameter.enumValues());
                }
                if (parameter.defaultValue() != null) {
                    out.append(" default ").append(parameter.defaultValue());
                }
                out.append('\n');
            }
        }
        if (operation.requestBody() != null) {
            out.append(INDENT.repeat(2)).append("body (").append(operation.requestBody().contentType()).append("):\n");
            printSchema(out, operation.requestBody().schema(), 3);
        }
        if (!operation.responses().isEmpty()) {
            out.append(INDENT.repeat(2)).append("responses:\n");
            operation.responses().forEach((status, response) -> {
                out.append(INDENT.repeat(3)).append(status).append(' ').append(response.format());
                if (!response.description().isEmpty()) {
                    out.append(" - ").append(response.description());
                }
                out.append('\n');
                printSchema(out, response.schema(), 4);
            });
        }
    }

    private static void printSchema(StringBuilder out, ApiSchema schema, int level) {
        if (schema == null) {
            return;
        }
        out.append(INDENT.repeat(level)).append(schema.name()).append(": ").append(String.join(" | ", schema.type()));
        if (schema.anyOf() != null) {
            out.append(" (anyOf ").append(schema.anyOf().size()).append(')');
        }
        if (schema.allOf() != null) {
            out.append(" (allOf ").append(schema.allOf().size()).append(')');
        }
        out.append('\n');
        for (ApiSchema property : schema.properties()) {
            printSchema(out, property, level + 1);
        }
        printSchema(out, schema.items(), level + 1);
    }

    static String printTools(List<Tool> tools) {
        StringBuilder out = new StringBuilder();
        out.append("Tools (").append(tools.size()).append("):\n");
        for (Tool tool : tools) {
            out.append(tool.name());
            if (!tool.description().isEmpty()) {
                out.append(": ").append(tool.description());
            }
            out.append('\n').append(INDENT).append(tool.method()).append(' ').append(tool.path()).append('\n');
            for (ToolParameter parameter : tool.parameters()) {
                out.append(INDENT).append("- ").append(parameter.name()).append(": ").append(parameter.type());
                if (parameter.required()) {
                    out.append(" (required)");
                }
                if (parameter.defaultValue() != null) {
                    out.append(" = ").append(parameter.defaultValue());
                }
                if (!parameter.description().isEmpty()) {
                    out.append(" - ").append(parameter.description());
                }
                out.append('\n');
            }
        }
        return out.toString().stripTrailing();
    }
}
