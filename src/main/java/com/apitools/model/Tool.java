package com.apitools.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A callable tool compiled from one operation.
 *
 * @param name            The normalized snake_case operation id.
 * @param description     Summary, else description, else empty; single line.
 * @param method          The upper-case HTTP method.
 * @param path            The path template, e.g. {@code /users/{userId}}.
 * @param parameters      Ordered, de-duplicated parameters.
 * @param bodyContentType The content type of the request body, {@code null} without body parameters.
 */
public record Tool(String name, String description, String method, String path, List<ToolParameter> parameters,
                   String bodyContentType) {

    public Tool {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    /**
     * Parameters sent outside the body, in path, query, header or cookie, in tool order.
     */
    @JsonIgnore
    public List<ToolParameter> queryParameters() {
        return parameters.stream().filter(parameter -> !parameter.isBodyField()).collect(Collectors.toList());
    }

    /**
     * Body parameters keyed by the content type they are encoded with. Empty when the tool has no body.
     */
    @JsonIgnore
    public Map<String, List<ToolParameter>> bodyParametersByContentType() {
        List<ToolParameter> body = parameters.stream().filter(ToolParameter::isBodyField)
                .collect(Collectors.toList());
        Map<String, List<ToolParameter>> grouped = new LinkedHashMap<>();
        if (!body.isEmpty()) {
            grouped.put(bodyContentType != null ? bodyContentType : "application/json", List.copyOf(body));
        }
        return grouped;
    }
}
