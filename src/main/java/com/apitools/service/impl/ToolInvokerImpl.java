package com.apitools.service.impl;

import com.apitools.exception.ToolInvocationException;
import com.apitools.model.ProxyRequest;
import com.apitools.model.RegisteredServer;
import com.apitools.model.Tool;
import com.apitools.model.ToolParameter;
import com.apitools.model.ToolResult;
import com.apitools.service.api.HttpProxy;
import com.apitools.service.api.ToolInvoker;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriUtils;

/**
 * Turns a tool call into one upstream HTTP request. Argument problems come back as a failed
 * {@link ToolResult} and never reach the proxy.
 */
@Service
@Slf4j
public class ToolInvokerImpl implements ToolInvoker {

    private final HttpProxy httpProxy;

    public ToolInvokerImpl(HttpProxy httpProxy) {
        this.httpProxy = httpProxy;
    }

    @Override
    public ToolResult invoke(RegisteredServer server, String toolName, Map<String, Object> arguments,
                             Map<String, String> incomingHeaders) {
        Tool tool = server.tool(toolName).orElse(null);
        if (tool == null) {
            return ToolResult.failure("Unknown tool '" + toolName + "' for server " + server.definition().namespace());
        }
        ProxyRequest request;
        try {
            request = buildRequest(server.definition().baseUrl(), tool, arguments);
        } catch (ToolInvocationException e) {
            log.warn("Rejected call to {}: {}", tool.name(), e.getMessage());
            return ToolResult.failure(e.getMessage());
        }
        log.info("Calling tool {} of {}", tool.name(), server.definition().namespace());
        return httpProxy.execute(server.definition(), request, incomingHeaders);
    }

    /**
     * Validates the arguments, fills in defaults and distributes the values over path, query,
     * headers, cookies and body.
     *
     * @throws ToolInvocationException on unknown arguments, missing required values or mismatched types.
     */
    ProxyRequest buildRequest(String baseUrl, Tool tool, Map<String, Object> arguments) {
        Map<String, Object> supplied = arguments == null ? Map.of() : arguments;
        Set<String> known = tool.parameters().stream().map(ToolParameter::name).collect(Collectors.toSet());
        List<String> unknown = supplied.keySet().stream().filter(name -> !known.contains(name)).sorted()
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new ToolInvocationException("Unknown argument(s) for tool '" + tool.name() + "': "
                    + String.join(", ", unknown));
        }

        String path = tool.path();
        Map<String, Object> query = new LinkedHashMap<>();
        Map<String, String> headers = new LinkedHashMap<>();
        List<String> cookies = new ArrayList<>();
        for (ToolParameter parameter : tool.queryParameters()) {
            Object value = argument(tool, parameter, supplied);
            if (value == null) {
                continue;
            }
            switch (parameter.location()) {
                case "path" -> path = path.replace("{" + parameter.sourceName() + "}",
                        UriUtils.encodePathSegment(String.valueOf(value), StandardCharsets.UTF_8));
                case "header" -> headers.put(parameter.sourceName(), String.valueOf(value));
                case "cookie" -> cookies.add(parameter.sourceName() + "=" + value);
                default -> query.put(parameter.sourceName(), value);
            }
        }
        if (!cookies.isEmpty()) {
            headers.put(HttpHeaders.COOKIE, String.join("; ", cookies));
        }

        Object jsonBody = null;
        Map<String, Object> formData = null;
        for (Map.Entry<String, List<ToolParameter>> entry : tool.bodyParametersByContentType().entrySet()) {
            Map<String, Object> body = new LinkedHashMap<>();
            for (ToolParameter parameter : entry.getValue()) {
                Object value = argument(tool, parameter, supplied);
                if (value != null) {
                    assign(body, parameter.requestBodyField(), value);
                }
            }
            if (body.isEmpty()) {
                continue;
            }
            if (OperationExtractorImpl.FORM_CONTENT_TYPE.equals(entry.getKey())) {
                formData = new LinkedHashMap<>();
                flattenForm("", body, formData);
            } else {
                jsonBody = body;
            }
        }
        return new ProxyRequest(tool.method(), joinUrl(baseUrl, path), query, headers, jsonBody, formData);
    }

    /**
     * The supplied value, else the default. {@code null} when an optional parameter is left out.
     */
    private static Object argument(Tool tool, ToolParameter parameter, Map<String, Object> supplied) {
        Object value = supplied.get(parameter.name());
        if (value == null) {
            value = parameter.defaultValue();
        }
        if (value == null) {
            if (parameter.required()) {
                throw new ToolInvocationException("Missing required argument '" + parameter.name()
                        + "' for tool '" + tool.name() + "'");
            }
            return null;
        }
        checkType(tool, parameter, value);
        return value;
    }

    private static void checkType(Tool tool, ToolParameter parameter, Object value) {
        String type = parameter.type();
        boolean matches;
        if (type.startsWith("list[")) {
            matches = value instanceof Collection<?>;
        } else {
            matches = switch (type) {
                case ToolTypes.INTEGER, ToolTypes.FLOAT -> value instanceof Number;
                case ToolTypes.BOOL -> value instanceof Boolean;
                case ToolTypes.STRING -> value instanceof String || value instanceof Number || value instanceof Boolean;
                default -> true;
            };
        }
        if (!matches) {
            throw new ToolInvocationException("Argument '" + parameter.name() + "' of tool '" + tool.name()
                    + "' expects " + type + " but got " + value.getClass().getSimpleName());
        }
    }

    /**
     * Places {@code value} at the dotted {@code field} path, creating intermediate objects.
     */
    @SuppressWarnings("unchecked")
    private static void assign(Map<String, Object> body, String field, Object value) {
        String[] segments = field.split("\\.");
        Map<String, Object> current = body;
        for (int i = 0; i < segments.length - 1; i++) {
            Object next = current.computeIfAbsent(segments[i], key -> new LinkedHashMap<String, Object>());
            if (!(next instanceof Map)) {
                throw new ToolInvocationException("Body field '" + segments[i] + "' is set both as a value and as an object");
            }
            current = (Map<String, Object>) next;
        }
        current.put(segments[segments.length - 1], value);
    }

    /**
     * Flattens nested objects into bracketed keys, {@code address[city]}.
     */
    private static void flattenForm(String prefix, Map<?, ?> values, Map<String, Object> target) {
        values.forEach((key, value) -> {
            String name = prefix.isEmpty() ? String.valueOf(key) : prefix + "[" + key + "]";
            if (value instanceof Map<?, ?> nested) {
                flattenForm(name, nested, target);
            } else {
                target.put(name, value);
            }
        });
    }

    private static String joinUrl(String baseUrl, String path) {
        if (baseUrl == null || baseUrl.isEmpty()) {
            return path;
        }
        if (baseUrl.endsWith("/") && path.startsWith("/")) {
            return baseUrl + path.substring(1);
        }
        return baseUrl + path;
    }
}
