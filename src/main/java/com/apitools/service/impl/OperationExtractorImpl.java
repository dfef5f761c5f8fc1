package com.apitools.service.impl;

import com.apitools.model.ApiEncoding;
import com.apitools.model.ApiOperation;
import com.apitools.model.ApiParameter;
import com.apitools.model.ApiPath;
import com.apitools.model.ApiRequestBody;
import com.apitools.model.ApiResponse;
import com.apitools.model.ApiSchema;
import com.apitools.service.api.OperationExtractor;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.Encoding;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.parameters.RequestBody;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Projects swagger-parser's model onto {@link ApiPath} records for the selected routes.
 */
@Service
@Slf4j
public class OperationExtractorImpl implements OperationExtractor {

    static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";
    static final String JSON_CONTENT_TYPE = "application/json";
    static final String TEXT_CONTENT_TYPE = "text/plain";

    private static final String PARAMETERS_PREFIX = "#/components/parameters/";
    private static final String REQUEST_BODIES_PREFIX = "#/components/requestBodies/";
    private static final String RESPONSES_PREFIX = "#/components/responses/";

    private final SchemaResolver schemaResolver;
    private final int maxDepth;

    public OperationExtractorImpl(SchemaResolver schemaResolver,
                                  @Value("${apitools.schema.max-depth:10}") int maxDepth) {
        this.schemaResolver = schemaResolver;
        this.maxDepth = maxDepth;
    }

    /**
     * {@inheritDoc}
     * Matching uses {@link java.util.regex.Matcher#lookingAt()}, so {@code /users} also selects
     * {@code /users/{id}} while {@code /users$} selects only the collection path.
     */
    @Override
    public List<ApiPath> extractPaths(OpenAPI document, List<String> routePatterns) {
        List<Pattern> patterns = routePatterns.stream().map(OperationExtractorImpl::compileRoute)
                .collect(Collectors.toList());
        List<ApiPath> paths = new ArrayList<>();
        if (document.getPaths() == null) {
            return paths;
        }
        document.getPaths().forEach((path, item) -> {
            if (patterns.stream().noneMatch(pattern -> pattern.matcher(path).lookingAt())) {
                return;
            }
            log.debug("Selected path {}", path);
            List<Parameter> shared = item.getParameters() != null ? item.getParameters() : List.of();
            paths.add(new ApiPath(path,
                    toOperation(item.getGet(), path, shared, document),
                    toOperation(item.getPost(), path, shared, document),
                    toOperation(item.getPut(), path, shared, document),
                    toOperation(item.getDelete(), path, shared, document),
                    toOperation(item.getPatch(), path, shared, document)));
        });
        return paths;
    }

    /**
     * Compiles a route pattern. A pattern that is not a valid regular expression, such as a
     * literal path template with {@code {id}}, is matched literally.
     */
    static Pattern compileRoute(String route) {
        try {
            return Pattern.compile(route);
        } catch (PatternSyntaxException e) {
            log.debug("Route {} is not a regular expression, matching it literally", route);
            return Pattern.compile(Pattern.quote(route));
        }
    }

    private ApiOperation toOperation(Operation operation, String path, List<Parameter> shared, OpenAPI document) {
        if (operation == null) {
            return null;
        }
        String id = operation.getOperationId() != null ? operation.getOperationId() : path;
        return new ApiOperation(id, operation.getSummary(), operation.getDescription(),
                toParameters(shared, operation.getParameters(), document),
                toRequestBody(operation.getRequestBody(), document),
                toResponses(operation, document));
    }

    /**
     * Path-level parameters come first; an operation parameter with the same name and location replaces one.
     */
    private List<ApiParameter> toParameters(List<Parameter> shared, List<Parameter> own, OpenAPI document) {
        Map<String, ApiParameter> parameters = new LinkedHashMap<>();
        for (Parameter parameter : shared) {
            ApiParameter converted = toParameter(parameter, document);
            if (converted != null) {
                parameters.put(converted.in() + ":" + converted.name(), converted);
            }
        }
        if (own != null) {
            for (Parameter parameter : own) {
                ApiParameter converted = toParameter(parameter, document);
                if (converted != null) {
                    parameters.put(converted.in() + ":" + converted.name(), converted);
                }
            }
        }
        return new ArrayList<>(parameters.values());
    }

    private ApiParameter toParameter(Parameter parameter, OpenAPI document) {
        Parameter resolved = parameter;
        if (parameter.get$ref() != null) {
            resolved = lookup(parameter.get$ref(), PARAMETERS_PREFIX,
                    document.getComponents() == null ? null : document.getComponents().getParameters());
            if (resolved == null) {
                log.warn("Skipping unresolvable parameter reference {}", parameter.get$ref());
                return null;
            }
        }
        Schema<?> schema = dereference(resolved.getSchema(), document);
        String type = "string";
        String itemType = null;
        List<String> unionTypes = null;
        List<Object> enumValues = null;
        Object defaultValue = null;
        if (schema != null) {
            type = schema.getType() != null || schema.getTypes() != null ? SchemaResolver.typeOf(schema) : "string";
            if (ApiSchema.ARRAY.equals(type) && schema.getItems() != null) {
                Schema<?> items = dereference(schema.getItems(), document);
                itemType = items == null ? null : SchemaResolver.typeOf(items);
            }
            List<Schema> branches = schema.getOneOf() != null && !schema.getOneOf().isEmpty()
                    ? schema.getOneOf() : schema.getAnyOf();
            if (branches != null && !branches.isEmpty()) {
                unionTypes = new ArrayList<>();
                for (Schema<?> branch : branches) {
                    Schema<?> dereferenced = dereference(branch, document);
                    unionTypes.add(dereferenced == null ? ApiSchema.OBJECT : SchemaResolver.typeOf(dereferenced));
                }
            }
            if (schema.getEnum() != null) {
                enumValues = schema.getEnum().stream().map(OperationExtractorImpl::plainValue)
                        .collect(Collectors.toList());
            }
            defaultValue = plainValue(schema.getDefault());
        }
        return new ApiParameter(resolved.getName(), resolved.getIn(), Boolean.TRUE.equals(resolved.getRequired()),
                type, itemType, unionTypes, enumValues, defaultValue, resolved.getDescription());
    }

    private ApiRequestBody toRequestBody(RequestBody requestBody, OpenAPI document) {
        RequestBody resolved = requestBody;
        if (requestBody != null && requestBody.get$ref() != null) {
            resolved = lookup(requestBody.get$ref(), REQUEST_BODIES_PREFIX,
                    document.getComponents() == null ? null : document.getComponents().getRequestBodies());
        }
        if (resolved == null || resolved.getContent() == null) {
            return null;
        }
        String contentType = selectContentType(resolved.getContent());
        if (contentType == null) {
            log.debug("Request body has no form or JSON content: {}", resolved.getContent().keySet());
            return null;
        }
        MediaType media = resolved.getContent().get(contentType);
        ApiSchema schema = media.getSchema() == null ? null
                : schemaResolver.resolve(media.getSchema(), SchemaResolver.INLINE, document, 0, maxDepth,
                new HashSet<>());
        Map<String, ApiEncoding> encoding = new LinkedHashMap<>();
        if (media.getEncoding() != null) {
            for (Map.Entry<String, Encoding> entry : media.getEncoding().entrySet()) {
                Encoding value = entry.getValue();
                encoding.put(entry.getKey(), new ApiEncoding(value.getExplode(),
                        value.getStyle() == null ? null : value.getStyle().toString(),
                        value.getAllowReserved(), value.getContentType()));
            }
        }
        return new ApiRequestBody(Boolean.TRUE.equals(resolved.getRequired()), normalizedContentType(contentType),
                resolved.getDescription(), schema, encoding);
    }

    private Map<String, ApiResponse> toResponses(Operation operation, OpenAPI document) {
        Map<String, ApiResponse> responses = new LinkedHashMap<>();
        if (operation.getResponses() == null) {
            return responses;
        }
        operation.getResponses().forEach((status, response) -> {
            io.swagger.v3.oas.models.responses.ApiResponse resolved = response;
            if (response.get$ref() != null) {
                resolved = lookup(response.get$ref(), RESPONSES_PREFIX,
                        document.getComponents() == null ? null : document.getComponents().getResponses());
                if (resolved == null) {
                    return;
                }
            }
            String description = resolved.getDescription() != null ? resolved.getDescription() : "";
            MediaType json = resolved.getContent() == null ? null : jsonMedia(resolved.getContent());
            if (json != null) {
                ApiSchema schema = json.getSchema() == null ? null
                        : schemaResolver.resolve(json.getSchema(), SchemaResolver.INLINE, document, 0, maxDepth,
                        new HashSet<>());
                responses.put(status, new ApiResponse(description, schema, JSON_CONTENT_TYPE));
            } else {
                responses.put(status, new ApiResponse(description, null, TEXT_CONTENT_TYPE));
            }
        });
        return responses;
    }

    /**
     * Form encoding wins over JSON when both are offered.
     */
    private static String selectContentType(Content content) {
        if (content.containsKey(FORM_CONTENT_TYPE)) {
            return FORM_CONTENT_TYPE;
        }
        return content.keySet().stream().filter(OperationExtractorImpl::isJson).findFirst().orElse(null);
    }

    private static MediaType jsonMedia(Content content) {
        return content.entrySet().stream()
                .filter(entry -> isJson(entry.getKey()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
    }

    private static boolean isJson(String contentType) {
        return contentType.equals(JSON_CONTENT_TYPE) || contentType.startsWith(JSON_CONTENT_TYPE + ";");
    }

    private static String normalizedContentType(String contentType) {
        return isJson(contentType) ? JSON_CONTENT_TYPE : contentType;
    }

    /**
     * Follows a single {@code components.schemas} reference.
     */
    private static Schema<?> dereference(Schema<?> schema, OpenAPI document) {
        if (schema == null || schema.get$ref() == null) {
            return schema;
        }
        if (document.getComponents() == null || document.getComponents().getSchemas() == null) {
            return null;
        }
        return document.getComponents().getSchemas().get(SchemaResolver.refName(schema.get$ref()));
    }

    private static <T> T lookup(String ref, String prefix, Map<String, T> components) {
        if (components == null || !ref.startsWith(prefix)) {
            return null;
        }
        return components.get(ref.substring(prefix.length()));
    }

    /**
     * Keeps JSON-friendly scalars and renders anything else, such as parsed dates, as text.
     */
    private static Object plainValue(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        return value.toString();
    }
}
