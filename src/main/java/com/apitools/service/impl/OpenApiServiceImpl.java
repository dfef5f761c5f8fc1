package com.apitools.service.impl;

import com.apitools.exception.ApiToolsException;
import com.apitools.exception.SpecLoadException;
import com.apitools.model.ApiSpecification;
import com.apitools.model.SpecSource;
import com.apitools.service.api.CacheStore;
import com.apitools.service.api.OpenApiService;
import com.apitools.service.api.OperationExtractor;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.parser.OpenAPIV3Parser;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

@Service
@Slf4j
public class OpenApiServiceImpl implements OpenApiService {

    private final OperationExtractor operationExtractor;
    private final CacheStore cacheStore;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OpenApiServiceImpl(OperationExtractor operationExtractor, CacheStore cacheStore) {
        this.operationExtractor = operationExtractor;
        this.cacheStore = cacheStore;
    }

    /**
     * {@inheritDoc}
     * The cache key covers the source and the sorted route patterns, so the same patterns in a
     * different order hit the same entry. A cache write failure is logged and the freshly parsed
     * result is still returned.
     */
    @Override
    public ApiSpecification loadAndParseSpec(SpecSource source, List<String> routePatterns, boolean useCache) {
        String key = cacheKey(source.location(), routePatterns);
        if (useCache) {
            Optional<ApiSpecification> cached = readCached(key);
            if (cached.isPresent()) {
                log.info("Loaded specification for {} from cache", source.location());
                return cached.get();
            }
        }

        log.info("Loading and parsing OpenAPI spec from: {}", source.location());
        OpenAPI document = readDocument(source);
        List<String> serverUrls = document.getServers() == null ? List.of()
                : document.getServers().stream().map(Server::getUrl).collect(Collectors.toList());
        ApiSpecification specification = new ApiSpecification(
                operationExtractor.extractPaths(document, routePatterns), serverUrls);
        log.info("Parsed {} operations on {} paths from {}", specification.operationCount(),
                specification.paths().size(), source.location());

        if (useCache) {
            writeCached(key, specification);
        }
        return specification;
    }

    /**
     * MD5 of the source and the sorted patterns.
     */
    static String cacheKey(String source, List<String> routePatterns) {
        List<String> sorted = new ArrayList<>(routePatterns);
        Collections.sort(sorted);
        String material = source + ":" + String.join(",", sorted);
        return DigestUtils.md5DigestAsHex(material.getBytes(StandardCharsets.UTF_8));
    }

    private OpenAPI readDocument(SpecSource source) {
        ParseOptions options = new ParseOptions();
        options.setResolve(true);
        SwaggerParseResult result;
        try {
            result = new OpenAPIV3Parser().readLocation(source.location(), null, options);
        } catch (RuntimeException e) {
            throw new SpecLoadException("Failed to load the OpenAPI specification from: " + source.location(), e);
        }
        if (result == null || result.getOpenAPI() == null || result.getOpenAPI().getPaths() == null) {
            String reasons = result == null || result.getMessages() == null || result.getMessages().isEmpty()
                    ? "unreadable or empty document"
                    : String.join("; ", result.getMessages());
            throw new SpecLoadException("Failed to load or parse the OpenAPI specification from the source: "
                    + source.location() + " (" + reasons + ")");
        }
        if (result.getMessages() != null && !result.getMessages().isEmpty()) {
            log.debug("Parser messages for {}: {}", source.location(), result.getMessages());
        }
        return result.getOpenAPI();
    }

    private Optional<ApiSpecification> readCached(String key) {
        Optional<byte[]> bytes = cacheStore.get(key);
        if (bytes.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(bytes.get(), ApiSpecification.class));
        } catch (IOException e) {
            log.warn("Ignoring unreadable cache entry {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCached(String key, ApiSpecification specification) {
        try {
            cacheStore.put(key, objectMapper.writeValueAsBytes(specification));
        } catch (IOException | ApiToolsException e) {
            log.warn("Could not cache specification under {}: {}", key, e.getMessage());
        }
    }
}
