package com.apitools.service.api;

import com.apitools.model.ApiSpecification;
import com.apitools.model.SpecSource;
import java.util.List;

/**
 * Loads OpenAPI documents and turns them into the route-filtered {@link ApiSpecification} model.
 */
public interface OpenApiService {

    /**
     * Loads the document at {@code source}, keeps only the paths matching {@code routePatterns}
     * and resolves their operations.
     *
     * @param source        The local file or URL of the document.
     * @param routePatterns Regular expressions anchored at the start of the path.
     * @param useCache      Whether a cached result may be returned and a fresh result stored.
     * @return The parsed specification.
     * @throws com.apitools.exception.SpecLoadException if the document cannot be read or parsed.
     */
    ApiSpecification loadAndParseSpec(SpecSource source, List<String> routePatterns, boolean useCache);
}
