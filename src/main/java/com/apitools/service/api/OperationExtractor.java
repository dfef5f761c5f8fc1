package com.apitools.service.api;

import com.apitools.model.ApiPath;
import io.swagger.v3.oas.models.OpenAPI;
import java.util.List;

/**
 * Selects paths of a parsed document and converts their operations into the internal model.
 */
public interface OperationExtractor {

    /**
     * @param document      The parsed document.
     * @param routePatterns Regular expressions; a path is kept when any of them matches its beginning.
     * @return The selected paths in document order.
     */
    List<ApiPath> extractPaths(OpenAPI document, List<String> routePatterns);
}
