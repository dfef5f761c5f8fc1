package com.apitools.model;

import java.util.List;

/**
 * The parsed, route-filtered view of an OpenAPI document. This is the unit stored in the spec cache.
 *
 * @param paths      Selected paths, in document order.
 * @param serverUrls Server URLs declared by the document.
 */
public record ApiSpecification(List<ApiPath> paths, List<String> serverUrls) {

    public ApiSpecification {
        paths = paths == null ? List.of() : List.copyOf(paths);
        serverUrls = serverUrls == null ? List.of() : List.copyOf(serverUrls);
    }

    public int operationCount() {
        return paths.stream().mapToInt(path -> path.operations().size()).sum();
    }
}
