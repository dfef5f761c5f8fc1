package com.apitools.service.api;

import com.apitools.model.ApiOperation;
import com.apitools.model.ApiSpecification;
import com.apitools.model.Tool;
import java.util.Collection;
import java.util.List;

/**
 * Compiles operations into tools with flat, normalized parameter lists.
 */
public interface ToolCompiler {

    /**
     * Compiles a single operation.
     *
     * @param operation       The operation.
     * @param method          The upper-case HTTP method.
     * @param path            The path template.
     * @param excludedParams  Parameter names the caller never supplies, raw or normalized.
     * @return The compiled tool. The result depends only on the inputs.
     */
    Tool compile(ApiOperation operation, String method, String path, Collection<String> excludedParams);

    /**
     * Compiles every operation of the specification in path and method order.
     */
    List<Tool> compileAll(ApiSpecification specification, Collection<String> excludedParams);
}
