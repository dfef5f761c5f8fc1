package com.apitools.cli;

import com.apitools.cli.ui.Spinner;
import com.apitools.dto.request.SpecSourceRequest;
import com.apitools.dto.response.CommandResponse;
import com.apitools.model.SpecSource;
import com.apitools.model.Tool;
import com.apitools.service.api.OpenApiService;
import com.apitools.service.api.ToolCompiler;
import java.util.Arrays;
import java.util.List;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Prints the tools compiled from an OpenAPI document.
 */
@ShellComponent
public class ToolsCommand {

    private final OpenApiService openApiService;
    private final ToolCompiler toolCompiler;
    private final Spinner spinner;

    public ToolsCommand(OpenApiService openApiService, ToolCompiler toolCompiler, Spinner spinner) {
        this.openApiService = openApiService;
        this.toolCompiler = toolCompiler;
        this.spinner = spinner;
    }

    /**
     * @param forwardQueryParams Query parameters the proxy fills from headers; they are left out of the tools.
     */
    @ShellMethod(key = "tools", value = "Compile an OpenAPI spec into tools and print them.")
    public String tools(
            @ShellOption(help = "Path to a local OpenAPI file.", defaultValue = ShellOption.NULL) String file,
            @ShellOption(help = "URL of a remote OpenAPI document.", defaultValue = ShellOption.NULL) String url,
            @ShellOption(help = "Route patterns to include, e.g. /v1/users.", arity = Integer.MAX_VALUE) String[] routes,
            @ShellOption(value = "--forward-query-params", help = "Query parameters supplied by the proxy.",
                    arity = Integer.MAX_VALUE, defaultValue = ShellOption.NULL) String[] forwardQueryParams,
            @ShellOption(value = "--use-cache", help = "Use the spec cache.", defaultValue = "false", arity = 0) boolean useCache
    ) {
        SpecSource source = new SpecSourceRequest(file, url).toSource();
        List<String> excluded = forwardQueryParams == null ? List.of() : Arrays.asList(forwardQueryParams);
        try {
            List<Tool> tools = spinner.spin("Compiling tools from " + source.location() + "...",
                    () -> toolCompiler.compileAll(
                            openApiService.loadAndParseSpec(source, Arrays.asList(routes), useCache), excluded));
            return SpecPrinter.printTools(tools);
        } catch (Exception e) {
            return CommandResponse.error("Failed to compile tools: " + e.getMessage()).toAnsiString();
        }
    }
}
