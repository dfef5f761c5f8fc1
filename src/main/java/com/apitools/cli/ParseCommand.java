package com.apitools.cli;

import com.apitools.cli.ui.Spinner;
import com.apitools.dto.request.SpecSourceRequest;
import com.apitools.dto.response.CommandResponse;
import com.apitools.model.ApiSpecification;
import com.apitools.model.SpecSource;
import com.apitools.service.api.OpenApiService;
import java.util.Arrays;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Prints the resolved paths of an OpenAPI document.
 */
@ShellComponent
public class ParseCommand {

    private final OpenApiService openApiService;
    private final Spinner spinner;

    public ParseCommand(OpenApiService openApiService, Spinner spinner) {
        this.openApiService = openApiService;
        this.spinner = spinner;
    }

    /**
     * Parses the document and prints every selected path with its operations, parameters,
     * request body and responses.
     *
     * @param file     Path of a local document.
     * @param url      URL of a remote document.
     * @param routes   Route patterns selecting the paths to parse.
     * @param useCache Whether to read and write the spec cache.
     * @return The rendered specification, or a red error message.
     */
    @ShellMethod(key = "parse", value = "Parse an OpenAPI spec and print its resolved paths.")
    public String parse(
            @ShellOption(help = "Path to a local OpenAPI file.", defaultValue = ShellOption.NULL) String file,
            @ShellOption(help = "URL of a remote OpenAPI document.", defaultValue = ShellOption.NULL) String url,
            @ShellOption(help = "Route patterns to include, e.g. /v1/users.", arity = Integer.MAX_VALUE) String[] routes,
            @ShellOption(value = "--use-cache", help = "Use the spec cache.", defaultValue = "false", arity = 0) boolean useCache
    ) {
        SpecSource source = new SpecSourceRequest(file, url).toSource();
        try {
            ApiSpecification specification = spinner.spin("Parsing " + source.location() + "...",
                    () -> openApiService.loadAndParseSpec(source, Arrays.asList(routes), useCache));
            return SpecPrinter.printSpecification(specification);
        } catch (Exception e) {
            return CommandResponse.error("Failed to parse spec: " + e.getMessage()).toAnsiString();
        }
    }
}
