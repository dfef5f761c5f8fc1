package com.apitools.config;

import com.apitools.exception.InvalidSourceException;
import com.apitools.exception.SpecLoadException;
import org.junit.jupiter.api.Test;
import org.springframework.shell.command.CommandHandlingResult;

import static org.assertj.core.api.Assertions.assertThat;

class CliExceptionResolverTest {

    private final CliExceptionResolver resolver = new CliExceptionResolver();

    @Test
    void resolve_shouldMapInvalidSourceToUsageExitCode() {
        CommandHandlingResult result = resolver.resolve(
                new InvalidSourceException("Error: Must specify either --file or --url"));

        assertThat(result).isNotNull();
        assertThat(result.exitCode()).isEqualTo(CliExceptionResolver.USAGE_EXIT_CODE);
        assertThat(result.message()).contains("Error: Must specify either --file or --url");
    }

    @Test
    void resolve_shouldLeaveOtherExceptionsToTheShell() {
        assertThat(resolver.resolve(new SpecLoadException("Failed to load"))).isNull();
    }
}
