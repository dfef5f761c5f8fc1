package com.apitools.config;

import com.apitools.dto.response.CommandResponse;
import com.apitools.exception.InvalidSourceException;
import org.springframework.shell.command.CommandExceptionResolver;
import org.springframework.shell.command.CommandHandlingResult;
import org.springframework.stereotype.Component;

/**
 * Turns usage errors of the spec commands into a red message and exit code {@value #USAGE_EXIT_CODE}.
 * Other exceptions are left to the shell's default handling.
 */
@Component
public class CliExceptionResolver implements CommandExceptionResolver {

    static final int USAGE_EXIT_CODE = 2;

    @Override
    public CommandHandlingResult resolve(Exception ex) {
        if (ex instanceof InvalidSourceException) {
            return CommandHandlingResult.of(CommandResponse.error(ex.getMessage()).toAnsiString() + "\n",
                    USAGE_EXIT_CODE);
        }
        return null;
    }
}
