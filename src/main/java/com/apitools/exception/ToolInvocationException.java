package com.apitools.exception;

/**
 * Raised when the arguments of a tool call do not fit the tool's parameters.
 */
public class ToolInvocationException extends ApiToolsException {

    public ToolInvocationException(String message) {
        super(message);
    }
}
