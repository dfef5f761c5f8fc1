package com.apitools.exception;

/**
 * Raised when an OpenAPI document cannot be fetched or parsed.
 */
public class SpecLoadException extends ApiToolsException {

    public SpecLoadException(String message) {
        super(message);
    }

    public SpecLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
