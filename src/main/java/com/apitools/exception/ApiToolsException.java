package com.apitools.exception;

/**
 * Base runtime exception for failures raised while loading specifications,
 * compiling tools, or serving tool calls.
 */
public class ApiToolsException extends RuntimeException {

    /**
     * @param message The detail message.
     */
    public ApiToolsException(String message) {
        super(message);
    }

    /**
     * @param message The detail message.
     * @param cause   The underlying failure, may be {@code null}.
     */
    public ApiToolsException(String message, Throwable cause) {
        super(message, cause);
    }
}
