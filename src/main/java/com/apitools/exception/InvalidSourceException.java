package com.apitools.exception;

/**
 * Raised by the CLI when neither or both of {@code --file} and {@code --url} are given.
 */
public class InvalidSourceException extends ApiToolsException {

    public InvalidSourceException(String message) {
        super(message);
    }
}
