package com.apitools.model;

/**
 * The outcome of a tool call as returned to the caller.
 *
 * @param success    Whether the upstream answered with a 2xx status.
 * @param statusCode The upstream status, {@code 0} when no response was received.
 * @param body       The upstream response text or an error message.
 */
public record ToolResult(boolean success, int statusCode, String body) {

    public static ToolResult failure(String message) {
        return new ToolResult(false, 0, message);
    }

    public static ToolResult of(ProxyResponse response) {
        return new ToolResult(response.isSuccessful(), response.statusCode(), response.body());
    }
}
