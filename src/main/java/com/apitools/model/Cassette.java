package com.apitools.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * A recorded upstream exchange.
 *
 * @param request   The request as sent. Sensitive header values are stored encrypted.
 * @param response  The response as received.
 * @param timestamp ISO-8601 local time of the recording.
 */
public record Cassette(Request request, Response response, String timestamp) {

    public record Request(String method, String url, Map<String, Object> params, Object json,
                          Map<String, Object> form, Map<String, String> headers) {
    }

    public record Response(@JsonProperty("status_code") int statusCode, Map<String, String> headers, String text) {
    }
}
