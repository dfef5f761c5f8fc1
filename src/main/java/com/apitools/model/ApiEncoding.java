package com.apitools.model;

/**
 * Serialization hints for one property of a form-encoded request body.
 */
public record ApiEncoding(Boolean explode, String style, Boolean allowReserved, String contentType) {
}
