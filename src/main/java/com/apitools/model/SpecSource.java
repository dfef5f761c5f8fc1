package com.apitools.model;

/**
 * Where an OpenAPI document is read from.
 *
 * @param location A local file path or an http(s) URL.
 * @param remote   Whether {@code location} is a URL.
 */
public record SpecSource(String location, boolean remote) {

    private static final String FILE_SCHEME = "file://";

    public static SpecSource file(String path) {
        return new SpecSource(path, false);
    }

    public static SpecSource url(String url) {
        return new SpecSource(url, true);
    }

    /**
     * Interprets a configured location: {@code file://} URIs become local paths,
     * {@code http(s)} URLs stay remote, anything else is treated as a path.
     */
    public static SpecSource parse(String location) {
        if (location.startsWith(FILE_SCHEME)) {
            return file(location.substring(FILE_SCHEME.length()));
        }
        if (location.startsWith("http://") || location.startsWith("https://")) {
            return url(location);
        }
        return file(location);
    }
}
