package com.apitools.dto.request;

import com.apitools.exception.InvalidSourceException;
import com.apitools.model.SpecSource;

/**
 * The {@code --file} / {@code --url} pair accepted by the spec commands. Exactly one must be set.
 */
public record SpecSourceRequest(String file, String url) {

    public SpecSource toSource() {
        boolean hasFile = file != null && !file.isBlank();
        boolean hasUrl = url != null && !url.isBlank();
        if (hasFile && hasUrl) {
            throw new InvalidSourceException("Error: Cannot specify both --file and --url");
        }
        if (!hasFile && !hasUrl) {
            throw new InvalidSourceException("Error: Must specify either --file or --url");
        }
        return hasFile ? SpecSource.file(file) : SpecSource.url(url);
    }
}
