package com.apitools.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Locale;

/**
 * Whether proxied calls are recorded to, or answered from, cassette files.
 */
public enum CassetteMode {
    OFF,
    RECORD,
    REPLAY;

    @JsonCreator
    public static CassetteMode fromValue(String value) {
        return value == null ? OFF : valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
