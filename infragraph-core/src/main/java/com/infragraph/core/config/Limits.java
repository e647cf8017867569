package com.infragraph.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Input limits enforced by callers before documents reach the pipeline.
 *
 * @param maxFiles maximum number of documents per run
 * @param maxBytesPerFile bytes read from each document; the rest is truncated
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Limits(
    @JsonProperty("maxFiles") Integer maxFiles,
    @JsonProperty("maxBytesPerFile") Integer maxBytesPerFile
) {
    public static final int DEFAULT_MAX_FILES = 25;
    public static final int DEFAULT_MAX_BYTES_PER_FILE = 30_000;

    public Limits {
        if (maxFiles == null || maxFiles <= 0) {
            maxFiles = DEFAULT_MAX_FILES;
        }
        if (maxBytesPerFile == null || maxBytesPerFile <= 0) {
            maxBytesPerFile = DEFAULT_MAX_BYTES_PER_FILE;
        }
    }

    public static Limits defaults() {
        return new Limits(null, null);
    }
}
