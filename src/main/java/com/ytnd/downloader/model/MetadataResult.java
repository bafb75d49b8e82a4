package com.ytnd.downloader.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

/**
 * Outcome of resolving one queued URL: either info JSON or an error text, never both.
 */
@Getter
public class MetadataResult {

    private final String sourceUrl;
    private final JsonNode data;
    private final String error;

    private MetadataResult(String sourceUrl, JsonNode data, String error) {
        this.sourceUrl = sourceUrl;
        this.data = data;
        this.error = error;
    }

    public static MetadataResult success(String sourceUrl, JsonNode data) {
        return new MetadataResult(sourceUrl, data, null);
    }

    public static MetadataResult failure(String sourceUrl, String error) {
        return new MetadataResult(sourceUrl, null, error);
    }

    public boolean isSuccess() {
        return data != null && error == null;
    }
}
