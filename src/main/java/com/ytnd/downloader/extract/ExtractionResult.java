package com.ytnd.downloader.extract;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * Structured outcome of an extraction-tool call. Failures carry the tool's free-text reason.
 */
@Getter
public class ExtractionResult {

    private final boolean success;
    private final JsonNode info;
    private final List<Path> artifacts;
    private final String reason;
    private final String stdout;
    private final String stderr;

    private ExtractionResult(boolean success, JsonNode info, List<Path> artifacts,
                             String reason, String stdout, String stderr) {
        this.success = success;
        this.info = info;
        this.artifacts = artifacts;
        this.reason = reason;
        this.stdout = stdout == null ? "" : stdout;
        this.stderr = stderr == null ? "" : stderr;
    }

    public static ExtractionResult metadata(JsonNode info) {
        return new ExtractionResult(true, info, Collections.emptyList(), null, "", "");
    }

    public static ExtractionResult downloaded(List<Path> artifacts) {
        return new ExtractionResult(true, null, Collections.unmodifiableList(artifacts), null, "", "");
    }

    public static ExtractionResult failure(String reason, String stdout, String stderr) {
        return new ExtractionResult(false, null, Collections.emptyList(), reason, stdout, stderr);
    }

    public static ExtractionResult failure(String reason) {
        return failure(reason, "", "");
    }
}
