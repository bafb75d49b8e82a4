package com.ytnd.downloader.extract;

/**
 * The external extractor/downloader. Implementations never throw for tool-level failures;
 * they report them through {@link ExtractionResult#failure(String, String, String)}.
 */
public interface ExtractionTool {

    ExtractionResult extract(String url, ExtractionOptions options);

    /**
     * Version string of the tool, or {@code null} when it cannot be executed.
     */
    String version();
}
