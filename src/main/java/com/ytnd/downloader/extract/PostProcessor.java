package com.ytnd.downloader.extract;

/**
 * Post-processing steps the extraction tool runs after a media download.
 */
public enum PostProcessor {
    /** Convert to the target audio codec. */
    EXTRACT_AUDIO,
    /** Write title/artist/date into the container. */
    ADD_METADATA,
    /** Fetch the thumbnail and embed it as cover art. */
    EMBED_THUMBNAIL
}
