package com.ytnd.downloader.service;

import java.nio.file.Path;

/**
 * Converts a cover image to JPEG.
 */
public interface ImageTranscoder {

    /**
     * @return true when {@code target} was written
     */
    boolean toJpeg(Path source, Path target, long timeoutSeconds);
}
