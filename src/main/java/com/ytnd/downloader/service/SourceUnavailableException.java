package com.ytnd.downloader.service;

/**
 * The source URL of a song can no longer be resolved.
 */
public class SourceUnavailableException extends RuntimeException {

    public SourceUnavailableException(String message) {
        super(message);
    }
}
