package com.ytnd.downloader.service;

/**
 * No song cache record matches the requested id or title/artist.
 */
public class SongNotFoundException extends RuntimeException {

    public SongNotFoundException(String message) {
        super(message);
    }
}
