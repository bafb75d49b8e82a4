package com.ytnd.downloader.tag;

/**
 * Tags could not be written to an audio file.
 */
public class TagWriteException extends Exception {

    public TagWriteException(String message) {
        super(message);
    }

    public TagWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
