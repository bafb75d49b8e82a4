package com.ytnd.downloader.store;

/**
 * The song cache could not be read or written.
 */
public class CacheStoreException extends RuntimeException {

    public CacheStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
