package com.ytnd.downloader.store;

/**
 * Storage-layer failure of the queue. Fatal to whoever triggered it.
 */
public class QueueStoreException extends RuntimeException {

    public QueueStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
