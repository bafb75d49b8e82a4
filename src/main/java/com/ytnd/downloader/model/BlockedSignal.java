package com.ytnd.downloader.model;

/**
 * Classification of an attempt-1 failure. Everything except {@link #OTHER} triggers the
 * alternate-client retry.
 */
public enum BlockedSignal {

    FORBIDDEN,
    RATE_LIMITED,
    AGE_GATE,
    OWNER_DISABLED,
    OTHER;

    public boolean isBlocked() {
        return this != OTHER;
    }
}
