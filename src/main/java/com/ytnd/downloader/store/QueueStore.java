package com.ytnd.downloader.store;

import java.util.List;

/**
 * Ordered per-user list of pending URLs.
 * Every method throws {@link QueueStoreException} when the backing store fails.
 */
public interface QueueStore {

    List<String> load(String userId);

    /**
     * Replaces the whole queue; an empty list clears it.
     */
    void replace(String userId, List<String> urls);

    /**
     * Appends after the current last position. No filtering happens here.
     */
    void append(String userId, List<String> urls);
}
