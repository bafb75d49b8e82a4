package com.ytnd.downloader.store;

import com.ytnd.downloader.model.SongCacheRecord;

import java.util.List;

/**
 * Persistence of a user's completed-download records.
 */
public interface SongCacheStore {

    List<SongCacheRecord> load(String userId);

    void save(String userId, List<SongCacheRecord> records);
}
