package com.ytnd.downloader.service;

import com.ytnd.downloader.model.SongCacheRecord;
import com.ytnd.downloader.store.CacheStoreException;
import com.ytnd.downloader.store.SongCacheStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory view of one user's completion cache, keyed by {@link SongCacheRecord#getKey()}.
 * Written by download workers, so every access goes through {@code lock}.
 */
@Slf4j
public class SongCache {

    private final String userId;
    private final Map<String, SongCacheRecord> records = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public SongCache(String userId, List<SongCacheRecord> initial) {
        this.userId = userId;
        for (SongCacheRecord record : initial) {
            if (record != null) {
                records.put(record.getKey(), record);
            }
        }
    }

    /**
     * Loads the persisted cache. An unreadable cache file yields an empty cache; it will be
     * overwritten by the next save.
     */
    public static SongCache load(SongCacheStore store, String userId) {
        try {
            return new SongCache(userId, store.load(userId));
        } catch (CacheStoreException e) {
            log.error("Failed to load song cache for {}, starting empty: {}", userId, e.getMessage());
            return new SongCache(userId, Collections.emptyList());
        }
    }

    public boolean contains(String key) {
        lock.lock();
        try {
            return records.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Inserts or replaces the record under its key.
     */
    public void put(SongCacheRecord record) {
        lock.lock();
        try {
            records.put(record.getKey(), record);
        } finally {
            lock.unlock();
        }
    }

    public SongCacheRecord remove(String key) {
        lock.lock();
        try {
            return records.remove(key);
        } finally {
            lock.unlock();
        }
    }

    public Set<String> keys() {
        lock.lock();
        try {
            return new HashSet<>(records.keySet());
        } finally {
            lock.unlock();
        }
    }

    public List<SongCacheRecord> records() {
        lock.lock();
        try {
            return new ArrayList<>(records.values());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Writes the whole cache back. Failures are the caller's to handle.
     */
    public void save(SongCacheStore store) {
        store.save(userId, records());
    }
}
