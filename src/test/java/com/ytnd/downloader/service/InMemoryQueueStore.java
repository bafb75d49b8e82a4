package com.ytnd.downloader.service;

import com.ytnd.downloader.store.QueueStore;
import com.ytnd.downloader.store.QueueStoreException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

class InMemoryQueueStore implements QueueStore {

    private final Map<String, List<String>> queues = new HashMap<>();
    boolean failLoads;

    @Override
    public synchronized List<String> load(String userId) {
        if (failLoads) {
            throw new QueueStoreException("store down", null);
        }
        return new ArrayList<>(queues.getOrDefault(userId, new ArrayList<>()));
    }

    @Override
    public synchronized void replace(String userId, List<String> urls) {
        queues.put(userId, new ArrayList<>(urls));
    }

    @Override
    public synchronized void append(String userId, List<String> urls) {
        queues.computeIfAbsent(userId, k -> new ArrayList<>()).addAll(urls);
    }
}
