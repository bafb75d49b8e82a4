package com.ytnd.downloader.service;

import com.ytnd.downloader.store.QueueStore;
import com.ytnd.downloader.util.UrlUtils;
import com.ytnd.downloader.util.UserIds;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Queue intake and maintenance on top of a {@link QueueStore}.
 */
@Slf4j
public class QueueService {

    private final QueueStore queueStore;

    public QueueService(QueueStore queueStore) {
        this.queueStore = queueStore;
    }

    public List<String> list(String userId) {
        return queueStore.load(UserIds.sanitize(userId));
    }

    /**
     * Appends trimmed URLs, skipping blanks, overly long ones and any already queued.
     *
     * @return number of URLs actually added
     */
    public int add(String userId, List<String> urls) {
        String uid = UserIds.sanitize(userId);
        Set<String> present = new LinkedHashSet<>(queueStore.load(uid));
        List<String> accepted = new ArrayList<>();
        for (String raw : urls) {
            if (raw == null) {
                continue;
            }
            String url = raw.trim();
            if (url.isEmpty() || url.length() > UrlUtils.MAX_URL_LENGTH) {
                if (!url.isEmpty()) {
                    log.warn("Skipping URL longer than {} characters", UrlUtils.MAX_URL_LENGTH);
                }
                continue;
            }
            if (present.add(url)) {
                accepted.add(url);
            }
        }
        if (!accepted.isEmpty()) {
            queueStore.append(uid, accepted);
        }
        log.info("Queue for {} now holds {} URL(s)", uid, present.size());
        return accepted.size();
    }

    /**
     * Removes every queued occurrence of the given URLs (verbatim match after trimming).
     *
     * @return number of queue entries removed
     */
    public int remove(String userId, List<String> urls) {
        String uid = UserIds.sanitize(userId);
        Set<String> targets = new HashSet<>();
        for (String url : urls) {
            if (url != null) {
                targets.add(url.trim());
            }
        }
        List<String> current = queueStore.load(uid);
        List<String> remaining = new ArrayList<>();
        for (String url : current) {
            if (!targets.contains(url)) {
                remaining.add(url);
            }
        }
        int removed = current.size() - remaining.size();
        if (removed > 0) {
            queueStore.replace(uid, remaining);
        }
        return removed;
    }

    public void clear(String userId) {
        queueStore.replace(UserIds.sanitize(userId), new ArrayList<>());
    }
}
