package com.ytnd.downloader.model;

import lombok.Getter;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * Result value of one download task. Failures travel back to the coordinator as data,
 * never as exceptions thrown across the worker pool.
 */
@Getter
public class EntryOutcome {

    private final MediaEntry entry;
    private final boolean success;
    private final int attempts;
    private final String reason;
    private final String stdout;
    private final String stderr;
    private final List<Path> files;
    private final String coverFileName;

    private EntryOutcome(MediaEntry entry, boolean success, int attempts, String reason,
                         String stdout, String stderr, List<Path> files, String coverFileName) {
        this.entry = entry;
        this.success = success;
        this.attempts = attempts;
        this.reason = reason;
        this.stdout = stdout;
        this.stderr = stderr;
        this.files = files;
        this.coverFileName = coverFileName;
    }

    public static EntryOutcome success(MediaEntry entry, int attempts, List<Path> files, String coverFileName) {
        return new EntryOutcome(entry, true, attempts, null, "", "",
            Collections.unmodifiableList(files), coverFileName);
    }

    public static EntryOutcome failure(MediaEntry entry, int attempts, String reason, String stdout, String stderr) {
        return new EntryOutcome(entry, false, attempts, reason,
            stdout == null ? "" : stdout, stderr == null ? "" : stderr, Collections.emptyList(), null);
    }

    public FailedEntry toFailedEntry() {
        return new FailedEntry(
            entry.getTitle(),
            entry.getUploader(),
            entry.getCanonicalUrl(),
            reason == null || reason.isEmpty() ? "unknown error" : reason,
            attempts
        );
    }
}
