package com.ytnd.downloader.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Summary of one run. Not persisted.
 */
@Data
public class RunResult {

    public static final String INSUFFICIENT_DISK_SPACE = "Insufficient disk space";

    private int downloaded;
    private int duplicates;
    private int errors;
    private List<FailedEntry> failed = new ArrayList<>();

    public RunResult() {
    }

    public RunResult(int downloaded, int duplicates, List<FailedEntry> failed) {
        this.downloaded = downloaded;
        this.duplicates = duplicates;
        this.failed = new ArrayList<>(failed);
        this.errors = failed.size();
    }

    public static RunResult empty() {
        return new RunResult(0, 0, Collections.emptyList());
    }

    public static RunResult insufficientDiskSpace() {
        FailedEntry failure = new FailedEntry(
            FailedEntry.PLACEHOLDER, FailedEntry.PLACEHOLDER, FailedEntry.PLACEHOLDER, INSUFFICIENT_DISK_SPACE, 0);
        return new RunResult(0, 0, Collections.singletonList(failure));
    }
}
