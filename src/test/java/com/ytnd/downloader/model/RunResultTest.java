package com.ytnd.downloader.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class RunResultTest {

    @Test
    void errorsAlwaysEqualFailedCount() {
        RunResult result = new RunResult(2, 1, Arrays.asList(
            FailedEntry.metadata("u1", "No metadata"),
            new FailedEntry("t", "a", "u2", "yt-dlp exit: boom", 1)));
        assertEquals(2, result.getErrors());
        assertEquals(2, result.getFailed().size());
    }

    @Test
    void insufficientDiskSpaceHasSingleSyntheticFailure() {
        RunResult result = RunResult.insufficientDiskSpace();
        assertEquals(0, result.getDownloaded());
        assertEquals(1, result.getErrors());
        FailedEntry failed = result.getFailed().get(0);
        assertEquals("Insufficient disk space", failed.getReason());
        assertEquals(0, failed.getAttempts());
        assertEquals(FailedEntry.PLACEHOLDER, failed.getUrl());
    }

    @Test
    void failureOutcomeDefaultsBlankReason() {
        MediaEntry entry = new MediaEntry();
        entry.setTitle("T");
        entry.setUploader("U");
        entry.setCanonicalUrl("https://x");
        FailedEntry failed = EntryOutcome.failure(entry, 2, "", "", "").toFailedEntry();
        assertEquals("unknown error", failed.getReason());
        assertEquals(2, failed.getAttempts());
        assertEquals("T", failed.getTitle());
    }
}
