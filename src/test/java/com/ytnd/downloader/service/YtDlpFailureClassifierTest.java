package com.ytnd.downloader.service;

import com.ytnd.downloader.model.BlockedSignal;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class YtDlpFailureClassifierTest {

    private final FailureClassifier classifier = new YtDlpFailureClassifier();

    @Test
    void recognizesBlockedAccessMessages() {
        assertEquals(BlockedSignal.FORBIDDEN, classifier.classify("ERROR: unable to download: HTTP Error 403: Forbidden"));
        assertEquals(BlockedSignal.RATE_LIMITED, classifier.classify("HTTP Error 429: Too Many Requests"));
        assertEquals(BlockedSignal.AGE_GATE, classifier.classify("Sign in to confirm your age. This video may be inappropriate"));
        assertEquals(BlockedSignal.OWNER_DISABLED,
            classifier.classify("Playback on other websites has been disabled by the video owner"));
    }

    @Test
    void otherFailuresDoNotTriggerRetry() {
        assertEquals(BlockedSignal.OTHER, classifier.classify("ERROR: [youtube] abc: Video unavailable"));
        assertEquals(BlockedSignal.OTHER, classifier.classify(""));
        assertEquals(BlockedSignal.OTHER, classifier.classify(null));
        assertFalse(BlockedSignal.OTHER.isBlocked());
    }
}
