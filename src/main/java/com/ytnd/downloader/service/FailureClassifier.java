package com.ytnd.downloader.service;

import com.ytnd.downloader.model.BlockedSignal;

/**
 * Decides whether a failed download attempt looks like blocked access.
 */
public interface FailureClassifier {

    BlockedSignal classify(String failureText);
}
