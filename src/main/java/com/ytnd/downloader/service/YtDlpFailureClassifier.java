package com.ytnd.downloader.service;

import com.ytnd.downloader.model.BlockedSignal;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Matches yt-dlp's error wording. The phrases are not a stable API and may need updating
 * when the tool or the site changes its messages.
 */
public class YtDlpFailureClassifier implements FailureClassifier {

    private static final Map<String, BlockedSignal> SIGNALS = new LinkedHashMap<>();

    static {
        SIGNALS.put("http error 403", BlockedSignal.FORBIDDEN);
        SIGNALS.put("forbidden", BlockedSignal.FORBIDDEN);
        SIGNALS.put("429", BlockedSignal.RATE_LIMITED);
        SIGNALS.put("too many requests", BlockedSignal.RATE_LIMITED);
        SIGNALS.put("sign in to confirm your age", BlockedSignal.AGE_GATE);
        SIGNALS.put("playback on other websites has been disabled by the video owner", BlockedSignal.OWNER_DISABLED);
    }

    @Override
    public BlockedSignal classify(String failureText) {
        if (failureText == null || failureText.isEmpty()) {
            return BlockedSignal.OTHER;
        }
        String text = failureText.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, BlockedSignal> signal : SIGNALS.entrySet()) {
            if (text.contains(signal.getKey())) {
                return signal.getValue();
            }
        }
        return BlockedSignal.OTHER;
    }
}
