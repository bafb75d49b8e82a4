package com.ytnd.downloader.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line of the failure list in a {@link RunResult}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FailedEntry {

    public static final String PLACEHOLDER = "—";

    private String title;
    private String artist;
    private String url;
    private String reason;
    private int attempts;

    public static FailedEntry metadata(String url, String reason) {
        return new FailedEntry(PLACEHOLDER, PLACEHOLDER, url, reason, 0);
    }
}
