package com.ytnd.downloader.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One pending URL in a user's queue.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueueItem {
    private String url;
    private int position;
}
