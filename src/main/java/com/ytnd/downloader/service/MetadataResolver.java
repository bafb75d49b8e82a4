package com.ytnd.downloader.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.ytnd.downloader.config.DownloaderConfig;
import com.ytnd.downloader.extract.ExtractionOptions;
import com.ytnd.downloader.extract.ExtractionResult;
import com.ytnd.downloader.extract.ExtractionTool;
import com.ytnd.downloader.model.FailedEntry;
import com.ytnd.downloader.model.MediaEntry;
import com.ytnd.downloader.model.MetadataResult;
import com.ytnd.downloader.util.UrlUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Turns queued URLs into media metadata through the extraction tool.
 */
@Slf4j
public class MetadataResolver {

    private final ExtractionTool extractionTool;
    private final DownloaderConfig config;

    public MetadataResolver(ExtractionTool extractionTool, DownloaderConfig config) {
        this.extractionTool = extractionTool;
        this.config = config;
    }

    /**
     * Resolves one URL. Playlist URLs get a flat listing capped at the playlist limit;
     * anything else is stripped of its playlist context first.
     */
    public MetadataResult resolve(String url) {
        boolean playlist = UrlUtils.isPlaylistUrl(url);
        String effectiveUrl = playlist ? url : UrlUtils.stripPlaylistContext(url);

        ExtractionOptions options = ExtractionOptions.metadata(playlist, config.getPlaylistLimit())
            .withCookies(config.getCookiesFilePath());
        ExtractionResult result = extractionTool.extract(effectiveUrl, options);

        if (!result.isSuccess()) {
            log.warn("Metadata fetch failed for {}: {}", url, result.getReason());
            return MetadataResult.failure(url, "yt-dlp error: " + result.getReason());
        }
        JsonNode info = result.getInfo();
        if (info == null || info.isNull() || info.size() == 0) {
            return MetadataResult.failure(url, "No metadata");
        }
        return MetadataResult.success(url, info);
    }

    /**
     * Resolves every URL on {@code pool} and waits for all of them. Results keep queue order.
     */
    public List<MetadataResult> resolveAll(List<String> urls, String userId, ExecutorService pool)
        throws InterruptedException {
        List<Callable<MetadataResult>> tasks = new ArrayList<>();
        for (String url : urls) {
            tasks.add(() -> {
                MDC.put("uid", userId);
                MDC.put("step", "metadata");
                try {
                    return resolve(url);
                } finally {
                    MDC.clear();
                }
            });
        }

        List<Future<MetadataResult>> futures = pool.invokeAll(tasks);
        List<MetadataResult> results = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Metadata task failed for {}", urls.get(i), cause);
                results.add(MetadataResult.failure(urls.get(i), "Metadata fetch error: " + cause.getMessage()));
            }
        }
        return results;
    }

    /**
     * Flattens resolved metadata into media entries. Playlist data yields one entry per
     * non-null child; single-item data yields one entry.
     */
    public Expansion expand(List<MetadataResult> results) {
        Expansion expansion = new Expansion();
        for (MetadataResult result : results) {
            if (!result.isSuccess()) {
                String reason = result.getError() == null || result.getError().isEmpty()
                    ? "No metadata" : result.getError();
                expansion.failures.add(FailedEntry.metadata(result.getSourceUrl(), reason));
                continue;
            }

            JsonNode data = result.getData();
            JsonNode children = data.get("entries");
            if (children == null || !children.isArray()) {
                expansion.entries.add(MediaEntry.fromInfo(data));
                continue;
            }

            int added = 0;
            for (JsonNode child : children) {
                if (added >= config.getPlaylistLimit()) {
                    break;
                }
                if (child == null || child.isNull() || !child.isObject()) {
                    continue;
                }
                expansion.entries.add(MediaEntry.fromInfo(child));
                added++;
            }
            if (added == 0) {
                expansion.failures.add(FailedEntry.metadata(result.getSourceUrl(), "Playlist has no entries"));
            }
        }
        return expansion;
    }

    /**
     * Checks that a URL resolves to something downloadable without touching any state.
     */
    public ProbeResult probe(String url) {
        if (url == null || url.trim().isEmpty()) {
            return ProbeResult.failed("Empty URL");
        }
        if (url.length() > UrlUtils.MAX_URL_LENGTH) {
            return ProbeResult.failed("URL too long");
        }
        MetadataResult result = resolve(url.trim());
        if (!result.isSuccess()) {
            return ProbeResult.failed(result.getError());
        }
        JsonNode children = result.getData().get("entries");
        if (children != null && children.isArray()) {
            for (JsonNode child : children) {
                if (child != null && child.isObject()) {
                    return ProbeResult.ok();
                }
            }
            return ProbeResult.failed("Playlist has no entries");
        }
        if (!result.getData().has("id") && !result.getData().has("title")) {
            return ProbeResult.failed("Unrecognized response");
        }
        return ProbeResult.ok();
    }

    @Getter
    public static class Expansion {
        private final List<MediaEntry> entries = new ArrayList<>();
        private final List<FailedEntry> failures = new ArrayList<>();
    }

    @Getter
    public static class ProbeResult {
        private final boolean available;
        private final String reason;

        private ProbeResult(boolean available, String reason) {
            this.available = available;
            this.reason = reason;
        }

        public static ProbeResult ok() {
            return new ProbeResult(true, null);
        }

        public static ProbeResult failed(String reason) {
            return new ProbeResult(false, reason);
        }
    }
}
