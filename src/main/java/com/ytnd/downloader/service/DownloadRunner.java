package com.ytnd.downloader.service;

import com.ytnd.downloader.config.DownloaderConfig;
import com.ytnd.downloader.extract.ExtractionTool;
import com.ytnd.downloader.model.EntryOutcome;
import com.ytnd.downloader.model.FailedEntry;
import com.ytnd.downloader.model.MediaEntry;
import com.ytnd.downloader.model.MetadataResult;
import com.ytnd.downloader.model.RunResult;
import com.ytnd.downloader.store.CacheStoreException;
import com.ytnd.downloader.store.SongCacheStore;
import com.ytnd.downloader.util.Messages;
import com.ytnd.downloader.util.UserIds;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one user's queue through metadata resolution, deduplication and downloading, then
 * persists the song cache and clears the queue.
 */
@Slf4j
public class DownloadRunner {

    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final DownloaderConfig config;
    private final QueueService queueService;
    private final SongCacheStore cacheStore;
    private final ExtractionTool extractionTool;
    private final FailureClassifier failureClassifier;
    private final TagWriterService tagWriter;
    private final ImageTranscoder imageTranscoder;
    private final DiskSpaceProbe diskSpaceProbe;
    private final String ffmpegLocation;
    private final MetadataResolver metadataResolver;
    private final DuplicateFilter duplicateFilter;

    public DownloadRunner(DownloaderConfig config, QueueService queueService, SongCacheStore cacheStore,
                          ExtractionTool extractionTool, FailureClassifier failureClassifier,
                          TagWriterService tagWriter, ImageTranscoder imageTranscoder,
                          DiskSpaceProbe diskSpaceProbe, String ffmpegLocation) {
        this.config = config;
        this.queueService = queueService;
        this.cacheStore = cacheStore;
        this.extractionTool = extractionTool;
        this.failureClassifier = failureClassifier;
        this.tagWriter = tagWriter;
        this.imageTranscoder = imageTranscoder;
        this.diskSpaceProbe = diskSpaceProbe;
        this.ffmpegLocation = ffmpegLocation;
        this.metadataResolver = new MetadataResolver(extractionTool, config);
        this.duplicateFilter = new DuplicateFilter();
    }

    public RunResult run(String userId) {
        return run(userId, config.getWorkers());
    }

    /**
     * Processes the whole queue snapshot of {@code userId} with {@code workers} threads per phase.
     * Only queue-store failures escape; everything else ends up in the returned summary.
     */
    public RunResult run(String userId, int workers) {
        String uid = UserIds.sanitize(userId);
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive: " + workers);
        }
        MDC.put("uid", uid);
        try {
            List<String> urls = queueService.list(uid);
            if (urls.isEmpty()) {
                log.info(Messages.get("run.queue.empty", uid));
                return RunResult.empty();
            }

            Path outputDir = UserIds.resolveUnder(config.getOutputRootPath(), uid);
            Path coverDir = UserIds.resolveUnder(config.getCoversRootPath(), uid);

            if (!hasEnoughSpace(outputDir)) {
                log.error(Messages.get("run.disk.insufficient", config.getMinFreeSpaceMb()));
                queueService.clear(uid);
                return RunResult.insufficientDiskSpace();
            }

            RunResult result;
            try {
                result = process(uid, urls, workers, outputDir, coverDir);
            } finally {
                queueService.clear(uid);
            }
            log.info(Messages.get("run.summary", result.getDownloaded(), result.getDuplicates(), result.getErrors()));
            return result;
        } finally {
            MDC.remove("uid");
        }
    }

    private RunResult process(String uid, List<String> urls, int workers, Path outputDir, Path coverDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            log.error("Cannot create output directory {}: {}", outputDir, e.getMessage());
            List<FailedEntry> failed = new ArrayList<>();
            for (String url : urls) {
                failed.add(new FailedEntry(FailedEntry.PLACEHOLDER, FailedEntry.PLACEHOLDER, url,
                    "Cannot create output directory: " + e.getMessage(), 0));
            }
            return new RunResult(0, 0, failed);
        }

        log.info(Messages.get("run.start", uid, urls.size(), workers));

        List<MetadataResult> metadata;
        ExecutorService metadataPool = Executors.newFixedThreadPool(workers, namedThreads("ytnd-meta"));
        try {
            metadata = metadataResolver.resolveAll(urls, uid, metadataPool);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted during metadata resolution");
            return new RunResult(0, 0, interruptedFailures(urls));
        } finally {
            metadataPool.shutdownNow();
        }

        MetadataResolver.Expansion expansion = metadataResolver.expand(metadata);
        List<FailedEntry> failed = new ArrayList<>(expansion.getFailures());

        SongCache songCache = SongCache.load(cacheStore, uid);
        List<MediaEntry> entries = expansion.getEntries();
        List<MediaEntry> toDownload = duplicateFilter.filter(entries, songCache.keys(), outputDir);
        int duplicates = entries.size() - toDownload.size();

        if (toDownload.isEmpty()) {
            log.info(Messages.get("run.nothing.new", duplicates));
            return new RunResult(0, duplicates, failed);
        }

        CoverArtService coverArtService = new CoverArtService(extractionTool, imageTranscoder, coverDir,
            config.getCookiesFilePath(), config.getCoverConvertTimeoutSeconds());
        DownloadExecutor executor = new DownloadExecutor(extractionTool, failureClassifier, tagWriter,
            coverArtService, songCache, config, ffmpegLocation, outputDir);

        int downloaded = 0;
        int total = toDownload.size();
        ExecutorService downloadPool = Executors.newFixedThreadPool(workers, namedThreads("ytnd-dl"));
        try {
            CompletionService<EntryOutcome> completion = new ExecutorCompletionService<>(downloadPool);
            for (MediaEntry entry : toDownload) {
                completion.submit(() -> {
                    MDC.put("uid", uid);
                    try {
                        return executor.process(entry);
                    } finally {
                        MDC.clear();
                    }
                });
            }

            for (int done = 1; done <= total; done++) {
                EntryOutcome outcome = take(completion);
                if (outcome == null) {
                    failed.add(new FailedEntry(FailedEntry.PLACEHOLDER, FailedEntry.PLACEHOLDER,
                        FailedEntry.PLACEHOLDER, "Download task failed", 1));
                } else if (outcome.isSuccess()) {
                    downloaded++;
                } else {
                    logToolOutput(outcome);
                    failed.add(outcome.toFailedEntry());
                }
                log.info(Messages.get("run.progress", done, total));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for downloads");
        } finally {
            downloadPool.shutdownNow();
        }

        try {
            songCache.save(cacheStore);
        } catch (CacheStoreException e) {
            log.error("Failed to save song cache for {}: {}", uid, e.getMessage());
        }
        return new RunResult(downloaded, duplicates, failed);
    }

    private EntryOutcome take(CompletionService<EntryOutcome> completion) throws InterruptedException {
        try {
            return completion.take().get();
        } catch (ExecutionException e) {
            log.error("Download task failed", e.getCause());
            return null;
        }
    }

    private void logToolOutput(EntryOutcome outcome) {
        String title = outcome.getEntry().getTitle();
        if (!outcome.getStderr().isEmpty()) {
            log.error("yt-dlp stderr for {}: {}", title, outcome.getStderr());
        }
        if (!outcome.getStdout().isEmpty()) {
            log.info("yt-dlp stdout for {}: {}", title, outcome.getStdout());
        }
    }

    boolean hasEnoughSpace(Path outputDir) {
        Path probeDir = outputDir;
        while (probeDir != null && !Files.exists(probeDir)) {
            probeDir = probeDir.toAbsolutePath().getParent();
        }
        if (probeDir == null) {
            return true;
        }
        try {
            long freeMb = diskSpaceProbe.usableBytes(probeDir) / BYTES_PER_MB;
            return freeMb >= config.getMinFreeSpaceMb();
        } catch (IOException | RuntimeException e) {
            log.warn("Disk space check failed, continuing: {}", e.getMessage());
            return true;
        }
    }

    private List<FailedEntry> interruptedFailures(List<String> urls) {
        List<FailedEntry> failed = new ArrayList<>();
        for (String url : urls) {
            failed.add(FailedEntry.metadata(url, "Interrupted"));
        }
        return failed;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
