package com.ytnd.downloader.service;

import com.ytnd.downloader.config.DownloaderConfig;
import com.ytnd.downloader.extract.ExtractionOptions;
import com.ytnd.downloader.extract.ExtractionResult;
import com.ytnd.downloader.extract.ExtractionTool;
import com.ytnd.downloader.model.BlockedSignal;
import com.ytnd.downloader.model.EntryOutcome;
import com.ytnd.downloader.model.MediaEntry;
import com.ytnd.downloader.model.SongCacheRecord;
import com.ytnd.downloader.util.FileNameUtils;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Downloads one media entry, retrying once with the alternate client when the first
 * attempt looks blocked, then renames, tags and fetches the cover.
 * Runs on download-pool workers; the only shared state it touches is the {@link SongCache}.
 */
@Slf4j
public class DownloadExecutor {

    static final int MAX_REASON_LENGTH = 600;

    private final ExtractionTool extractionTool;
    private final FailureClassifier failureClassifier;
    private final TagWriterService tagWriter;
    private final CoverArtService coverArtService;
    private final SongCache songCache;
    private final DownloaderConfig config;
    private final String ffmpegLocation;
    private final Path outputDir;

    public DownloadExecutor(ExtractionTool extractionTool, FailureClassifier failureClassifier,
                            TagWriterService tagWriter, CoverArtService coverArtService, SongCache songCache,
                            DownloaderConfig config, String ffmpegLocation, Path outputDir) {
        this.extractionTool = extractionTool;
        this.failureClassifier = failureClassifier;
        this.tagWriter = tagWriter;
        this.coverArtService = coverArtService;
        this.songCache = songCache;
        this.config = config;
        this.ffmpegLocation = ffmpegLocation;
        this.outputDir = outputDir;
    }

    /**
     * Processes {@code entry} end to end. Never throws; every failure becomes a failed outcome.
     */
    public EntryOutcome process(MediaEntry entry) {
        MDC.put("vid", entry.getId() != null ? entry.getId() : "-");
        int attempts = 0;
        try {
            if (entry.getCanonicalUrl() == null || entry.getCanonicalUrl().isEmpty()) {
                return EntryOutcome.failure(entry, 0, "No URL for entry", "", "");
            }

            String prefix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
            Path template = outputDir.resolve(
                prefix + "_" + FileNameUtils.trackBaseName(entry.getTitle(), entry.getUploader()) + ".%(ext)s");
            ExtractionOptions options = ExtractionOptions.audioDownload(
                template, config.getAudioFormat(), config.getAudioQuality())
                .withCookies(config.getCookiesFilePath());
            options.setFfmpegLocation(ffmpegLocation);
            options.setTimeoutSeconds(config.getDownloadTimeoutSeconds());

            MDC.put("step", "download");
            attempts = 1;
            ExtractionResult result = extractionTool.extract(entry.getCanonicalUrl(), options);

            if (!result.isSuccess()) {
                BlockedSignal signal = failureClassifier.classify(result.getReason() + "\n" + result.getStderr());
                if (!signal.isBlocked()) {
                    return failed(entry, attempts, result);
                }

                log.info("Blocked ({}) on {}, retrying with {} client", signal, entry.getId(),
                    ExtractionOptions.ANDROID_CLIENT);
                Thread.sleep(config.getRetryBackoffMillis());

                ExtractionOptions retry = options.copy();
                retry.setPlayerClient(ExtractionOptions.ANDROID_CLIENT);
                attempts = 2;
                result = extractionTool.extract(entry.getCanonicalUrl(), retry);
                if (!result.isSuccess()) {
                    return failed(entry, attempts, result);
                }
            }

            List<Path> files = finalizeFiles(prefix);

            MDC.put("step", "tag");
            for (Path file : files) {
                tagWriter.writeTags(file, entry);
            }

            MDC.put("step", "cover");
            String cover = null;
            try {
                cover = coverArtService.saveCover(entry);
            } catch (RuntimeException e) {
                log.warn("Cover error for {}: {}", entry.getId(), e.getMessage());
            }

            songCache.put(SongCacheRecord.of(entry, cover));
            log.info("Downloaded: {} - {}", entry.getUploader(), entry.getTitle());
            return EntryOutcome.success(entry, attempts, files, cover);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return EntryOutcome.failure(entry, attempts, "Interrupted", "", "");
        } catch (IOException | RuntimeException e) {
            log.error("Unexpected error processing {}", entry.getTitle(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return EntryOutcome.failure(entry, Math.max(attempts, 1), message, "", "");
        } finally {
            MDC.remove("vid");
            MDC.remove("step");
        }
    }

    /**
     * Renames every {@code <prefix>_name} artifact to {@code name}.
     */
    List<Path> finalizeFiles(String prefix) throws IOException {
        List<Path> temporary = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(outputDir, prefix + "_*")) {
            for (Path path : stream) {
                temporary.add(path);
            }
        }

        List<Path> finalFiles = new ArrayList<>();
        for (Path path : temporary) {
            String name = path.getFileName().toString();
            Path target = outputDir.resolve(name.substring(name.indexOf('_') + 1));
            Files.move(path, target, StandardCopyOption.REPLACE_EXISTING);
            finalFiles.add(target);
        }
        return finalFiles;
    }

    private EntryOutcome failed(MediaEntry entry, int attempts, ExtractionResult result) {
        String reason = "yt-dlp exit: " + FileNameUtils.shorten(result.getReason(), MAX_REASON_LENGTH);
        log.warn("Download failed after {} attempt(s): {} - {}", attempts, entry.getTitle(), reason);
        return EntryOutcome.failure(entry, attempts, reason,
            FileNameUtils.shorten(result.getStdout(), MAX_REASON_LENGTH),
            FileNameUtils.shorten(result.getStderr(), MAX_REASON_LENGTH));
    }
}
