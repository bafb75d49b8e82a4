package com.ytnd.downloader.service;

import com.ytnd.downloader.extract.ExtractionOptions;
import com.ytnd.downloader.extract.ExtractionResult;
import com.ytnd.downloader.extract.ExtractionTool;
import com.ytnd.downloader.model.MediaEntry;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Stores one cover per media id as {@code <id>.jpg} in a user's cover directory.
 * Existing covers in any known format are reused.
 */
@Slf4j
public class CoverArtService {

    public static final List<String> COVER_EXTENSIONS = Arrays.asList("jpg", "jpeg", "png", "webp");
    private static final List<String> FETCHED_EXTENSIONS = Arrays.asList("webp", "png", "jpeg", "jpg");

    private final ExtractionTool extractionTool;
    private final ImageTranscoder transcoder;
    private final Path coverDir;
    private final Path cookieFile;
    private final long convertTimeoutSeconds;

    public CoverArtService(ExtractionTool extractionTool, ImageTranscoder transcoder, Path coverDir,
                           Path cookieFile, long convertTimeoutSeconds) {
        this.extractionTool = extractionTool;
        this.transcoder = transcoder;
        this.coverDir = coverDir;
        this.cookieFile = cookieFile;
        this.convertTimeoutSeconds = convertTimeoutSeconds;
    }

    /**
     * @return the stored cover file name, or null when there is none
     */
    public String saveCover(MediaEntry entry) {
        String id = entry.getId();
        if (id == null || id.isEmpty()) {
            return null;
        }
        if (!isSafeId(id)) {
            log.warn("Refusing cover for unsafe id: {}", id);
            return null;
        }

        Path existing = findCover(id);
        if (existing != null) {
            return existing.getFileName().toString();
        }

        try {
            Files.createDirectories(coverDir);
        } catch (IOException e) {
            log.warn("Cannot create cover directory {}: {}", coverDir, e.getMessage());
            return null;
        }

        ExtractionOptions options = ExtractionOptions.thumbnailOnly(coverDir.resolve(id + ".%(ext)s"))
            .withCookies(cookieFile);
        ExtractionResult result = extractionTool.extract(entry.getCanonicalUrl(), options);
        if (!result.isSuccess()) {
            log.warn("Thumbnail fetch failed for {}: {}", id, result.getReason());
            return null;
        }

        Path fetched = null;
        for (String ext : FETCHED_EXTENSIONS) {
            Path candidate = coverDir.resolve(id + "." + ext);
            if (Files.exists(candidate)) {
                fetched = candidate;
                break;
            }
        }
        if (fetched == null) {
            log.warn("Thumbnail for {} not found after download", id);
            return null;
        }
        if (fetched.getFileName().toString().endsWith(".jpg")) {
            return fetched.getFileName().toString();
        }

        Path jpeg = coverDir.resolve(id + ".jpg");
        if (transcoder.toJpeg(fetched, jpeg, convertTimeoutSeconds) && Files.exists(jpeg)) {
            try {
                Files.deleteIfExists(fetched);
            } catch (IOException e) {
                log.debug("Could not remove original thumbnail {}: {}", fetched, e.getMessage());
            }
            return jpeg.getFileName().toString();
        }
        log.warn("Cover conversion failed, keeping {}", fetched.getFileName());
        return fetched.getFileName().toString();
    }

    /**
     * Existing cover for {@code id} in any known extension, or null.
     */
    public Path findCover(String id) {
        if (id == null || !isSafeId(id)) {
            return null;
        }
        for (String ext : COVER_EXTENSIONS) {
            Path candidate = coverDir.resolve(id + "." + ext);
            if (Files.exists(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Deletes every cover file stored for {@code id}.
     *
     * @return number of files removed
     */
    public int removeCovers(String id) {
        if (id == null || id.isEmpty() || !isSafeId(id)) {
            return 0;
        }
        int removed = 0;
        for (String ext : COVER_EXTENSIONS) {
            try {
                if (Files.deleteIfExists(coverDir.resolve(id + "." + ext))) {
                    removed++;
                }
            } catch (IOException e) {
                log.warn("Failed to delete cover {}.{}: {}", id, ext, e.getMessage());
            }
        }
        return removed;
    }

    static boolean isSafeId(String id) {
        return !id.contains("/") && !id.contains("\\") && !id.contains("..");
    }
}
