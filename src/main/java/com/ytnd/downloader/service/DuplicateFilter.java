package com.ytnd.downloader.service;

import com.ytnd.downloader.model.MediaEntry;
import com.ytnd.downloader.util.FileNameUtils;
import com.ytnd.downloader.util.Messages;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Drops entries that were already downloaded. Runs on a single thread between the two
 * parallel phases.
 */
@Slf4j
public class DuplicateFilter {

    /**
     * An entry is a duplicate when its id or {@code title|uploader} key is cached, or when a
     * file in {@code outputDir} already carries its sanitized base name.
     */
    public List<MediaEntry> filter(List<MediaEntry> entries, Set<String> cacheKeys, Path outputDir) {
        List<String> existingNames = listFileNames(outputDir);
        List<MediaEntry> kept = new ArrayList<>();
        for (MediaEntry entry : entries) {
            if (isDuplicate(entry, cacheKeys, existingNames)) {
                log.info(Messages.get("dedup.skip", entry.getTitle()));
                continue;
            }
            kept.add(entry);
        }
        return kept;
    }

    boolean isDuplicate(MediaEntry entry, Set<String> cacheKeys, List<String> existingNames) {
        if (entry.getId() != null && !entry.getId().isEmpty() && cacheKeys.contains(entry.getId())) {
            return true;
        }
        if (cacheKeys.contains(entry.titleArtistKey())) {
            return true;
        }
        String baseName = FileNameUtils.trackBaseName(entry.getTitle(), entry.getUploader());
        for (String name : existingNames) {
            if (name.contains(baseName)) {
                return true;
            }
        }
        return false;
    }

    private List<String> listFileNames(Path outputDir) {
        List<String> names = new ArrayList<>();
        if (outputDir == null || !Files.isDirectory(outputDir)) {
            return names;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(outputDir)) {
            for (Path path : stream) {
                names.add(path.getFileName().toString());
            }
        } catch (IOException e) {
            log.warn("Failed to list {}: {}", outputDir, e.getMessage());
        }
        return names;
    }
}
