package com.ytnd.downloader.service;

import com.ytnd.downloader.model.MediaEntry;
import com.ytnd.downloader.tag.AudioContainer;
import com.ytnd.downloader.tag.TagApplier;
import com.ytnd.downloader.tag.TagWriteException;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Picks the applier for the file's container. Never throws: a tagging failure must not fail
 * the download it belongs to.
 */
@Slf4j
public class TagWriterService {

    private final TagApplier jaudiotaggerApplier;
    private final TagApplier ffmpegApplier;

    public TagWriterService(TagApplier jaudiotaggerApplier, TagApplier ffmpegApplier) {
        this.jaudiotaggerApplier = jaudiotaggerApplier;
        this.ffmpegApplier = ffmpegApplier;
    }

    /**
     * @return true when tags were written
     */
    public boolean writeTags(Path file, MediaEntry entry) {
        Optional<AudioContainer> container = AudioContainer.fromFileName(file.getFileName().toString());
        if (!container.isPresent()) {
            log.warn("Unknown format, not tagging: {}", file.getFileName());
            return false;
        }
        if (!Files.isRegularFile(file)) {
            log.warn("File to tag does not exist: {}", file);
            return false;
        }

        TagApplier applier = container.get().getBackend() == AudioContainer.Backend.FFMPEG
            ? ffmpegApplier : jaudiotaggerApplier;
        try {
            applier.apply(file, container.get(), entry);
            log.debug("Tagged {}", file.getFileName());
            return true;
        } catch (TagWriteException e) {
            log.warn("Tagging error for {}: {}", file.getFileName(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.warn("Tagging error for {}", file.getFileName(), e);
            return false;
        }
    }
}
