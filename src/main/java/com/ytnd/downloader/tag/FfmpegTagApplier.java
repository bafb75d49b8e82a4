package com.ytnd.downloader.tag;

import com.ytnd.downloader.model.MediaEntry;
import com.ytnd.downloader.util.ProcessRunner;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Rewrites Vorbis comments of an Opus file with an ffmpeg stream copy into a sibling temp
 * file, then moves it over the original. {@code DESCRIPTION} holds the source URL and
 * {@code COMMENT} the media description.
 */
@Slf4j
public class FfmpegTagApplier implements TagApplier {

    private final String ffmpegPath;
    private final ProcessRunner processRunner;
    private final long timeoutSeconds;

    public FfmpegTagApplier(String ffmpegPath, ProcessRunner processRunner, long timeoutSeconds) {
        this.ffmpegPath = ffmpegPath;
        this.processRunner = processRunner;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public void apply(Path file, AudioContainer container, MediaEntry entry) throws TagWriteException {
        Path temp = file.resolveSibling(".tagging-" + file.getFileName());
        try {
            ProcessRunner.ProcessOutput output = processRunner.run(buildCommand(file, temp, entry), timeoutSeconds);
            if (!output.isSuccess() || !Files.exists(temp)) {
                String detail = output.isTimedOut() ? "timed out" : "exit code " + output.getExitCode();
                throw new TagWriteException("ffmpeg tagging failed for " + file.getFileName() + ": " + detail);
            }
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new TagWriteException("ffmpeg tagging failed for " + file.getFileName() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TagWriteException("Interrupted while tagging " + file.getFileName(), e);
        } finally {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                log.debug("Failed to remove temp file {}: {}", temp, e.getMessage());
            }
        }
    }

    List<String> buildCommand(Path source, Path target, MediaEntry entry) {
        List<String> command = new ArrayList<>(Arrays.asList(
            ffmpegPath, "-y", "-v", "error", "-i", source.toString(),
            "-map", "0", "-c", "copy", "-map_metadata", "0"));
        addMetadata(command, "title", entry.getTitle());
        addMetadata(command, "artist", entry.getUploader());
        addMetadata(command, "album", entry.getAlbum());
        addMetadata(command, "date", entry.getUploadDate());
        addMetadata(command, "description", entry.getCanonicalUrl());
        addMetadata(command, "comment", entry.getDescription());
        command.add("-f");
        command.add("opus");
        command.add(target.toString());
        return command;
    }

    private void addMetadata(List<String> command, String key, String value) {
        if (value != null && !value.isEmpty()) {
            command.add("-metadata");
            command.add(key + "=" + value);
        }
    }
}
