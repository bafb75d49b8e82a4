package com.ytnd.downloader.service;

import com.ytnd.downloader.util.ProcessRunner;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Cover conversion via {@code ffmpeg -q:v 2}.
 */
@Slf4j
public class FfmpegImageTranscoder implements ImageTranscoder {

    private final String ffmpegPath;
    private final ProcessRunner processRunner;

    public FfmpegImageTranscoder(String ffmpegPath, ProcessRunner processRunner) {
        this.ffmpegPath = ffmpegPath;
        this.processRunner = processRunner;
    }

    @Override
    public boolean toJpeg(Path source, Path target, long timeoutSeconds) {
        try {
            ProcessRunner.ProcessOutput output = processRunner.run(Arrays.asList(
                ffmpegPath, "-y", "-i", source.toString(), "-v", "quiet", "-q:v", "2", target.toString()),
                timeoutSeconds);
            if (output.isTimedOut()) {
                log.warn("Cover conversion timed out after {}s: {}", timeoutSeconds, source.getFileName());
                return false;
            }
            return output.isSuccess() && Files.exists(target);
        } catch (IOException e) {
            log.warn("Cover conversion failed for {}: {}", source.getFileName(), e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
