package com.ytnd.downloader.util;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs external tools (yt-dlp, ffmpeg) with a hard timeout.
 * stdout and stderr go to temp files so a chatty process can never block on a full pipe.
 */
@Slf4j
public class ProcessRunner {

    public ProcessOutput run(List<String> command, long timeoutSeconds) throws IOException, InterruptedException {
        return run(command, timeoutSeconds, null);
    }

    public ProcessOutput run(List<String> command, long timeoutSeconds, File workingDirectory)
        throws IOException, InterruptedException {
        Path stdoutFile = Files.createTempFile("ytnd-proc-", ".out");
        Path stderrFile = Files.createTempFile("ytnd-proc-", ".err");
        try {
            ProcessBuilder processBuilder = new ProcessBuilder(new ArrayList<>(command));
            if (workingDirectory != null) {
                processBuilder.directory(workingDirectory);
            }
            processBuilder.redirectOutput(stdoutFile.toFile());
            processBuilder.redirectError(stderrFile.toFile());

            log.debug("Running: {}", String.join(" ", command));
            Process process = processBuilder.start();

            boolean finished;
            try {
                finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                throw e;
            }

            if (!finished) {
                process.destroyForcibly();
                process.waitFor(3, TimeUnit.SECONDS);
                log.warn("Process timed out after {}s: {}", timeoutSeconds, command.get(0));
                return new ProcessOutput(-1, read(stdoutFile), read(stderrFile), true);
            }

            return new ProcessOutput(process.exitValue(), read(stdoutFile), read(stderrFile), false);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    private String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Failed to delete temp file: {} - {}", file, e.getMessage());
        }
    }

    @Getter
    public static class ProcessOutput {
        private final int exitCode;
        private final String stdout;
        private final String stderr;
        private final boolean timedOut;

        public ProcessOutput(int exitCode, String stdout, String stderr, boolean timedOut) {
            this.exitCode = exitCode;
            this.stdout = stdout;
            this.stderr = stderr;
            this.timedOut = timedOut;
        }

        public boolean isSuccess() {
            return !timedOut && exitCode == 0;
        }
    }
}
