package com.ytnd.downloader.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ytnd.downloader.util.ProcessRunner;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * {@link ExtractionTool} backed by the yt-dlp command line.
 */
@Slf4j
public class YtDlpExtractor implements ExtractionTool {

    private static final long METADATA_TIMEOUT_SECONDS = 300;
    private static final long VERSION_TIMEOUT_SECONDS = 15;

    private final String executable;
    private final ProcessRunner processRunner;
    private final ObjectMapper objectMapper;

    public YtDlpExtractor(String executable, ProcessRunner processRunner) {
        this.executable = executable == null || executable.isEmpty() ? "yt-dlp" : executable;
        this.processRunner = processRunner;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public ExtractionResult extract(String url, ExtractionOptions options) {
        List<String> command = buildCommand(url, options);
        long timeout = options.getTimeoutSeconds() > 0 ? options.getTimeoutSeconds() : METADATA_TIMEOUT_SECONDS;

        ProcessRunner.ProcessOutput output;
        try {
            output = processRunner.run(command, timeout);
        } catch (IOException e) {
            log.error("Failed to start yt-dlp: {}", e.getMessage());
            return ExtractionResult.failure("Failed to start yt-dlp: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExtractionResult.failure("Interrupted while running yt-dlp");
        }

        if (output.isTimedOut()) {
            return ExtractionResult.failure("yt-dlp timed out after " + timeout + "s",
                output.getStdout(), output.getStderr());
        }

        if (options.getMode() == ExtractionOptions.Mode.METADATA) {
            return parseMetadata(output);
        }

        if (!output.isSuccess()) {
            return ExtractionResult.failure(errorText(output), output.getStdout(), output.getStderr());
        }
        return ExtractionResult.downloaded(collectArtifacts(output.getStdout()));
    }

    @Override
    public String version() {
        try {
            ProcessRunner.ProcessOutput output =
                processRunner.run(Arrays.asList(executable, "--version"), VERSION_TIMEOUT_SECONDS);
            return output.isSuccess() ? output.getStdout().trim() : null;
        } catch (IOException e) {
            log.debug("yt-dlp not executable: {}", e.getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    List<String> buildCommand(String url, ExtractionOptions options) {
        List<String> command = new ArrayList<>();
        command.add(executable);

        switch (options.getMode()) {
            case METADATA:
                command.add("--dump-single-json");
                command.add("--ignore-errors");
                if (options.isFlatPlaylist()) {
                    command.add("--flat-playlist");
                }
                if (options.getPlaylistEnd() > 0) {
                    command.add("--playlist-end");
                    command.add(String.valueOf(options.getPlaylistEnd()));
                }
                break;
            case DOWNLOAD:
                command.add("--format");
                command.add(options.getFormat() != null ? options.getFormat() : ExtractionOptions.BEST_AUDIO);
                command.add("--output");
                command.add(options.getOutputTemplate());
                command.add("--no-progress");
                addPostProcessors(command, options);
                command.add("--print");
                command.add("after_move:filepath");
                break;
            case THUMBNAIL:
                command.add("--skip-download");
                command.add("--write-thumbnail");
                command.add("--output");
                command.add(options.getOutputTemplate());
                break;
            default:
                throw new IllegalArgumentException("Unsupported mode: " + options.getMode());
        }

        command.add("--quiet");
        command.add("--no-warnings");
        command.add("--force-ipv4");

        if (options.getCookieFile() != null) {
            command.add("--cookies");
            command.add(options.getCookieFile().toString());
        }
        if (options.getPlayerClient() != null && !options.getPlayerClient().isEmpty()) {
            command.add("--extractor-args");
            command.add("youtube:player_client=" + options.getPlayerClient());
        }

        command.add("--");
        command.add(url);
        return command;
    }

    private void addPostProcessors(List<String> command, ExtractionOptions options) {
        if (options.getFfmpegLocation() != null && !options.getFfmpegLocation().isEmpty()) {
            command.add("--ffmpeg-location");
            command.add(options.getFfmpegLocation());
        }
        for (PostProcessor postProcessor : options.getPostProcessors()) {
            switch (postProcessor) {
                case EXTRACT_AUDIO:
                    command.add("--extract-audio");
                    if (options.getAudioFormat() != null) {
                        command.add("--audio-format");
                        command.add(options.getAudioFormat());
                    }
                    if (options.getAudioQuality() != null) {
                        command.add("--audio-quality");
                        command.add(options.getAudioQuality());
                    }
                    break;
                case ADD_METADATA:
                    command.add("--embed-metadata");
                    break;
                case EMBED_THUMBNAIL:
                    command.add("--embed-thumbnail");
                    break;
                default:
                    break;
            }
        }
    }

    private ExtractionResult parseMetadata(ProcessRunner.ProcessOutput output) {
        // with --ignore-errors a playlist with some broken children still exits non-zero
        String stdout = output.getStdout().trim();
        if (!stdout.isEmpty()) {
            try {
                JsonNode info = objectMapper.readTree(stdout);
                if (info != null && info.isObject()) {
                    return ExtractionResult.metadata(info);
                }
            } catch (IOException e) {
                log.debug("Unparseable yt-dlp metadata output: {}", e.getMessage());
            }
        }
        if (output.isSuccess()) {
            return ExtractionResult.failure("No metadata", output.getStdout(), output.getStderr());
        }
        return ExtractionResult.failure(errorText(output), output.getStdout(), output.getStderr());
    }

    static String errorText(ProcessRunner.ProcessOutput output) {
        String stderr = output.getStderr() == null ? "" : output.getStderr().trim();
        StringBuilder errors = new StringBuilder();
        for (String line : stderr.split("\\R")) {
            if (line.startsWith("ERROR:")) {
                if (errors.length() > 0) {
                    errors.append('\n');
                }
                errors.append(line);
            }
        }
        if (errors.length() > 0) {
            return errors.toString();
        }
        if (!stderr.isEmpty()) {
            return stderr;
        }
        return "exit code " + output.getExitCode();
    }

    static List<Path> collectArtifacts(String stdout) {
        List<Path> artifacts = new ArrayList<>();
        for (String line : stdout.split("\\R")) {
            String candidate = line.trim();
            if (candidate.isEmpty()) {
                continue;
            }
            try {
                Path path = Paths.get(candidate);
                if (Files.isRegularFile(path)) {
                    artifacts.add(path);
                }
            } catch (RuntimeException e) {
                log.debug("Ignoring non-path output line: {}", candidate);
            }
        }
        return artifacts;
    }
}
