package com.ytnd.downloader.util;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves the ffmpeg executable from a configured hint.
 */
public final class FfmpegLocator {

    private static final String DEFAULT = "ffmpeg";

    private FfmpegLocator() {
    }

    /**
     * Hint file, then {@code ffmpeg} inside a hint directory, then the PATH, then plain {@code ffmpeg}.
     */
    public static String find(String pathHint) {
        if (pathHint != null && !pathHint.trim().isEmpty()) {
            Path hint = Paths.get(pathHint.trim());
            if (Files.isRegularFile(hint) && Files.isExecutable(hint)) {
                return hint.toString();
            }
            if (Files.isDirectory(hint)) {
                Path inDir = hint.resolve(DEFAULT);
                if (Files.isRegularFile(inDir) && Files.isExecutable(inDir)) {
                    return inDir.toString();
                }
            }
        }

        String pathEnv = System.getenv("PATH");
        if (pathEnv != null) {
            for (String dir : pathEnv.split(File.pathSeparator)) {
                if (dir.isEmpty()) {
                    continue;
                }
                Path candidate = Paths.get(dir, DEFAULT);
                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                    return candidate.toString();
                }
            }
        }

        return DEFAULT;
    }
}
