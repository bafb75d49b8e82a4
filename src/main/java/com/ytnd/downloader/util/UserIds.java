package com.ytnd.downloader.util;

import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * User ids double as directory names, so they are validated before any path is built from them.
 */
public final class UserIds {

    private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private UserIds() {
    }

    public static String sanitize(String userId) {
        if (userId == null) {
            throw new IllegalArgumentException("Invalid user ID: null");
        }
        String trimmed = userId.trim();
        if (!ALLOWED.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Invalid user ID: " + userId);
        }
        return trimmed;
    }

    /**
     * Resolves {@code root/userId} and verifies the result still lives below {@code root}.
     */
    public static Path resolveUnder(Path root, String userId) {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path userDir = normalizedRoot.resolve(sanitize(userId)).normalize();
        if (!userDir.startsWith(normalizedRoot) || userDir.equals(normalizedRoot)) {
            throw new IllegalArgumentException("User directory escapes its root: " + userDir);
        }
        return userDir;
    }
}
