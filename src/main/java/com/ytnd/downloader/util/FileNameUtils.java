package com.ytnd.downloader.util;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Produces file names that are safe on every filesystem the downloads may be synced to.
 */
public final class FileNameUtils {

    private static final int MAX_LENGTH = 200;
    private static final Pattern ILLEGAL = Pattern.compile("[/\\\\:*?\"<>|]");
    private static final Map<String, String> REPLACEMENTS = new LinkedHashMap<>();

    static {
        REPLACEMENTS.put("/", "／");
        REPLACEMENTS.put("\\", "＼");
        REPLACEMENTS.put(":", "：");
        REPLACEMENTS.put("*", "＊");
        REPLACEMENTS.put("?", "？");
        REPLACEMENTS.put("\"", "＂");
        REPLACEMENTS.put("<", "＜");
        REPLACEMENTS.put(">", "＞");
        REPLACEMENTS.put("|", "｜");
    }

    private FileNameUtils() {
    }

    /**
     * Replaces characters that are illegal in file names
     * Illegal characters are swapped for their full-width look-alikes instead of being dropped,
     * so "AC/DC" stays readable. Result is capped at 200 code points, trimmed, without trailing dots.
     */
    public static String sanitize(String name) {
        if (name == null || name.isEmpty()) {
            return "unnamed";
        }

        if (name.codePointCount(0, name.length()) > MAX_LENGTH) {
            name = name.substring(0, name.offsetByCodePoints(0, MAX_LENGTH));
        }

        for (Map.Entry<String, String> replacement : REPLACEMENTS.entrySet()) {
            name = name.replace(replacement.getKey(), replacement.getValue());
        }
        name = ILLEGAL.matcher(name).replaceAll("").trim();

        int end = name.length();
        while (end > 0 && name.charAt(end - 1) == '.') {
            end--;
        }
        return name.substring(0, end);
    }

    /**
     * Base name of an audio file as it is stored in the output directory: {@code title # artist}.
     */
    public static String trackBaseName(String title, String artist) {
        return sanitize(title + " # " + artist);
    }

    /**
     * Lower-cased extension without the dot, or an empty string.
     */
    public static String extension(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dotIndex = fileName.lastIndexOf('.');
        if (dotIndex < 0 || dotIndex == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dotIndex + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Truncates diagnostic text for logs and failure reasons.
     */
    public static String shorten(String text, int maxLength) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.length() <= maxLength) {
            return trimmed;
        }
        return trimmed.substring(0, maxLength) + " …";
    }
}
