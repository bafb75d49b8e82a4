package com.ytnd.downloader.util;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * URL shape rules used before metadata resolution.
 */
public final class UrlUtils {

    public static final int MAX_URL_LENGTH = 2000;

    private static final Set<String> PLAYLIST_CONTEXT_PARAMS =
        new HashSet<>(Arrays.asList("list", "index", "start_radio"));

    private UrlUtils() {
    }

    /**
     * A URL counts as a playlist when it points at {@code /playlist}, or at {@code /watch}
     * with a {@code list} parameter and no {@code v}. Shorts and youtu.be links are single items.
     */
    public static boolean isPlaylistUrl(String url) {
        if (url == null || url.isEmpty() || url.length() > MAX_URL_LENGTH) {
            return false;
        }

        String[] parts = splitUrl(url);
        String host = parts[0].toLowerCase(Locale.ROOT);
        String path = parts[1];
        Set<String> params = nonBlankParameterNames(parts[2]);

        if (!host.contains("youtube.com") && !host.contains("youtu.be")) {
            return false;
        }
        if (path.startsWith("/playlist")) {
            return true;
        }
        if (host.endsWith("youtu.be") && !stripSlashes(path).isEmpty()) {
            return false;
        }
        if (path.startsWith("/shorts/")) {
            return false;
        }
        return path.startsWith("/watch") && params.contains("list") && !params.contains("v");
    }

    /**
     * Removes {@code list}, {@code index} and {@code start_radio} so a single video is not
     * resolved inside its playlist context. Other parameters keep their original encoding.
     */
    public static String stripPlaylistContext(String url) {
        if (url == null || url.isEmpty()) {
            return "";
        }
        if (url.length() > MAX_URL_LENGTH) {
            return url.substring(0, MAX_URL_LENGTH);
        }

        int queryStart = url.indexOf('?');
        if (queryStart < 0) {
            return url;
        }
        int fragmentStart = url.indexOf('#', queryStart);
        String query = fragmentStart < 0 ? url.substring(queryStart + 1) : url.substring(queryStart + 1, fragmentStart);
        String fragment = fragmentStart < 0 ? "" : url.substring(fragmentStart);

        List<String> kept = new ArrayList<>();
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            if (!PLAYLIST_CONTEXT_PARAMS.contains(parameterName(pair))) {
                kept.add(pair);
            }
        }

        String base = url.substring(0, queryStart);
        return kept.isEmpty() ? base + fragment : base + "?" + String.join("&", kept) + fragment;
    }

    /**
     * Splits {@code scheme://authority/path?query#fragment} into authority, path and query
     * without validating any character, so URLs that {@link java.net.URI} rejects still parse.
     * The authority is empty when the URL has no {@code //} after its scheme.
     */
    static String[] splitUrl(String url) {
        String rest = url;
        int fragmentStart = rest.indexOf('#');
        if (fragmentStart >= 0) {
            rest = rest.substring(0, fragmentStart);
        }
        String query = "";
        int queryStart = rest.indexOf('?');
        if (queryStart >= 0) {
            query = rest.substring(queryStart + 1);
            rest = rest.substring(0, queryStart);
        }

        int colon = rest.indexOf(':');
        if (colon > 0 && rest.indexOf('/') > colon) {
            rest = rest.substring(colon + 1);
        }
        String authority = "";
        if (rest.startsWith("//")) {
            int pathStart = rest.indexOf('/', 2);
            authority = pathStart < 0 ? rest.substring(2) : rest.substring(2, pathStart);
            rest = pathStart < 0 ? "" : rest.substring(pathStart);
        }
        return new String[]{authority, rest, query};
    }

    private static Set<String> nonBlankParameterNames(String rawQuery) {
        Set<String> names = new HashSet<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return names;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            if (eq <= 0 || eq == pair.length() - 1) {
                // blank values do not count as present
                continue;
            }
            names.add(parameterName(pair));
        }
        return names;
    }

    private static String parameterName(String pair) {
        int eq = pair.indexOf('=');
        String rawName = eq < 0 ? pair : pair.substring(0, eq);
        try {
            return URLDecoder.decode(rawName, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return rawName;
        }
    }

    private static String stripSlashes(String path) {
        int start = 0;
        int end = path.length();
        while (start < end && path.charAt(start) == '/') {
            start++;
        }
        while (end > start && path.charAt(end - 1) == '/') {
            end--;
        }
        return path.substring(start, end);
    }
}
