package com.ytnd.downloader.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

import java.util.Locale;

/**
 * A single resolved media item (one video), possibly expanded from a playlist.
 * Lives only for the duration of a run.
 */
@Data
public class MediaEntry {

    public static final String UNKNOWN_TITLE = "Unknown Title";
    public static final String UNKNOWN_ARTIST = "Unknown Artist";
    private static final String NIGHTCORE = "Nightcore";

    private String id;
    private String title;
    private String uploader;
    private String canonicalUrl;
    private String album;
    private String uploadDate; // yyyy-MM-dd
    private String description;

    /**
     * Builds an entry from yt-dlp info JSON (a single video or one playlist child).
     */
    public static MediaEntry fromInfo(JsonNode data) {
        MediaEntry entry = new MediaEntry();
        entry.setId(firstText(data, "id", "display_id"));
        entry.setTitle(textOr(data, "title", UNKNOWN_TITLE));
        entry.setUploader(textOr(data, "uploader", UNKNOWN_ARTIST));
        entry.setCanonicalUrl(firstText(data, "webpage_url", "url"));
        entry.setAlbum(inferAlbum(entry.getTitle()));
        entry.setUploadDate(formatUploadDate(textOr(data, "upload_date", null)));
        String description = textOr(data, "description", "");
        entry.setDescription(description == null ? "" : description.trim());
        return entry;
    }

    /**
     * Cache key: the media id when known, otherwise {@code title|uploader}.
     */
    public String dedupKey() {
        return id != null && !id.isEmpty() ? id : titleArtistKey();
    }

    public String titleArtistKey() {
        return title + "|" + uploader;
    }

    static String inferAlbum(String title) {
        if (title != null && title.toLowerCase(Locale.ROOT).contains("nightcore")) {
            return NIGHTCORE;
        }
        return null;
    }

    static String formatUploadDate(String raw) {
        if (raw == null || raw.length() != 8) {
            return null;
        }
        return raw.substring(0, 4) + "-" + raw.substring(4, 6) + "-" + raw.substring(6);
    }

    private static String firstText(JsonNode data, String... fields) {
        for (String field : fields) {
            String value = textOr(data, field, null);
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return null;
    }

    private static String textOr(JsonNode data, String field, String fallback) {
        JsonNode node = data.get(field);
        if (node == null || node.isNull() || node.asText().isEmpty()) {
            return fallback;
        }
        return node.asText();
    }
}
