package com.ytnd.downloader.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persistent "already downloaded" record, one element of {@code song-list.json}.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"id", "title", "artist", "url", "date", "cover"})
public class SongCacheRecord {
    private String id;
    private String title;
    private String artist;
    private String url;
    private String date;
    private String cover;

    public SongCacheRecord(String id, String title, String artist, String url, String date, String cover) {
        this.id = id;
        this.title = title;
        this.artist = artist;
        this.url = url;
        this.date = date;
        this.cover = cover;
    }

    public static SongCacheRecord of(MediaEntry entry, String coverFileName) {
        return new SongCacheRecord(
            entry.getId(),
            entry.getTitle(),
            entry.getUploader(),
            entry.getCanonicalUrl(),
            entry.getUploadDate(),
            coverFileName
        );
    }

    /**
     * {@code id} when present, else {@code title|artist}.
     */
    @JsonIgnore
    public String getKey() {
        return id != null && !id.isEmpty() ? id : title + "|" + artist;
    }
}
