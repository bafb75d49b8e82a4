package com.ytnd.downloader.service;

import com.ytnd.downloader.config.DownloaderConfig;
import com.ytnd.downloader.model.SongCacheRecord;
import com.ytnd.downloader.store.SongCacheStore;
import com.ytnd.downloader.util.FileNameUtils;
import com.ytnd.downloader.util.UserIds;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Maintenance of a user's downloaded songs: listing, locating files, deletion and re-download.
 */
@Slf4j
public class SongLibraryService {

    public static final List<String> AUDIO_EXTENSIONS = Arrays.asList("opus", "mp3", "m4a", "flac", "ogg");

    private final DownloaderConfig config;
    private final SongCacheStore cacheStore;
    private final QueueService queueService;
    private final MetadataResolver metadataResolver;

    public SongLibraryService(DownloaderConfig config, SongCacheStore cacheStore, QueueService queueService,
                              MetadataResolver metadataResolver) {
        this.config = config;
        this.cacheStore = cacheStore;
        this.queueService = queueService;
        this.metadataResolver = metadataResolver;
    }

    public List<SongCacheRecord> listSongs(String userId) {
        return cacheStore.load(UserIds.sanitize(userId));
    }

    /**
     * Exact {@code sanitize(title # artist).<ext>} for a known audio extension, otherwise the
     * first file whose name contains that base name. Null when nothing matches.
     */
    public Path findAudioFile(String userId, String title, String artist) {
        Path outputDir = outputDir(userId);
        String baseName = FileNameUtils.trackBaseName(title, artist);
        for (String ext : AUDIO_EXTENSIONS) {
            Path candidate = outputDir.resolve(baseName + "." + ext);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        if (!Files.isDirectory(outputDir)) {
            return null;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(outputDir)) {
            for (Path path : stream) {
                String name = path.getFileName().toString();
                if (Files.isRegularFile(path) && name.contains(baseName)) {
                    return path;
                }
            }
        } catch (IOException e) {
            log.warn("Failed to scan {}: {}", outputDir, e.getMessage());
        }
        return null;
    }

    /**
     * The record's stored cover, otherwise {@code <id>.<ext>} for a known image extension.
     */
    public Path findCoverFile(String userId, SongCacheRecord record) {
        Path coverDir = coverDir(userId);
        String stored = record.getCover();
        if (stored != null && !stored.isEmpty() && CoverArtService.isSafeId(stored)) {
            Path candidate = coverDir.resolve(stored);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        String id = record.getId();
        if (id == null || id.isEmpty() || !CoverArtService.isSafeId(id)) {
            return null;
        }
        for (String ext : CoverArtService.COVER_EXTENSIONS) {
            Path candidate = coverDir.resolve(id + "." + ext);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Deletes the records matching {@code id} (or {@code title}+{@code artist} when no id is
     * given) with their audio and cover files. Without a matching record, a title+artist
     * request still removes the audio file found on disk.
     */
    public DeletionReport deleteSong(String userId, String id, String title, String artist) {
        String uid = UserIds.sanitize(userId);
        boolean byId = id != null && !id.isEmpty();
        if (!byId && (title == null || artist == null)) {
            throw new IllegalArgumentException("Either id or title and artist are required");
        }

        List<SongCacheRecord> records = new ArrayList<>(cacheStore.load(uid));
        List<SongCacheRecord> matched = new ArrayList<>();
        List<SongCacheRecord> kept = new ArrayList<>();
        for (SongCacheRecord record : records) {
            boolean match = byId
                ? id.equals(record.getId())
                : Objects.equals(title, record.getTitle()) && Objects.equals(artist, record.getArtist());
            if (match) {
                matched.add(record);
            } else {
                kept.add(record);
            }
        }

        DeletionReport report = new DeletionReport(matched.size());
        for (SongCacheRecord record : matched) {
            deleteAudio(uid, record.getTitle(), record.getArtist(), report);
            deleteCovers(uid, record, report);
        }
        if (matched.isEmpty() && !byId) {
            deleteAudio(uid, title, artist, report);
        }
        if (!matched.isEmpty()) {
            cacheStore.save(uid, kept);
        }
        log.info("Deleted {} record(s), {} audio file(s), {} cover(s) for {}",
            report.getRemovedRecords(), report.getDeletedAudio().size(), report.getDeletedCovers().size(), uid);
        return report;
    }

    /**
     * Removes a song and queues its source URL again. The URL comes from the stored record
     * unless given. Unless {@code force}, the source is probed first and nothing is deleted
     * when it is unavailable.
     */
    public RedownloadReport redownload(String userId, String url, String id, String title, String artist,
                                       boolean force) {
        String uid = UserIds.sanitize(userId);
        SongCacheRecord record = findRecord(uid, id, title, artist);
        String sourceUrl = url != null && !url.trim().isEmpty() ? url.trim() : null;
        if (sourceUrl == null) {
            if (record == null) {
                throw new SongNotFoundException("No song matches id=" + id + " title=" + title + " artist=" + artist);
            }
            sourceUrl = record.getUrl();
        }
        if (sourceUrl == null || sourceUrl.isEmpty()) {
            throw new SongNotFoundException("Song has no source URL");
        }

        if (!force) {
            MetadataResolver.ProbeResult probe = metadataResolver.probe(sourceUrl);
            if (!probe.isAvailable()) {
                throw new SourceUnavailableException(probe.getReason());
            }
        }

        DeletionReport deletion;
        if (record != null) {
            boolean hasId = record.getId() != null && !record.getId().isEmpty();
            deletion = deleteSong(uid, hasId ? record.getId() : null, record.getTitle(), record.getArtist());
        } else if (title != null && artist != null) {
            deletion = deleteSong(uid, null, title, artist);
        } else {
            deletion = new DeletionReport(0);
        }

        int added = queueService.add(uid, Collections.singletonList(sourceUrl));
        return new RedownloadReport(sourceUrl, added > 0, deletion);
    }

    private SongCacheRecord findRecord(String uid, String id, String title, String artist) {
        for (SongCacheRecord record : cacheStore.load(uid)) {
            if (id != null && !id.isEmpty()) {
                if (id.equals(record.getId())) {
                    return record;
                }
            } else if (title != null && artist != null
                && title.equals(record.getTitle()) && artist.equals(record.getArtist())) {
                return record;
            }
        }
        return null;
    }

    private void deleteAudio(String uid, String title, String artist, DeletionReport report) {
        Path audio = findAudioFile(uid, title, artist);
        if (audio == null) {
            return;
        }
        try {
            if (Files.deleteIfExists(audio)) {
                report.getDeletedAudio().add(audio.getFileName().toString());
            }
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", audio, e.getMessage());
        }
    }

    private void deleteCovers(String uid, SongCacheRecord record, DeletionReport report) {
        Path cover;
        while ((cover = findCoverFile(uid, record)) != null) {
            try {
                Files.delete(cover);
                report.getDeletedCovers().add(cover.getFileName().toString());
            } catch (IOException e) {
                log.warn("Failed to delete cover {}: {}", cover, e.getMessage());
                return;
            }
        }
    }

    private Path outputDir(String userId) {
        return UserIds.resolveUnder(config.getOutputRootPath(), UserIds.sanitize(userId));
    }

    private Path coverDir(String userId) {
        return UserIds.resolveUnder(config.getCoversRootPath(), UserIds.sanitize(userId));
    }

    @Getter
    public static class DeletionReport {
        private final int removedRecords;
        private final List<String> deletedAudio = new ArrayList<>();
        private final List<String> deletedCovers = new ArrayList<>();

        public DeletionReport(int removedRecords) {
            this.removedRecords = removedRecords;
        }
    }

    @Getter
    public static class RedownloadReport {
        private final String url;
        private final boolean queued;
        private final DeletionReport deletion;

        public RedownloadReport(String url, boolean queued, DeletionReport deletion) {
            this.url = url;
            this.queued = queued;
            this.deletion = deletion;
        }
    }
}
