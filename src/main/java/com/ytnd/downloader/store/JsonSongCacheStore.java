package com.ytnd.downloader.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ytnd.downloader.model.SongCacheRecord;
import com.ytnd.downloader.util.UserIds;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps each user's song cache as a JSON array in {@code <output.root>/<user>/song-list.json}.
 */
@Slf4j
public class JsonSongCacheStore implements SongCacheStore {

    public static final String FILE_NAME = "song-list.json";

    private final Path outputRoot;
    private final ObjectMapper objectMapper;

    public JsonSongCacheStore(Path outputRoot) {
        this.outputRoot = outputRoot;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path songListPath(String userId) {
        return UserIds.resolveUnder(outputRoot, userId).resolve(FILE_NAME);
    }

    /**
     * Missing file means an empty cache. An unreadable file is reported, not replaced.
     */
    @Override
    public List<SongCacheRecord> load(String userId) {
        Path file = songListPath(userId);
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        try {
            List<SongCacheRecord> records = objectMapper.readValue(
                file.toFile(), new TypeReference<List<SongCacheRecord>>() { });
            List<SongCacheRecord> loaded = new ArrayList<>();
            if (records != null) {
                for (SongCacheRecord record : records) {
                    if (record != null) {
                        loaded.add(record);
                    }
                }
            }
            if (records != null && loaded.size() < records.size()) {
                log.warn("Skipped {} empty record(s) in {}", records.size() - loaded.size(), file);
            }
            return loaded;
        } catch (IOException e) {
            log.error("Failed to load song cache: {}", e.getMessage());
            throw new CacheStoreException("Cannot read song cache " + file, e);
        }
    }

    /**
     * Writes to a sibling temp file first and moves it over the old list.
     */
    @Override
    public void save(String userId, List<SongCacheRecord> records) {
        Path file = songListPath(userId);
        Path temp = file.resolveSibling(FILE_NAME + ".tmp");
        try {
            Files.createDirectories(file.getParent());
            objectMapper.writeValue(temp.toFile(), records);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.error("Failed to save song cache: {}", e.getMessage());
            throw new CacheStoreException("Cannot save song cache " + file, e);
        }
    }
}
