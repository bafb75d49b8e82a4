package com.ytnd.downloader.store;

import com.ytnd.downloader.model.SongCacheRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonSongCacheStoreTest {

    @TempDir
    Path outputRoot;

    @Test
    void missingFileIsEmptyCache() {
        JsonSongCacheStore store = new JsonSongCacheStore(outputRoot);
        assertTrue(store.load("alice").isEmpty());
    }

    @Test
    void savedRecordsReloadUnchanged() {
        JsonSongCacheStore store = new JsonSongCacheStore(outputRoot);
        List<SongCacheRecord> records = Arrays.asList(
            new SongCacheRecord("id1", "Song", "Artist", "https://x/1", "2024-01-02", "id1.jpg"),
            new SongCacheRecord(null, "Other", "Someone", "https://x/2", null, null));

        store.save("alice", records);
        List<SongCacheRecord> loaded = store.load("alice");

        assertEquals(records, loaded);
        assertEquals("id1", loaded.get(0).getKey());
        assertEquals("Other|Someone", loaded.get(1).getKey());
        assertTrue(Files.exists(outputRoot.resolve("alice").resolve(JsonSongCacheStore.FILE_NAME)));
    }

    @Test
    void unknownFieldsAreIgnored() throws IOException {
        JsonSongCacheStore store = new JsonSongCacheStore(outputRoot);
        Path file = store.songListPath("alice");
        Files.createDirectories(file.getParent());
        Files.write(file, "[{\"id\":\"a\",\"title\":\"T\",\"artist\":\"A\",\"url\":\"u\",\"extra\":1}]"
            .getBytes(StandardCharsets.UTF_8));

        List<SongCacheRecord> loaded = store.load("alice");
        assertEquals(1, loaded.size());
        assertEquals("a", loaded.get(0).getId());
    }

    @Test
    void corruptFileRaisesCacheStoreException() throws IOException {
        JsonSongCacheStore store = new JsonSongCacheStore(outputRoot);
        Path file = store.songListPath("alice");
        Files.createDirectories(file.getParent());
        Files.write(file, "{not json".getBytes(StandardCharsets.UTF_8));

        assertThrows(CacheStoreException.class, () -> store.load("alice"));
    }

    @Test
    void writeFailureRaisesCacheStoreException() throws IOException {
        Files.write(outputRoot.resolve("bob"), new byte[]{1});
        JsonSongCacheStore store = new JsonSongCacheStore(outputRoot);
        assertThrows(CacheStoreException.class, () -> store.save("bob", Arrays.asList(
            new SongCacheRecord("x", "t", "a", "u", null, null))));
    }

    @Test
    void nullElementsAreSkipped() throws IOException {
        JsonSongCacheStore store = new JsonSongCacheStore(outputRoot);
        Path file = store.songListPath("alice");
        Files.createDirectories(file.getParent());
        Files.write(file, "[null, {\"id\":\"a\",\"title\":\"T\",\"artist\":\"A\"}, null]"
            .getBytes(StandardCharsets.UTF_8));

        List<SongCacheRecord> loaded = store.load("alice");
        assertEquals(1, loaded.size());
        assertEquals("a", loaded.get(0).getKey());
    }
}
