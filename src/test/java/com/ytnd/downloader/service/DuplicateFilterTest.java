package com.ytnd.downloader.service;

import com.ytnd.downloader.model.MediaEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DuplicateFilterTest {

    @TempDir
    Path outputDir;

    private final DuplicateFilter filter = new DuplicateFilter();

    private static MediaEntry entry(String id, String title, String uploader) {
        MediaEntry entry = new MediaEntry();
        entry.setId(id);
        entry.setTitle(title);
        entry.setUploader(uploader);
        return entry;
    }

    @Test
    void dropsEntriesWhoseIdIsCached() {
        List<MediaEntry> kept = filter.filter(
            Arrays.asList(entry("a", "A", "X"), entry("b", "B", "X")),
            new HashSet<>(Collections.singletonList("a")), outputDir);
        assertEquals(1, kept.size());
        assertEquals("b", kept.get(0).getId());
    }

    @Test
    void dropsEntriesWhoseTitleAndUploaderAreCached() {
        List<MediaEntry> kept = filter.filter(
            Collections.singletonList(entry("new-id", "Song", "Artist")),
            new HashSet<>(Collections.singletonList("Song|Artist")), outputDir);
        assertTrue(kept.isEmpty());
    }

    @Test
    void dropsEntriesAlreadyOnDisk() throws IOException {
        Files.write(outputDir.resolve("Song： Live # Artist.opus"), new byte[]{1});
        List<MediaEntry> kept = filter.filter(
            Collections.singletonList(entry("x", "Song: Live", "Artist")), new HashSet<>(), outputDir);
        assertTrue(kept.isEmpty());
    }

    @Test
    void sameUncachedIdTwiceBothPass() {
        List<MediaEntry> kept = filter.filter(
            Arrays.asList(entry("dup", "A", "X"), entry("dup", "A", "X")), new HashSet<>(), outputDir);
        assertEquals(2, kept.size());
    }

    @Test
    void missingOutputDirectoryIsTreatedAsEmpty() {
        List<MediaEntry> kept = filter.filter(
            Collections.singletonList(entry("a", "A", "X")), new HashSet<>(), outputDir.resolve("missing"));
        assertEquals(1, kept.size());
    }
}
