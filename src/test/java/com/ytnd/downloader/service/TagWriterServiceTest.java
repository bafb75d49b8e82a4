package com.ytnd.downloader.service;

import com.ytnd.downloader.model.MediaEntry;
import com.ytnd.downloader.tag.AudioContainer;
import com.ytnd.downloader.tag.JaudiotaggerTagApplier;
import com.ytnd.downloader.tag.TagApplier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TagWriterServiceTest {

    @TempDir
    Path dir;

    private final List<AudioContainer> jaudiotaggerCalls = new ArrayList<>();
    private final List<AudioContainer> ffmpegCalls = new ArrayList<>();

    private TagWriterService recordingService() {
        TagApplier jaudiotagger = (file, container, entry) -> jaudiotaggerCalls.add(container);
        TagApplier ffmpeg = (file, container, entry) -> ffmpegCalls.add(container);
        return new TagWriterService(jaudiotagger, ffmpeg);
    }

    private static MediaEntry entry() {
        MediaEntry entry = new MediaEntry();
        entry.setId("v1");
        entry.setTitle("Song");
        entry.setUploader("Artist");
        entry.setCanonicalUrl("https://www.youtube.com/watch?v=v1");
        entry.setDescription("desc");
        return entry;
    }

    @Test
    void dispatchesByExtension() throws IOException {
        TagWriterService service = recordingService();
        for (String name : new String[]{"a.mp3", "b.M4A", "c.flac", "d.ogg", "e.opus"}) {
            Path file = Files.write(dir.resolve(name), new byte[]{1});
            assertTrue(service.writeTags(file, entry()), name);
        }
        assertEquals(4, jaudiotaggerCalls.size());
        assertEquals(1, ffmpegCalls.size());
        assertEquals(AudioContainer.OPUS, ffmpegCalls.get(0));
        assertEquals(AudioContainer.M4A, jaudiotaggerCalls.get(1));
    }

    @Test
    void unknownExtensionIsSkipped() throws IOException {
        Path file = Files.write(dir.resolve("cover.webp"), new byte[]{1});
        assertFalse(recordingService().writeTags(file, entry()));
        assertTrue(jaudiotaggerCalls.isEmpty());
        assertTrue(ffmpegCalls.isEmpty());
    }

    @Test
    void missingFileIsSkipped() {
        assertFalse(recordingService().writeTags(dir.resolve("gone.mp3"), entry()));
        assertTrue(jaudiotaggerCalls.isEmpty());
    }

    @Test
    void corruptAudioDoesNotThrow() throws IOException {
        Path file = Files.write(dir.resolve("broken.mp3"), "not really audio".getBytes(StandardCharsets.UTF_8));
        TagWriterService service = new TagWriterService(new JaudiotaggerTagApplier(),
            (f, container, e) -> fail("ffmpeg applier must not be used for mp3"));

        assertFalse(service.writeTags(file, entry()));
    }
}
