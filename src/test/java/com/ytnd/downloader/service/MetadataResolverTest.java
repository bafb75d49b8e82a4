package com.ytnd.downloader.service;

import com.fasterxml.jackson.databind.node.NullNode;
import com.ytnd.downloader.config.DownloaderConfig;
import com.ytnd.downloader.extract.ExtractionOptions;
import com.ytnd.downloader.model.MetadataResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class MetadataResolverTest {

    private static final String VIDEO = "https://www.youtube.com/watch?v=v1";
    private static final String PLAYLIST = "https://www.youtube.com/playlist?list=PL1";

    @TempDir
    Path tempDir;

    @Test
    void videoUrlIsResolvedWithoutPlaylistContext() {
        FakeExtractionTool tool = new FakeExtractionTool()
            .withMetadata(VIDEO, FakeExtractionTool.video("v1", "T", "U"));
        MetadataResolver resolver = new MetadataResolver(tool, DownloaderConfig.defaults(tempDir));

        MetadataResult result = resolver.resolve(VIDEO + "&list=PL1&index=2");

        assertTrue(result.isSuccess());
        assertEquals(VIDEO + "&list=PL1&index=2", result.getSourceUrl());
        FakeExtractionTool.Call call = tool.calls().get(0);
        assertEquals(VIDEO, call.url);
        assertFalse(call.options.isFlatPlaylist());
    }

    @Test
    void playlistUrlUsesFlatBoundedListing() {
        FakeExtractionTool tool = new FakeExtractionTool()
            .withMetadata(PLAYLIST, FakeExtractionTool.playlist(FakeExtractionTool.video("a", "A", "U")));
        MetadataResolver resolver = new MetadataResolver(tool, DownloaderConfig.defaults(tempDir));

        assertTrue(resolver.resolve(PLAYLIST).isSuccess());

        ExtractionOptions options = tool.calls().get(0).options;
        assertTrue(options.isFlatPlaylist());
        assertEquals(150, options.getPlaylistEnd());
    }

    @Test
    void toolFailureBecomesMetadataFailure() {
        MetadataResolver resolver = new MetadataResolver(new FakeExtractionTool(), DownloaderConfig.defaults(tempDir));
        MetadataResult result = resolver.resolve(VIDEO);
        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("Video unavailable"));
    }

    @Test
    void resolveAllKeepsQueueOrder() throws InterruptedException {
        FakeExtractionTool tool = new FakeExtractionTool()
            .withMetadata("https://www.youtube.com/watch?v=a", FakeExtractionTool.video("a", "A", "U"))
            .withMetadata("https://www.youtube.com/watch?v=c", FakeExtractionTool.video("c", "C", "U"));
        MetadataResolver resolver = new MetadataResolver(tool, DownloaderConfig.defaults(tempDir));
        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            List<MetadataResult> results = resolver.resolveAll(Arrays.asList(
                "https://www.youtube.com/watch?v=a",
                "https://www.youtube.com/watch?v=b",
                "https://www.youtube.com/watch?v=c"), "alice", pool);

            assertEquals(3, results.size());
            assertTrue(results.get(0).isSuccess());
            assertFalse(results.get(1).isSuccess());
            assertEquals("https://www.youtube.com/watch?v=c", results.get(2).getSourceUrl());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void expandFlattensPlaylistsAndSkipsNullChildren() {
        MetadataResolver resolver = new MetadataResolver(new FakeExtractionTool(), DownloaderConfig.defaults(tempDir));
        MetadataResolver.Expansion expansion = resolver.expand(Arrays.asList(
            MetadataResult.success(PLAYLIST, FakeExtractionTool.playlist(
                FakeExtractionTool.video("a", "A", "U"), NullNode.getInstance(), FakeExtractionTool.video("b", "B", "U"))),
            MetadataResult.success(VIDEO, FakeExtractionTool.video("v1", "T", "U")),
            MetadataResult.failure("https://bad", "yt-dlp error: nope")));

        assertEquals(3, expansion.getEntries().size());
        assertEquals("a", expansion.getEntries().get(0).getId());
        assertEquals("v1", expansion.getEntries().get(2).getId());
        assertEquals(1, expansion.getFailures().size());
        assertEquals("https://bad", expansion.getFailures().get(0).getUrl());
        assertEquals(0, expansion.getFailures().get(0).getAttempts());
        assertEquals("—", expansion.getFailures().get(0).getTitle());
    }

    @Test
    void expandCapsPlaylistChildren() {
        DownloaderConfig config = DownloaderConfig.defaults(tempDir);
        config.setPlaylistLimit(2);
        MetadataResolver resolver = new MetadataResolver(new FakeExtractionTool(), config);
        MetadataResolver.Expansion expansion = resolver.expand(Collections.singletonList(
            MetadataResult.success(PLAYLIST, FakeExtractionTool.playlist(
                FakeExtractionTool.video("a", "A", "U"),
                FakeExtractionTool.video("b", "B", "U"),
                FakeExtractionTool.video("c", "C", "U")))));
        assertEquals(2, expansion.getEntries().size());
    }

    @Test
    void emptyPlaylistIsReportedAsFailure() {
        MetadataResolver resolver = new MetadataResolver(new FakeExtractionTool(), DownloaderConfig.defaults(tempDir));
        MetadataResolver.Expansion expansion = resolver.expand(Collections.singletonList(
            MetadataResult.success(PLAYLIST, FakeExtractionTool.playlist())));
        assertTrue(expansion.getEntries().isEmpty());
        assertEquals("Playlist has no entries", expansion.getFailures().get(0).getReason());
    }

    @Test
    void probeReportsReasons() {
        FakeExtractionTool tool = new FakeExtractionTool()
            .withMetadata(VIDEO, FakeExtractionTool.video("v1", "T", "U"))
            .withMetadata(PLAYLIST, FakeExtractionTool.playlist());
        MetadataResolver resolver = new MetadataResolver(tool, DownloaderConfig.defaults(tempDir));

        assertTrue(resolver.probe(VIDEO).isAvailable());
        assertEquals("Playlist has no entries", resolver.probe(PLAYLIST).getReason());
        assertFalse(resolver.probe("https://www.youtube.com/watch?v=gone").isAvailable());

        StringBuilder tooLong = new StringBuilder("https://x/");
        while (tooLong.length() <= 2000) {
            tooLong.append('a');
        }
        assertEquals("URL too long", resolver.probe(tooLong.toString()).getReason());
    }
}
