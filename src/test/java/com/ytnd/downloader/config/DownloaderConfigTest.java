package com.ytnd.downloader.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class DownloaderConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsMatchDocumentedValues() {
        DownloaderConfig config = DownloaderConfig.defaults(tempDir);
        assertEquals(4, config.getWorkers());
        assertEquals(100, config.getMinFreeSpaceMb());
        assertEquals(800, config.getRetryBackoffMillis());
        assertEquals(150, config.getPlaylistLimit());
        assertEquals(15, config.getCoverConvertTimeoutSeconds());
        assertEquals("opus", config.getAudioFormat());
        assertEquals("sqlite", config.getDbType());
        assertEquals(tempDir.resolve("downloads"), config.getOutputRootPath());
        assertTrue(config.isValid());
    }

    @Test
    void missingFileIsGeneratedWithDefaults() {
        Path file = tempDir.resolve("ytnd.properties");
        DownloaderConfig config = DownloaderConfig.load(file);
        assertTrue(Files.exists(file));
        assertEquals(4, config.getWorkers());
    }

    @Test
    void fileOverridesDefaults() throws IOException {
        Path file = tempDir.resolve("custom.properties");
        Files.write(file, ("data.root=" + tempDir.resolve("d").toString().replace("\\", "/") + "\n"
            + "download.workers=8\n"
            + "download.minFreeSpaceMb=500\n"
            + "cover.convertTimeoutSeconds=30\n"
            + "db.type=mysql\n").getBytes(StandardCharsets.UTF_8));

        DownloaderConfig config = DownloaderConfig.load(file);

        assertEquals(8, config.getWorkers());
        assertEquals(500, config.getMinFreeSpaceMb());
        assertEquals(30, config.getCoverConvertTimeoutSeconds());
        assertEquals("mysql", config.getDbType());
        assertEquals(Paths.get(tempDir.resolve("d").toString(), "covers"), config.getCoversRootPath());
    }

    @Test
    void invalidNumbersKeepDefaults() {
        DownloaderConfig config = DownloaderConfig.defaults(tempDir);
        Properties props = new Properties();
        props.setProperty("download.workers", "many");
        config.apply(props);
        assertEquals(4, config.getWorkers());
    }

    @Test
    void emptyCookiePathMeansNoCookies() {
        DownloaderConfig config = DownloaderConfig.defaults(tempDir);
        config.setCookiesFile("");
        assertNull(config.getCookiesFilePath());
    }
}
