package com.ytnd.downloader;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path tempDir;

    @Test
    void noUrlsIsUsageError() {
        assertEquals(Main.EXIT_USAGE, Main.run(new String[0]));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[]{"-u", "bob"}));
    }

    @Test
    void badWorkerCountIsUsageError() {
        assertEquals(Main.EXIT_USAGE, Main.run(new String[]{"-w", "zero", "https://a"}));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[]{"-w"}));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[]{"-w", "0", "https://a"}));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[]{"--unknown", "https://a"}));
    }

    @Test
    void parsesOptionsAndInputs() {
        Main main = new Main();
        new CommandLine(main).parseArgs("-u", "bob", "https://a", "--workers", "2", "list.txt");

        assertEquals("bob", main.getUser());
        assertEquals(Integer.valueOf(2), main.getWorkers());
        assertEquals(Arrays.asList("https://a", "list.txt"), main.getInputs());
    }

    @Test
    void defaultUserIsLocal() {
        Main main = new Main();
        new CommandLine(main).parseArgs("https://a");

        assertEquals("local", main.getUser());
        assertNull(main.getWorkers());
    }

    @Test
    void helpExitsCleanly() {
        assertEquals(Main.EXIT_OK, Main.run(new String[]{"--help"}));
    }

    @Test
    void textFilesAreReadLineByLine() throws IOException {
        Path list = Files.write(tempDir.resolve("urls.txt"),
            "https://a\n\n  https://b  \n".getBytes(StandardCharsets.UTF_8));

        List<String> urls = Main.collectUrls(Arrays.asList("https://c", list.toString()));

        assertEquals(Arrays.asList("https://c", "https://a", "https://b"), urls);
    }

    @Test
    void missingTextFileFails() {
        assertThrows(IOException.class,
            () -> Main.collectUrls(Collections.singletonList(tempDir.resolve("none.txt").toString())));
    }
}
