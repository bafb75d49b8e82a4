package com.ytnd.downloader.util;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class ProcessRunnerTest {

    private final ProcessRunner runner = new ProcessRunner();

    @Test
    void capturesExitCodeAndOutput() throws Exception {
        String java = Paths.get(System.getProperty("java.home"), "bin", "java").toString();

        ProcessRunner.ProcessOutput output = runner.run(Arrays.asList(java, "-version"), 60);

        assertTrue(output.isSuccess());
        assertFalse(output.isTimedOut());
        assertTrue(output.getStderr().toLowerCase(Locale.ROOT).contains("version"));
    }

    @Test
    void missingExecutableRaisesIOException() {
        assertThrows(IOException.class,
            () -> runner.run(Collections.singletonList("/definitely/not/here/yt-dlp"), 5));
    }
}
