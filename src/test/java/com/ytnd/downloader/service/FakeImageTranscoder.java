package com.ytnd.downloader.service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.atomic.AtomicInteger;

class FakeImageTranscoder implements ImageTranscoder {

    private final boolean succeed;
    final AtomicInteger invocations = new AtomicInteger();

    FakeImageTranscoder(boolean succeed) {
        this.succeed = succeed;
    }

    @Override
    public boolean toJpeg(Path source, Path target, long timeoutSeconds) {
        invocations.incrementAndGet();
        if (!succeed) {
            return false;
        }
        try {
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            return true;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
