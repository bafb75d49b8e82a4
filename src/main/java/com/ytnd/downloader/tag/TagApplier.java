package com.ytnd.downloader.tag;

import com.ytnd.downloader.model.MediaEntry;

import java.nio.file.Path;

/**
 * Writes an entry's metadata into one audio file of the given container kind.
 */
public interface TagApplier {

    void apply(Path file, AudioContainer container, MediaEntry entry) throws TagWriteException;
}
