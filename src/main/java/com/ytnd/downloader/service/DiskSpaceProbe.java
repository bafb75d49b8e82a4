package com.ytnd.downloader.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reports usable bytes on the volume holding a directory.
 */
public interface DiskSpaceProbe {

    DiskSpaceProbe FILE_STORE = directory -> Files.getFileStore(directory).getUsableSpace();

    long usableBytes(Path directory) throws IOException;
}
