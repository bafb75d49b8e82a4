package com.ytnd.downloader.tag;

import com.ytnd.downloader.util.FileNameUtils;

import java.util.Optional;

/**
 * Audio containers the tag writer understands, keyed by file extension.
 */
public enum AudioContainer {

    MP3("mp3", Backend.JAUDIOTAGGER),
    M4A("m4a", Backend.JAUDIOTAGGER),
    FLAC("flac", Backend.JAUDIOTAGGER),
    OGG("ogg", Backend.JAUDIOTAGGER),
    // jaudiotagger cannot write Ogg Opus, so these are remuxed through ffmpeg
    OPUS("opus", Backend.FFMPEG);

    public enum Backend {
        JAUDIOTAGGER,
        FFMPEG
    }

    private final String extension;
    private final Backend backend;

    AudioContainer(String extension, Backend backend) {
        this.extension = extension;
        this.backend = backend;
    }

    public String getExtension() {
        return extension;
    }

    public Backend getBackend() {
        return backend;
    }

    public static Optional<AudioContainer> fromFileName(String fileName) {
        String ext = FileNameUtils.extension(fileName);
        for (AudioContainer container : values()) {
            if (container.extension.equals(ext)) {
                return Optional.of(container);
            }
        }
        return Optional.empty();
    }
}
