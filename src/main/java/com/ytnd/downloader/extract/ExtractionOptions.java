package com.ytnd.downloader.extract;

import lombok.Data;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Option set for one extraction-tool invocation.
 */
@Data
public class ExtractionOptions {

    public enum Mode {
        /** Resolve metadata only, no media fetch. */
        METADATA,
        /** Download media and run the post-processor chain. */
        DOWNLOAD,
        /** Fetch only the thumbnail image. */
        THUMBNAIL
    }

    public static final String BEST_AUDIO = "bestaudio/best";
    public static final String ANDROID_CLIENT = "android";

    private Mode mode;
    private String format;
    private String outputTemplate;
    private List<PostProcessor> postProcessors = new ArrayList<>();
    private String audioFormat;
    private String audioQuality;
    private String ffmpegLocation;
    private Path cookieFile;
    private String playerClient;
    private boolean flatPlaylist;
    private int playlistEnd;
    private long timeoutSeconds;

    public static ExtractionOptions metadata(boolean playlist, int playlistLimit) {
        ExtractionOptions options = new ExtractionOptions();
        options.setMode(Mode.METADATA);
        options.setFlatPlaylist(playlist);
        options.setPlaylistEnd(playlist ? playlistLimit : 0);
        return options;
    }

    public static ExtractionOptions audioDownload(Path outputTemplate, String audioFormat, String audioQuality) {
        ExtractionOptions options = new ExtractionOptions();
        options.setMode(Mode.DOWNLOAD);
        options.setFormat(BEST_AUDIO);
        options.setOutputTemplate(outputTemplate.toString());
        options.setAudioFormat(audioFormat);
        options.setAudioQuality(audioQuality);
        options.setPostProcessors(new ArrayList<>(Arrays.asList(
            PostProcessor.EXTRACT_AUDIO, PostProcessor.ADD_METADATA, PostProcessor.EMBED_THUMBNAIL)));
        return options;
    }

    public static ExtractionOptions thumbnailOnly(Path outputTemplate) {
        ExtractionOptions options = new ExtractionOptions();
        options.setMode(Mode.THUMBNAIL);
        options.setOutputTemplate(outputTemplate.toString());
        return options;
    }

    /**
     * Applies the cookie file only when it exists on disk at call time.
     */
    public ExtractionOptions withCookies(Path cookies) {
        if (cookies != null && cookies.toFile().isFile()) {
            this.cookieFile = cookies;
        }
        return this;
    }

    public ExtractionOptions copy() {
        ExtractionOptions copy = new ExtractionOptions();
        copy.setMode(mode);
        copy.setFormat(format);
        copy.setOutputTemplate(outputTemplate);
        copy.setPostProcessors(new ArrayList<>(postProcessors));
        copy.setAudioFormat(audioFormat);
        copy.setAudioQuality(audioQuality);
        copy.setFfmpegLocation(ffmpegLocation);
        copy.setCookieFile(cookieFile);
        copy.setPlayerClient(playerClient);
        copy.setFlatPlaylist(flatPlaylist);
        copy.setPlaylistEnd(playlistEnd);
        copy.setTimeoutSeconds(timeoutSeconds);
        return copy;
    }
}
