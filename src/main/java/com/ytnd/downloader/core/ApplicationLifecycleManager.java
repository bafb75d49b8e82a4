package com.ytnd.downloader.core;

import com.ytnd.downloader.config.DownloaderConfig;
import com.ytnd.downloader.extract.YtDlpExtractor;
import com.ytnd.downloader.service.DatabaseService;
import com.ytnd.downloader.service.DiskSpaceProbe;
import com.ytnd.downloader.service.DownloadRunner;
import com.ytnd.downloader.service.FfmpegImageTranscoder;
import com.ytnd.downloader.service.MetadataResolver;
import com.ytnd.downloader.service.QueueService;
import com.ytnd.downloader.service.SongLibraryService;
import com.ytnd.downloader.service.TagWriterService;
import com.ytnd.downloader.service.YtDlpFailureClassifier;
import com.ytnd.downloader.store.JdbcQueueStore;
import com.ytnd.downloader.store.JsonSongCacheStore;
import com.ytnd.downloader.tag.FfmpegTagApplier;
import com.ytnd.downloader.tag.JaudiotaggerTagApplier;
import com.ytnd.downloader.util.FfmpegLocator;
import com.ytnd.downloader.util.Messages;
import com.ytnd.downloader.util.ProcessRunner;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Builds every service from the configuration and closes them again.
 */
@Slf4j
@Getter
public class ApplicationLifecycleManager {

    private final DownloaderConfig config;

    private DatabaseService databaseService;
    private ProcessRunner processRunner;
    private String ffmpegPath;
    private YtDlpExtractor extractor;
    private JsonSongCacheStore songCacheStore;
    private QueueService queueService;
    private TagWriterService tagWriter;
    private MetadataResolver metadataResolver;
    private DownloadRunner downloadRunner;
    private SongLibraryService songLibraryService;

    public ApplicationLifecycleManager(DownloaderConfig config) {
        this.config = config;
    }

    /**
     * Creates every service in dependency order.
     */
    public void initializeServices() throws IOException {
        Messages.init(config.getLanguage());
        log.info(Messages.get("app.init.services"));

        Files.createDirectories(config.getOutputRootPath());
        Files.createDirectories(config.getCoversRootPath());

        log.info(Messages.get("app.init.database", config.getDbType()));
        databaseService = new DatabaseService(config);
        JdbcQueueStore queueStore = new JdbcQueueStore(databaseService);
        queueService = new QueueService(queueStore);
        songCacheStore = new JsonSongCacheStore(config.getOutputRootPath());

        processRunner = new ProcessRunner();
        ffmpegPath = FfmpegLocator.find(config.getFfmpegPath());
        log.info(Messages.get("app.ffmpeg.path", ffmpegPath));
        extractor = new YtDlpExtractor(config.getYtDlpPath(), processRunner);

        tagWriter = new TagWriterService(
            new JaudiotaggerTagApplier(),
            new FfmpegTagApplier(ffmpegPath, processRunner, config.getTagTimeoutSeconds()));
        metadataResolver = new MetadataResolver(extractor, config);

        downloadRunner = new DownloadRunner(
            config,
            queueService,
            songCacheStore,
            extractor,
            new YtDlpFailureClassifier(),
            tagWriter,
            new FfmpegImageTranscoder(ffmpegPath, processRunner),
            DiskSpaceProbe.FILE_STORE,
            ffmpegPath
        );
        songLibraryService = new SongLibraryService(config, songCacheStore, queueService, metadataResolver);

        log.info(Messages.get("app.all.services.ready"));
    }

    /**
     * Logs yt-dlp, ffmpeg and cookie availability.
     *
     * @return true when yt-dlp can be executed
     */
    public boolean checkTools() {
        String ytDlpVersion = extractor.version();
        if (ytDlpVersion != null) {
            log.info(Messages.get("tools.ytdlp.ok", ytDlpVersion));
        } else {
            log.warn(Messages.get("tools.ytdlp.missing", config.getYtDlpPath()));
        }

        if (isFfmpegAvailable()) {
            log.info(Messages.get("tools.ffmpeg.ok", ffmpegPath));
        } else {
            log.warn(Messages.get("tools.ffmpeg.missing", ffmpegPath));
        }

        Path cookies = config.getCookiesFilePath();
        if (cookies != null && Files.isRegularFile(cookies)) {
            log.info(Messages.get("tools.cookies.present", cookies));
        } else {
            log.info(Messages.get("tools.cookies.absent"));
        }
        return ytDlpVersion != null;
    }

    private boolean isFfmpegAvailable() {
        try {
            return processRunner.run(Arrays.asList(ffmpegPath, "-version"), 15).isSuccess();
        } catch (IOException e) {
            log.debug("ffmpeg not executable: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Releases the database pool.
     */
    public void shutdown() {
        log.info(Messages.get("app.shutting.down"));
        try {
            if (databaseService != null) {
                databaseService.close();
            }
            log.info(Messages.get("app.shutdown.complete"));
        } catch (Exception e) {
            log.error(Messages.get("app.shutdown.error"), e);
        }
    }
}
