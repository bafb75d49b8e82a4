package com.ytnd.downloader.config;

import lombok.Data;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Defaults first, then {@code ytnd.properties} (or the file named by the {@code ytnd.config} system property).
 */
@Data
public class DownloaderConfig {

    public static final String CONFIG_PATH_PROPERTY = "ytnd.config";
    private static final String DEFAULT_CONFIG_FILE = "ytnd.properties";

    // directories
    private String dataRoot;
    private String outputRoot;
    private String coversRoot;
    private String cookiesFile;

    // external tools
    private String ytDlpPath;
    private String ffmpegPath;

    // download
    private int workers;
    private long minFreeSpaceMb;
    private long retryBackoffMillis;
    private int playlistLimit;
    private String audioFormat;
    private String audioQuality;
    private long downloadTimeoutSeconds;
    private long coverConvertTimeoutSeconds;
    private long tagTimeoutSeconds;

    // database
    private String dbType; // sqlite (default) or mysql
    private String dbSqlitePath;
    private String dbHost;
    private int dbPort;
    private String dbDatabase;
    private String dbUsername;
    private String dbPassword;
    private int dbMaxPoolSize;
    private int dbMinIdle;
    private long dbConnectionTimeout;

    // i18n
    private String language;

    private static DownloaderConfig instance;

    private DownloaderConfig(Path dataRoot) {
        applyDataRoot(dataRoot);
        this.ytDlpPath = "yt-dlp";
        this.ffmpegPath = "";

        this.workers = 4;
        this.minFreeSpaceMb = 100;
        this.retryBackoffMillis = 800;
        this.playlistLimit = 150;
        this.audioFormat = "opus";
        this.audioQuality = "0";
        this.downloadTimeoutSeconds = 1800;
        this.coverConvertTimeoutSeconds = 15;
        this.tagTimeoutSeconds = 60;

        this.dbType = "sqlite";
        this.dbHost = "localhost";
        this.dbPort = 3306;
        this.dbDatabase = "ytnd";
        this.dbUsername = "root";
        this.dbPassword = "";
        this.dbMaxPoolSize = 10;
        this.dbMinIdle = 1;
        this.dbConnectionTimeout = 30000;

        this.language = "en_US";
    }

    /**
     * Process-wide configuration, loaded on first use.
     */
    public static synchronized DownloaderConfig getInstance() {
        if (instance == null) {
            String configured = System.getProperty(CONFIG_PATH_PROPERTY, DEFAULT_CONFIG_FILE);
            instance = load(Paths.get(configured));
        }
        return instance;
    }

    /**
     * Built-in defaults with every data directory placed under {@code dataRoot}.
     */
    public static DownloaderConfig defaults(Path dataRoot) {
        return new DownloaderConfig(dataRoot);
    }

    /**
     * Loads {@code configPath} over the defaults. A missing file is generated with the defaults.
     */
    public static DownloaderConfig load(Path configPath) {
        DownloaderConfig config = new DownloaderConfig(Paths.get("data"));
        if (!Files.exists(configPath)) {
            System.out.println("Configuration file not found, generating default configuration: " + configPath);
            try {
                config.saveToFile(configPath);
            } catch (IOException e) {
                System.err.println("Failed to create default configuration: " + e.getMessage());
            }
            return config;
        }

        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(configPath);
             InputStreamReader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            System.err.println("Failed to read configuration, using defaults: " + e.getMessage());
            return config;
        }
        config.apply(props);
        return config;
    }

    /**
     * Overrides the current values with the keys present in {@code props}.
     */
    void apply(Properties props) {
        // data.root moves every derived directory unless those are set explicitly
        if (props.containsKey("data.root")) {
            applyDataRoot(Paths.get(props.getProperty("data.root").trim()));
        }
        if (props.containsKey("output.root")) {
            this.outputRoot = props.getProperty("output.root").trim();
        }
        if (props.containsKey("covers.root")) {
            this.coversRoot = props.getProperty("covers.root").trim();
        }
        if (props.containsKey("cookies.file")) {
            this.cookiesFile = props.getProperty("cookies.file").trim();
        }
        if (props.containsKey("tools.ytdlpPath")) {
            this.ytDlpPath = props.getProperty("tools.ytdlpPath").trim();
        }
        if (props.containsKey("tools.ffmpegPath")) {
            this.ffmpegPath = props.getProperty("tools.ffmpegPath").trim();
        }

        this.workers = intProperty(props, "download.workers", workers);
        this.minFreeSpaceMb = longProperty(props, "download.minFreeSpaceMb", minFreeSpaceMb);
        this.retryBackoffMillis = longProperty(props, "download.retryBackoffMillis", retryBackoffMillis);
        this.playlistLimit = intProperty(props, "download.playlistLimit", playlistLimit);
        if (props.containsKey("download.audioFormat")) {
            this.audioFormat = props.getProperty("download.audioFormat").trim();
        }
        if (props.containsKey("download.audioQuality")) {
            this.audioQuality = props.getProperty("download.audioQuality").trim();
        }
        this.downloadTimeoutSeconds = longProperty(props, "download.timeoutSeconds", downloadTimeoutSeconds);
        this.coverConvertTimeoutSeconds = longProperty(props, "cover.convertTimeoutSeconds", coverConvertTimeoutSeconds);
        this.tagTimeoutSeconds = longProperty(props, "tag.ffmpegTimeoutSeconds", tagTimeoutSeconds);

        if (props.containsKey("db.type")) {
            this.dbType = props.getProperty("db.type").trim();
        }
        if (props.containsKey("db.sqlite.path")) {
            this.dbSqlitePath = props.getProperty("db.sqlite.path").trim();
        }
        if (props.containsKey("db.mysql.host")) {
            this.dbHost = props.getProperty("db.mysql.host").trim();
        }
        this.dbPort = intProperty(props, "db.mysql.port", dbPort);
        if (props.containsKey("db.mysql.database")) {
            this.dbDatabase = props.getProperty("db.mysql.database").trim();
        }
        if (props.containsKey("db.mysql.username")) {
            this.dbUsername = props.getProperty("db.mysql.username").trim();
        }
        if (props.containsKey("db.mysql.password")) {
            this.dbPassword = props.getProperty("db.mysql.password");
        }
        this.dbMaxPoolSize = intProperty(props, "db.pool.maxPoolSize", dbMaxPoolSize);
        this.dbMinIdle = intProperty(props, "db.pool.minIdle", dbMinIdle);
        this.dbConnectionTimeout = longProperty(props, "db.pool.connectionTimeout", dbConnectionTimeout);

        if (props.containsKey("i18n.language")) {
            this.language = props.getProperty("i18n.language").trim();
        }
    }

    private void applyDataRoot(Path root) {
        this.dataRoot = root.toString();
        this.outputRoot = root.resolve("downloads").toString();
        this.coversRoot = root.resolve("covers").toString();
        this.cookiesFile = root.resolve("cookies.txt").toString();
        this.dbSqlitePath = root.resolve("ytnd.db").toString();
    }

    private static int intProperty(Properties props, String key, int fallback) {
        if (!props.containsKey(key)) {
            return fallback;
        }
        try {
            return Integer.parseInt(props.getProperty(key).trim());
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + key + " configuration: " + props.getProperty(key));
            return fallback;
        }
    }

    private static long longProperty(Properties props, String key, long fallback) {
        if (!props.containsKey(key)) {
            return fallback;
        }
        try {
            return Long.parseLong(props.getProperty(key).trim());
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + key + " configuration: " + props.getProperty(key));
            return fallback;
        }
    }

    private void saveToFile(Path configPath) throws IOException {
        Properties props = new Properties();
        props.setProperty("data.root", dataRoot);
        props.setProperty("output.root", outputRoot);
        props.setProperty("covers.root", coversRoot);
        props.setProperty("cookies.file", cookiesFile);
        props.setProperty("tools.ytdlpPath", ytDlpPath);
        props.setProperty("tools.ffmpegPath", ffmpegPath == null ? "" : ffmpegPath);
        props.setProperty("download.workers", String.valueOf(workers));
        props.setProperty("download.minFreeSpaceMb", String.valueOf(minFreeSpaceMb));
        props.setProperty("download.retryBackoffMillis", String.valueOf(retryBackoffMillis));
        props.setProperty("download.playlistLimit", String.valueOf(playlistLimit));
        props.setProperty("download.audioFormat", audioFormat);
        props.setProperty("download.audioQuality", audioQuality);
        props.setProperty("download.timeoutSeconds", String.valueOf(downloadTimeoutSeconds));
        props.setProperty("cover.convertTimeoutSeconds", String.valueOf(coverConvertTimeoutSeconds));
        props.setProperty("tag.ffmpegTimeoutSeconds", String.valueOf(tagTimeoutSeconds));
        props.setProperty("db.type", dbType);
        props.setProperty("db.sqlite.path", dbSqlitePath);
        props.setProperty("db.mysql.host", dbHost);
        props.setProperty("db.mysql.port", String.valueOf(dbPort));
        props.setProperty("db.mysql.database", dbDatabase);
        props.setProperty("db.mysql.username", dbUsername);
        props.setProperty("db.mysql.password", dbPassword == null ? "" : dbPassword);
        props.setProperty("db.pool.maxPoolSize", String.valueOf(dbMaxPoolSize));
        props.setProperty("db.pool.minIdle", String.valueOf(dbMinIdle));
        props.setProperty("db.pool.connectionTimeout", String.valueOf(dbConnectionTimeout));
        props.setProperty("i18n.language", language);

        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (FileOutputStream fos = new FileOutputStream(configPath.toFile())) {
            props.store(fos, "Auto-generated by ytnd-downloader");
        }
    }

    /**
     * Checks that directories are configured and the worker count is positive.
     */
    public boolean isValid() {
        if (outputRoot == null || outputRoot.isEmpty()) {
            System.err.println("Output root not configured");
            return false;
        }
        if (coversRoot == null || coversRoot.isEmpty()) {
            System.err.println("Covers root not configured");
            return false;
        }
        if (workers <= 0) {
            System.err.println("download.workers must be positive: " + workers);
            return false;
        }
        return true;
    }

    public Path getOutputRootPath() {
        return Paths.get(outputRoot);
    }

    public Path getCoversRootPath() {
        return Paths.get(coversRoot);
    }

    public Path getCookiesFilePath() {
        return cookiesFile == null || cookiesFile.isEmpty() ? null : Paths.get(cookiesFile);
    }
}
