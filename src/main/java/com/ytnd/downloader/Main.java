package com.ytnd.downloader;

import com.ytnd.downloader.config.DownloaderConfig;
import com.ytnd.downloader.core.ApplicationLifecycleManager;
import com.ytnd.downloader.model.FailedEntry;
import com.ytnd.downloader.model.RunResult;
import com.ytnd.downloader.util.Messages;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command line entry point.
 * Queues the given URLs for the user and runs the download pipeline once.
 */
@Slf4j
@Command(
    name = "ytnd-downloader",
    mixinStandardHelpOptions = true,
    version = "ytnd-downloader 1.0.0",
    description = "Queue audio URLs for a user and download them once.")
public class Main implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FATAL = 2;

    @Spec
    private CommandSpec spec;

    @Option(
        names = {"-u", "--user"},
        defaultValue = "local",
        paramLabel = "USER",
        description = "User whose queue and library are used (default: ${DEFAULT-VALUE}).")
    private String user;

    @Option(
        names = {"-w", "--workers"},
        paramLabel = "N",
        description = "Worker threads per phase (default: download.workers).")
    private Integer workers;

    @Parameters(
        arity = "1..*",
        paramLabel = "URL|FILE.txt",
        description = "Media URLs, or .txt files holding one URL per line.")
    private List<String> inputs = new ArrayList<>();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        CommandLine commandLine = new CommandLine(new Main());
        commandLine.setParameterExceptionHandler(Main::handleParameterException);
        return commandLine.execute(args);
    }

    private static int handleParameterException(ParameterException e, String[] args) {
        CommandLine commandLine = e.getCommandLine();
        commandLine.getErr().println(e.getMessage());
        commandLine.usage(commandLine.getErr());
        return EXIT_USAGE;
    }

    @Override
    public Integer call() {
        if (workers != null && workers <= 0) {
            throw new ParameterException(spec.commandLine(), "Worker count must be positive: " + workers);
        }

        List<String> urls;
        try {
            urls = collectUrls(inputs);
        } catch (IOException e) {
            System.err.println("Cannot read URL file: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (urls.isEmpty()) {
            spec.commandLine().usage(spec.commandLine().getErr());
            return EXIT_USAGE;
        }

        ApplicationLifecycleManager lifecycleManager = null;
        try {
            DownloaderConfig config = DownloaderConfig.getInstance();
            if (!config.isValid()) {
                log.error(Messages.get("app.config.invalid"));
                return EXIT_FATAL;
            }

            lifecycleManager = new ApplicationLifecycleManager(config);
            lifecycleManager.initializeServices();
            if (!lifecycleManager.checkTools()) {
                log.warn(Messages.get("main.ytdlp.warning"));
            }

            lifecycleManager.getQueueService().add(user, urls);
            int workerCount = workers != null ? workers : config.getWorkers();
            RunResult result = lifecycleManager.getDownloadRunner().run(user, workerCount);
            printSummary(result);
            return EXIT_OK;
        } catch (Exception e) {
            log.error(Messages.get("main.error"), e);
            return EXIT_FATAL;
        } finally {
            if (lifecycleManager != null) {
                lifecycleManager.shutdown();
            }
        }
    }

    /**
     * Arguments ending in {@code .txt} are read line by line; everything else is a URL.
     */
    static List<String> collectUrls(List<String> inputs) throws IOException {
        List<String> urls = new ArrayList<>();
        for (String input : inputs) {
            if (input.toLowerCase(Locale.ROOT).endsWith(".txt")) {
                Path file = Paths.get(input);
                for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                    String url = line.trim();
                    if (!url.isEmpty()) {
                        urls.add(url);
                    }
                }
            } else if (!input.trim().isEmpty()) {
                urls.add(input.trim());
            }
        }
        return urls;
    }

    private static void printSummary(RunResult result) {
        System.out.println(Messages.get("main.summary.separator"));
        System.out.println(Messages.get("main.summary",
            result.getDownloaded(), result.getDuplicates(), result.getErrors()));
        for (FailedEntry failed : result.getFailed()) {
            System.out.println(Messages.get("main.summary.failed",
                failed.getTitle(), failed.getArtist(), failed.getUrl(), failed.getReason(), failed.getAttempts()));
        }
    }

    String getUser() {
        return user;
    }

    Integer getWorkers() {
        return workers;
    }

    List<String> getInputs() {
        return inputs;
    }
}
