package com.ytnd.downloader.util;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.helpers.MessageFormatter;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * Loads {@code /messages_<language>.properties} and formats SLF4J-style {@code {}} placeholders.
 */
@Slf4j
public final class Messages {

    private static final String DEFAULT_LANGUAGE = "en_US";

    private static volatile Properties messages;
    private static volatile String currentLanguage = DEFAULT_LANGUAGE;

    private Messages() {
    }

    public static synchronized void init(String language) {
        if (language == null || language.trim().isEmpty()) {
            language = DEFAULT_LANGUAGE;
        }

        String resourceFile = "/messages_" + language + ".properties";
        InputStream is = Messages.class.getResourceAsStream(resourceFile);
        if (is == null) {
            log.warn("Message bundle not found: {}", resourceFile);
            if (!DEFAULT_LANGUAGE.equals(language)) {
                init(DEFAULT_LANGUAGE);
            } else {
                messages = new Properties();
            }
            return;
        }

        Properties loaded = new Properties();
        try (InputStreamReader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
            loaded.load(reader);
        } catch (IOException e) {
            log.error("Failed to load message bundle: {}", resourceFile, e);
        }
        messages = loaded;
        currentLanguage = language;
    }

    /**
     * Message for {@code key}, or the key itself when the bundle has no such entry.
     */
    public static String get(String key, Object... args) {
        if (messages == null) {
            init(currentLanguage);
        }
        String pattern = messages.getProperty(key, key);
        if (args == null || args.length == 0) {
            return pattern;
        }
        return MessageFormatter.arrayFormat(pattern, args).getMessage();
    }

    public static String getCurrentLanguage() {
        return currentLanguage;
    }
}
