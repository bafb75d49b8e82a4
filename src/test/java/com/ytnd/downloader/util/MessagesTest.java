package com.ytnd.downloader.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MessagesTest {

    @Test
    void formatsPlaceholders() {
        Messages.init("en_US");
        assertEquals("Progress: 2/5", Messages.get("run.progress", 2, 5));
    }

    @Test
    void unknownKeyFallsBackToKey() {
        Messages.init("en_US");
        assertEquals("no.such.key", Messages.get("no.such.key"));
    }

    @Test
    void unknownLanguageFallsBackToEnglish() {
        Messages.init("xx_XX");
        assertEquals("en_US", Messages.getCurrentLanguage());
        assertEquals("Progress: 1/1", Messages.get("run.progress", 1, 1));
    }
}
