package com.ytnd.downloader.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UrlUtilsTest {

    @Test
    void recognizesPlaylistUrls() {
        assertTrue(UrlUtils.isPlaylistUrl("https://www.youtube.com/playlist?list=PL123"));
        assertTrue(UrlUtils.isPlaylistUrl("https://www.youtube.com/watch?list=PL123"));
    }

    @Test
    void videoInsidePlaylistIsNotAPlaylist() {
        assertFalse(UrlUtils.isPlaylistUrl("https://www.youtube.com/watch?v=abc&list=PL123"));
        assertFalse(UrlUtils.isPlaylistUrl("https://youtu.be/abc?list=PL123"));
        assertFalse(UrlUtils.isPlaylistUrl("https://www.youtube.com/shorts/abc"));
        assertFalse(UrlUtils.isPlaylistUrl("https://example.com/playlist?list=PL123"));
    }

    @Test
    void blankListParameterDoesNotCount() {
        assertFalse(UrlUtils.isPlaylistUrl("https://www.youtube.com/watch?list="));
    }

    @Test
    void stripsPlaylistContextAndKeepsOtherParameters() {
        assertEquals("https://www.youtube.com/watch?v=abc&t=10",
            UrlUtils.stripPlaylistContext("https://www.youtube.com/watch?v=abc&list=PL1&index=3&t=10&start_radio=1"));
    }

    @Test
    void stripKeepsFragmentAndDropsEmptyQuery() {
        assertEquals("https://youtu.be/abc#frag", UrlUtils.stripPlaylistContext("https://youtu.be/abc?list=PL1#frag"));
        assertEquals("https://youtu.be/abc", UrlUtils.stripPlaylistContext("https://youtu.be/abc"));
    }

    @Test
    void overlongUrlsAreRejected() {
        StringBuilder url = new StringBuilder("https://www.youtube.com/playlist?list=");
        while (url.length() <= UrlUtils.MAX_URL_LENGTH) {
            url.append('x');
        }
        assertFalse(UrlUtils.isPlaylistUrl(url.toString()));
        assertEquals(UrlUtils.MAX_URL_LENGTH, UrlUtils.stripPlaylistContext(url.toString()).length());
    }

    @Test
    void characterOutsideUriGrammarDoesNotHidePlaylist() {
        String url = "https://www.youtube.com/playlist?list=PL1&feature=a|b";
        assertTrue(UrlUtils.isPlaylistUrl(url));
        assertTrue(UrlUtils.isPlaylistUrl("https://www.youtube.com/watch?list=PL1&q=a b^{c}%zz"));
        assertFalse(UrlUtils.isPlaylistUrl("https://www.youtube.com/watch?v=x|y&list=PL1"));
    }

    @Test
    void splitsAuthorityPathAndQueryWithoutValidation() {
        assertArrayEquals(new String[]{"www.youtube.com", "/playlist", "list=PL1&f=a|b"},
            UrlUtils.splitUrl("https://www.youtube.com/playlist?list=PL1&f=a|b#top"));
        assertArrayEquals(new String[]{"youtu.be", "", ""}, UrlUtils.splitUrl("https://youtu.be"));
        assertArrayEquals(new String[]{"", "www.youtube.com/playlist", "list=PL1"},
            UrlUtils.splitUrl("www.youtube.com/playlist?list=PL1"));
    }
}
