package io.vidsort4j.utils;

import io.vidsort4j.core.Platform;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlatformDetectorTest {

    @Test
    void shouldDetectSupportedHostsAndSubdomains() {
        assertEquals(Platform.TWITTER, PlatformDetector.detect("https://x.com/someone/status/1"));
        assertEquals(Platform.TWITTER, PlatformDetector.detect("https://mobile.twitter.com/someone/status/1"));
        assertEquals(Platform.INSTAGRAM, PlatformDetector.detect("https://www.instagram.com/reel/abc/"));
        assertEquals(Platform.FACEBOOK, PlatformDetector.detect("https://fb.watch/xyz/"));
        assertEquals(Platform.YOUTUBE, PlatformDetector.detect("https://youtu.be/abc"));
        assertEquals(Platform.YOUTUBE, PlatformDetector.detect("HTTPS://M.YOUTUBE.COM/watch?v=abc"));
    }

    @Test
    void lookalikeHostsShouldBeUnknown() {
        assertEquals(Platform.UNKNOWN, PlatformDetector.detect("https://notx.com/a"));
        assertEquals(Platform.UNKNOWN, PlatformDetector.detect("https://example.org/video"));
        assertEquals(Platform.UNKNOWN, PlatformDetector.detect("x.com/someone"));
    }

    @Test
    void onlyHttpUrlsShouldBeWebUrls() {
        assertTrue(PlatformDetector.isWebUrl("http://example.org/a"));
        assertFalse(PlatformDetector.isWebUrl("file:///tmp/a.mp4"));
        assertFalse(PlatformDetector.isWebUrl("https://"));
        assertFalse(PlatformDetector.isWebUrl(null));
    }
}
