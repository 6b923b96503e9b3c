package io.vidsort4j.utils;

import io.vidsort4j.core.Platform;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Maps a URL to its hosting platform by host name.
 */
public final class PlatformDetector {
    private PlatformDetector() {
    }

    public static Platform detect(String url) {
        String host = host(url);
        if (host == null) {
            return Platform.UNKNOWN;
        }
        if (matches(host, "twitter.com") || matches(host, "x.com")) {
            return Platform.TWITTER;
        }
        if (matches(host, "instagram.com")) {
            return Platform.INSTAGRAM;
        }
        if (matches(host, "facebook.com") || matches(host, "fb.watch")) {
            return Platform.FACEBOOK;
        }
        if (matches(host, "youtube.com") || matches(host, "youtu.be")) {
            return Platform.YOUTUBE;
        }
        return Platform.UNKNOWN;
    }

    /**
     * Whether {@code url} is an absolute http(s) URL with a host.
     */
    public static boolean isWebUrl(String url) {
        return host(url) != null;
    }

    private static String host(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                return null;
            }
            String host = uri.getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    // exact host or any subdomain (www., m., mobile.)
    private static boolean matches(String host, String domain) {
        return host.equals(domain) || host.endsWith("." + domain);
    }
}
