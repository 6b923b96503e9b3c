package io.vidsort4j;

import io.vidsort4j.core.FetchedMedia;
import io.vidsort4j.core.Platform;
import io.vidsort4j.core.error.PlatformException;

import java.nio.file.Path;
import java.util.Set;

/**
 * Fetches media and metadata for a URL on one or more platforms.
 */
public interface PlatformGateway {

    Set<Platform> platforms();

    /**
     * Download the media behind {@code url} into {@code targetDir}.
     *
     * @throws PlatformException on auth walls, throttling, removal, missing posts or unknown failures
     */
    FetchedMedia fetch(String url, Path targetDir) throws PlatformException;
}
