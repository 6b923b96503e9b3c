package io.vidsort4j.media;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads container metadata.
 */
public interface MediaProbe {

    MediaInfo probe(Path media) throws IOException;

    record MediaInfo(double durationSeconds, int width, int height, boolean hasAudio) {
    }
}
