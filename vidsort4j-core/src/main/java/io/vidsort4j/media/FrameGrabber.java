package io.vidsort4j.media;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Extracts a single still frame from a media file.
 */
public interface FrameGrabber {

    /**
     * Write the frame at {@code offsetSeconds} to {@code target} as a PNG image.
     *
     * @throws IOException when the tool fails or produces no frame
     */
    void grab(Path media, double offsetSeconds, Path target) throws IOException;
}
