package io.vidsort4j.media;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Demuxes the audio track into a 16 kHz mono PCM WAV file, the input format of the transcriber.
 */
public interface AudioTrackExtractor {

    void extractAudio(Path media, Path targetWav) throws IOException;
}
