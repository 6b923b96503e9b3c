package io.vidsort4j;

import io.vidsort4j.core.error.ExtractionException;

import java.nio.file.Path;

/**
 * Speech-to-text capability.
 */
public interface Transcriber {

    String AUTO_LANGUAGE = "auto";

    /**
     * @param audioPath    16 kHz mono WAV
     * @param languageHint language code, or {@link #AUTO_LANGUAGE} to let the model detect it
     * @return transcript text; empty when nothing was recognised
     */
    String transcribe(Path audioPath, String languageHint) throws ExtractionException;
}
