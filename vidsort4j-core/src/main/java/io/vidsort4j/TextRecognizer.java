package io.vidsort4j;

import io.vidsort4j.core.error.ExtractionException;

import java.nio.file.Path;
import java.util.List;

/**
 * On-screen text recognition capability.
 */
public interface TextRecognizer {

    /**
     * @param framePaths    still frames
     * @param languageOrder recognition languages, primary first (e.g. ["ara", "eng"])
     */
    String recognize(List<Path> framePaths, List<String> languageOrder) throws ExtractionException;
}
