package io.vidsort4j;

import io.vidsort4j.core.error.ExtractionException;

import java.nio.file.Path;
import java.util.List;

/**
 * Optional natural-language frame description capability.
 */
public interface VisionDescriber {

    String describe(List<Path> framePaths) throws ExtractionException;
}
