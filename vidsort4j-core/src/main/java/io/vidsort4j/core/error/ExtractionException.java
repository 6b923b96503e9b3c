package io.vidsort4j.core.error;

import io.vidsort4j.core.ErrorKind;

/**
 * An extractor (or the model capability behind it) could not produce evidence.
 *
 * <p>{@code transientFailure} separates a backend that is down or timed out from input that will never
 * yield evidence, such as a missing audio track.
 */
public class ExtractionException extends PipelineException {

    private final boolean transientFailure;

    public ExtractionException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public ExtractionException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public static ExtractionException permanent(String message) {
        return new ExtractionException(message, false);
    }

    public static ExtractionException transientFailure(String message, Throwable cause) {
        return new ExtractionException(message, true, cause);
    }

    public boolean isTransient() {
        return transientFailure;
    }

    @Override
    public ErrorKind errorKind() {
        return ErrorKind.EXTRACTION;
    }
}
