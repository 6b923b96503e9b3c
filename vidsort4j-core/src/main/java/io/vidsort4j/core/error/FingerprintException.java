package io.vidsort4j.core.error;

import io.vidsort4j.core.ErrorKind;

/**
 * Missing or corrupt frames; the fingerprinter never degrades to a partial hash.
 */
public class FingerprintException extends PipelineException {

    public FingerprintException(String message) {
        super(message);
    }

    public FingerprintException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind errorKind() {
        return ErrorKind.FINGERPRINT;
    }
}
