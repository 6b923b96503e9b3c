package io.vidsort4j.core.error;

import io.vidsort4j.core.ErrorKind;

/**
 * Base of the checked failures raised by external capabilities. Each maps onto an {@link ErrorKind}
 * so the orchestrator can route it through the retry policy.
 */
public abstract class PipelineException extends Exception {

    protected PipelineException(String message) {
        super(message);
    }

    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind errorKind();
}
