package io.vidsort4j.core;

/**
 * Failure kinds recorded on {@link Job#lastError()}.
 */
public enum ErrorKind {
    AUTH_REQUIRED(false),
    RATE_LIMITED(true),
    NOT_FOUND(false),
    REMOVED(false),
    PLATFORM_UNKNOWN(true),
    UNSUPPORTED_PLATFORM(false),
    FINGERPRINT(true),
    EXTRACTION(true),
    INTERNAL(true),
    CANCELLED(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Whether a single occurrence may be retried. FINGERPRINT is retryable once only; see
     * {@code RetryScheduler}.
     */
    public boolean retryable() {
        return retryable;
    }
}
