package io.vidsort4j.core;

import java.time.Instant;
import java.util.Objects;

public record JobError(
        ErrorKind kind,
        String message,
        Instant at
) {
    public static final String CANCELLED_REASON = "cancelled";

    public JobError {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(at, "at must not be null");
    }

    public static JobError of(ErrorKind kind, String message, Instant at) {
        return new JobError(kind, message, at);
    }

    public static JobError leaseExhausted(int attempts, Instant at) {
        return new JobError(ErrorKind.INTERNAL, "lease expired, attempts exhausted (" + attempts + ")", at);
    }

    public static JobError cancelled(Instant at) {
        return new JobError(ErrorKind.CANCELLED, CANCELLED_REASON, at);
    }
}
