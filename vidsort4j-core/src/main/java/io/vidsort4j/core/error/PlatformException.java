package io.vidsort4j.core.error;

import io.vidsort4j.core.ErrorKind;

import java.util.Objects;

/**
 * Raised by a {@code PlatformGateway} on suspension, auth walls, removal, throttling or unknown failures.
 */
public class PlatformException extends PipelineException {

    private final PlatformErrorKind kind;

    public PlatformException(PlatformErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public PlatformException(PlatformErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public PlatformErrorKind kind() {
        return kind;
    }

    @Override
    public ErrorKind errorKind() {
        return kind.errorKind();
    }
}
