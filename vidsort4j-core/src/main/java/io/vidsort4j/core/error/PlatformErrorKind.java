package io.vidsort4j.core.error;

import io.vidsort4j.core.ErrorKind;

public enum PlatformErrorKind {
    AUTH_REQUIRED(ErrorKind.AUTH_REQUIRED),
    RATE_LIMITED(ErrorKind.RATE_LIMITED),
    NOT_FOUND(ErrorKind.NOT_FOUND),
    REMOVED(ErrorKind.REMOVED),
    UNKNOWN(ErrorKind.PLATFORM_UNKNOWN),
    UNSUPPORTED(ErrorKind.UNSUPPORTED_PLATFORM);

    private final ErrorKind errorKind;

    PlatformErrorKind(ErrorKind errorKind) {
        this.errorKind = errorKind;
    }

    public ErrorKind errorKind() {
        return errorKind;
    }
}
