package io.vidsort4j.core;

public enum Platform {
    TWITTER,
    INSTAGRAM,
    FACEBOOK,
    YOUTUBE,
    UNKNOWN
}
