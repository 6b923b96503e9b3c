package io.vidsort4j.extract;

import io.vidsort4j.Transcriber;

import java.util.Objects;

/**
 * @param language         first-pass language hint, usually {@link Transcriber#AUTO_LANGUAGE}
 * @param fallbackLanguage explicit language for a second pass when the first is too short; null disables it
 * @param minCharacters    first-pass transcripts shorter than this trigger the fallback
 */
public record TranscriptSettings(String language, String fallbackLanguage, int minCharacters) {

    public static final TranscriptSettings DEFAULTS = new TranscriptSettings(Transcriber.AUTO_LANGUAGE, "ar", 40);

    public TranscriptSettings {
        Objects.requireNonNull(language, "language must not be null");
        if (minCharacters < 0) {
            throw new IllegalArgumentException("minCharacters must not be negative");
        }
    }
}
