package io.vidsort4j.internal.llm;

import java.time.Duration;
import java.util.Objects;

/**
 * @param url           Ollama {@code /api/generate} endpoint
 * @param model         model name passed through to Ollama
 * @param timeout       read timeout for one classification call
 * @param maxCharacters longest text sent per call; longer input is cut
 */
public record LlmLabelerSettings(String url, String model, Duration timeout, int maxCharacters) {

    public static final LlmLabelerSettings DEFAULTS = new LlmLabelerSettings(
            "http://localhost:11434/api/generate", "deepseek-v3.1:671b-cloud", Duration.ofSeconds(120), 12_000);

    public LlmLabelerSettings {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model must not be blank");
        }
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be a positive duration");
        }
        if (maxCharacters <= 0) {
            throw new IllegalArgumentException("maxCharacters must be a positive number");
        }
    }
}
