package io.vidsort4j.core;

import java.util.Objects;

/**
 * A downloaded media file plus the coarse metadata used for deduplication.
 *
 * @param path            local file path
 * @param durationSeconds duration in seconds
 * @param width           frame width in pixels (0 when unknown)
 * @param height          frame height in pixels (0 when unknown)
 * @param hasAudio        whether the container carries an audio stream
 * @param perceptualHash  64-bit perceptual hash as 16 hex chars; null until fingerprinted
 */
public record MediaAsset(
        String path,
        double durationSeconds,
        int width,
        int height,
        boolean hasAudio,
        String perceptualHash
) {
    public MediaAsset {
        Objects.requireNonNull(path, "path must not be null");
        if (durationSeconds < 0 || Double.isNaN(durationSeconds)) {
            throw new IllegalArgumentException("durationSeconds must be a non-negative number");
        }
    }

    public MediaAsset withPerceptualHash(String hash) {
        return new MediaAsset(path, durationSeconds, width, height, hasAudio, hash);
    }

    public boolean isFingerprinted() {
        return perceptualHash != null && !perceptualHash.isBlank();
    }

    public String resolution() {
        return width + "x" + height;
    }
}
