package io.vidsort4j.store;

/**
 * Near-duplicate thresholds.
 *
 * @param maxHammingDistance inclusive upper bound on differing hash bits
 * @param durationTolerance  exclusive upper bound on duration difference, in seconds
 */
public record DedupSettings(int maxHammingDistance, double durationTolerance) {

    public static final DedupSettings DEFAULTS = new DedupSettings(10, 1.0);

    public DedupSettings {
        if (maxHammingDistance < 0 || maxHammingDistance >= 64) {
            throw new IllegalArgumentException("maxHammingDistance must be within [0, 63]");
        }
        if (Double.isNaN(durationTolerance) || durationTolerance <= 0) {
            throw new IllegalArgumentException("durationTolerance must be positive");
        }
    }
}
