package io.vidsort4j.fusion;

import io.vidsort4j.core.EvidenceSource;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Tunables for {@link EvidenceFusion}.
 *
 * @param sourceWeights       multiplier applied to each source's best fragment before the noisy-OR union
 * @param tagThreshold        directly evidenced tags below this are discarded
 * @param implicationDiscount factor applied per implication hop
 * @param reviewThreshold     overall confidence below this requires review
 * @param coverageFloor       share of category strength kept when only part of the expected sources contributed
 */
public record FusionSettings(
        Map<EvidenceSource, Double> sourceWeights,
        double tagThreshold,
        double implicationDiscount,
        double reviewThreshold,
        double coverageFloor
) {
    public static final FusionSettings DEFAULTS = new FusionSettings(
            Map.of(EvidenceSource.AUDIO, 1.0, EvidenceSource.OCR, 1.0, EvidenceSource.VISION, 0.85),
            0.3, 0.6, 0.5, 0.7);

    public FusionSettings {
        Objects.requireNonNull(sourceWeights, "sourceWeights must not be null");
        Map<EvidenceSource, Double> weights = new EnumMap<>(EvidenceSource.class);
        for (EvidenceSource s : EvidenceSource.values()) {
            double w = sourceWeights.getOrDefault(s, 1.0);
            if (Double.isNaN(w) || w < 0.0) {
                throw new IllegalArgumentException("weight for " + s + " must be non-negative");
            }
            weights.put(s, w);
        }
        sourceWeights = Map.copyOf(weights);
        requireUnit("tagThreshold", tagThreshold);
        requireUnit("implicationDiscount", implicationDiscount);
        requireUnit("reviewThreshold", reviewThreshold);
        requireUnit("coverageFloor", coverageFloor);
    }

    public double weight(EvidenceSource source) {
        return sourceWeights.getOrDefault(source, 1.0);
    }

    private static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be within [0, 1]: " + value);
        }
    }
}
