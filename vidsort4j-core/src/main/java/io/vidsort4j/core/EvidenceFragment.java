package io.vidsort4j.core;

import java.util.List;
import java.util.Objects;

/**
 * One immutable unit of extracted signal.
 *
 * @param kind       whether {@code text} is raw content or a label hint
 * @param text       raw content, or the category/tag label for hints
 * @param source     extractor family that produced it
 * @param confidence 0.0 - 1.0
 * @param frameRefs  sampled frame indices the fragment derives from; empty if not frame-derived
 * @param excerpt    short supporting snippet for hints; null for raw content
 */
public record EvidenceFragment(
        FragmentKind kind,
        String text,
        EvidenceSource source,
        double confidence,
        List<Integer> frameRefs,
        String excerpt
) {
    public EvidenceFragment {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(source, "source must not be null");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        frameRefs = frameRefs == null ? List.of() : List.copyOf(frameRefs);
    }

    public static EvidenceFragment text(String content, EvidenceSource source, List<Integer> frameRefs) {
        return new EvidenceFragment(FragmentKind.TEXT, content, source, 1.0, frameRefs, null);
    }

    public static EvidenceFragment categoryHint(String label, EvidenceSource source, double confidence,
                                                List<Integer> frameRefs, String excerpt) {
        return new EvidenceFragment(FragmentKind.CATEGORY, label, source, confidence, frameRefs, excerpt);
    }

    public static EvidenceFragment tagHint(String label, EvidenceSource source, double confidence,
                                           List<Integer> frameRefs, String excerpt) {
        return new EvidenceFragment(FragmentKind.TAG, label, source, confidence, frameRefs, excerpt);
    }

    public boolean isHint() {
        return kind != FragmentKind.TEXT;
    }
}
