package io.vidsort4j.core;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A tag in a fused {@link Classification}.
 *
 * @param impliedBy the tag or category whose presence implied this one; null for directly evidenced tags
 */
public record ScoredTag(
        Tag label,
        double confidence,
        Set<EvidenceSource> sources,
        List<String> evidence,
        List<Integer> frameRefs,
        String impliedBy
) {
    public ScoredTag {
        Objects.requireNonNull(label, "label must not be null");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        sources = sources == null ? Set.of() : Set.copyOf(sources);
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        frameRefs = frameRefs == null ? List.of() : List.copyOf(frameRefs);
    }
}
