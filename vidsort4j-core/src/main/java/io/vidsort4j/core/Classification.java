package io.vidsort4j.core;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Fused output for a job.
 *
 * @param category          exactly one category
 * @param categoryScores    aggregate evidence per candidate category
 * @param tags              scored tags, highest confidence first, no duplicate labels
 * @param overallConfidence 0.0 - 1.0
 * @param requiresReview    whether a human should look at it
 * @param reviewReason      why review is needed; null when not
 * @param droppedTags       tags removed by conflict resolution
 */
public record Classification(
        Category category,
        Map<Category, Double> categoryScores,
        List<ScoredTag> tags,
        double overallConfidence,
        boolean requiresReview,
        String reviewReason,
        List<String> droppedTags
) {
    public Classification {
        Objects.requireNonNull(category, "category must not be null");
        if (Double.isNaN(overallConfidence) || overallConfidence < 0.0 || overallConfidence > 1.0) {
            throw new IllegalArgumentException("overallConfidence must be within [0, 1]: " + overallConfidence);
        }
        categoryScores = categoryScores == null ? Map.of() : Map.copyOf(categoryScores);
        tags = tags == null ? List.of() : List.copyOf(tags);
        droppedTags = droppedTags == null ? List.of() : List.copyOf(droppedTags);

        Set<Tag> seen = new HashSet<>();
        for (ScoredTag t : tags) {
            if (!seen.add(t.label())) {
                throw new IllegalArgumentException("duplicate tag label: " + t.label().label());
            }
        }
    }

    public Optional<ScoredTag> tag(Tag label) {
        return tags.stream().filter(t -> t.label() == label).findFirst();
    }

    public boolean hasTag(Tag label) {
        return tag(label).isPresent();
    }
}
