package io.vidsort4j.extract;

import io.vidsort4j.core.Category;
import io.vidsort4j.core.EvidenceFragment;
import io.vidsort4j.core.FragmentKind;
import io.vidsort4j.core.Job;
import io.vidsort4j.core.Priority;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Decides per job whether the costly visual description runs, after the text extractors finished.
 *
 * @param ambiguityThreshold in AUTO mode, a best category hint below this counts as ambiguous
 */
public record VisionPolicy(VisionMode mode, double ambiguityThreshold) {

    public static final VisionPolicy DISABLED = new VisionPolicy(VisionMode.OFF, 0.5);

    public VisionPolicy {
        Objects.requireNonNull(mode, "mode must not be null");
    }

    public boolean shouldDescribe(Job job, List<EvidenceFragment> textEvidence) {
        return switch (mode) {
            case OFF -> false;
            case ALWAYS -> true;
            case AUTO -> job.priority() == Priority.URGENT || isAmbiguous(textEvidence);
        };
    }

    /**
     * No category hint at all, or the strongest one is below the ambiguity threshold.
     */
    boolean isAmbiguous(List<EvidenceFragment> fragments) {
        OptionalDouble best = fragments.stream()
                .filter(f -> f.kind() == FragmentKind.CATEGORY)
                .filter(f -> Category.fromLabel(f.text()).filter(c -> c != Category.UNKNOWN).isPresent())
                .mapToDouble(EvidenceFragment::confidence)
                .max();
        return best.isEmpty() || best.getAsDouble() < ambiguityThreshold;
    }
}
