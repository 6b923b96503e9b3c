package io.vidsort4j.fusion;

import io.vidsort4j.core.Category;
import io.vidsort4j.core.Classification;
import io.vidsort4j.core.EvidenceFragment;
import io.vidsort4j.core.EvidenceSource;
import io.vidsort4j.core.FragmentKind;
import io.vidsort4j.core.ScoredTag;
import io.vidsort4j.core.Tag;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Merges evidence fragments into one {@link Classification}.
 *
 * <ol>
 *   <li>Per label, each source contributes its best fragment times the source weight; sources combine by
 *       noisy-OR ({@code 1 - prod(1 - w*c)}), so agreement between independent sources raises confidence.</li>
 *   <li>The category is the highest aggregate; ties go to the category backed by the strongest single
 *       fragment, then to declaration order.</li>
 *   <li>Tags below the tag threshold are dropped; surviving tags and the chosen category imply further tags
 *       at a discount per hop, to a fixpoint.</li>
 *   <li>Conflicting tags keep the stronger one; the loser is recorded for review.</li>
 *   <li>Overall confidence is category strength scaled by source coverage.</li>
 * </ol>
 *
 * Pure computation: never throws on well-formed fragments and never touches I/O.
 */
public class EvidenceFusion {

    public static final String NO_EVIDENCE = "no evidence extracted";

    private static final double EPSILON = 1e-9;

    private final FusionSettings settings;
    private final TagRelationships relationships;

    public EvidenceFusion(FusionSettings settings, TagRelationships relationships) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.relationships = Objects.requireNonNull(relationships, "relationships must not be null");
    }

    public Classification fuse(List<EvidenceFragment> fragments) {
        return fuse(fragments, EnumSet.allOf(EvidenceSource.class), Set.of());
    }

    /**
     * @param expectedSources sources whose extractors were invoked for this job
     * @param requiredSources sources whose silence alone requires review
     */
    public Classification fuse(List<EvidenceFragment> fragments,
                               Set<EvidenceSource> expectedSources,
                               Set<EvidenceSource> requiredSources) {
        List<EvidenceFragment> all = fragments == null ? List.of() : fragments.stream()
                .filter(Objects::nonNull)
                .filter(f -> f.confidence() > 0.0)
                .toList();
        if (all.isEmpty()) {
            return new Classification(Category.UNKNOWN, Map.of(), List.of(), 0.0, true, NO_EVIDENCE, List.of());
        }

        Map<Category, Aggregate> categories = new EnumMap<>(Category.class);
        Map<Tag, Aggregate> tagEvidence = new EnumMap<>(Tag.class);
        Set<EvidenceSource> contributing = EnumSet.noneOf(EvidenceSource.class);
        Set<EvidenceSource> producing = EnumSet.noneOf(EvidenceSource.class);

        for (EvidenceFragment f : all) {
            producing.add(f.source());
            if (f.kind() == FragmentKind.CATEGORY) {
                Category.fromLabel(f.text())
                        .filter(c -> c != Category.UNKNOWN)
                        .ifPresent(c -> {
                            categories.computeIfAbsent(c, k -> new Aggregate()).add(f, settings.weight(f.source()));
                            contributing.add(f.source());
                        });
            } else if (f.kind() == FragmentKind.TAG) {
                Tag.fromLabel(f.text()).ifPresent(t -> {
                    tagEvidence.computeIfAbsent(t, k -> new Aggregate()).add(f, settings.weight(f.source()));
                    contributing.add(f.source());
                });
            }
        }

        // category
        Map<Category, Double> categoryScores = new EnumMap<>(Category.class);
        categories.forEach((c, agg) -> categoryScores.put(c, agg.combined()));
        Category category = selectCategory(categories);
        double strength = category == Category.UNKNOWN ? 0.0 : categoryScores.getOrDefault(category, 0.0);

        // tags: direct, then implications to a fixpoint
        Map<Tag, TagState> tags = new EnumMap<>(Tag.class);
        tagEvidence.forEach((t, agg) -> {
            double c = agg.combined();
            if (c >= settings.tagThreshold()) {
                tags.put(t, TagState.direct(c, agg));
            }
        });
        Deque<Tag> work = new ArrayDeque<>(tags.keySet());
        if (category != Category.UNKNOWN && strength > 0.0) {
            double implied = strength * settings.implicationDiscount();
            for (Tag t : relationships.impliedByCategory(category)) {
                if (offer(tags, t, implied, category.label())) {
                    work.add(t);
                }
            }
        }
        while (!work.isEmpty()) {
            Tag from = work.poll();
            TagState state = tags.get(from);
            double implied = state.confidence * settings.implicationDiscount();
            if (implied < settings.tagThreshold()) {
                continue;
            }
            for (Tag to : relationships.implicationsOf(from)) {
                if (offer(tags, to, implied, from.label())) {
                    work.add(to);
                }
            }
        }

        // conflicts
        List<Map.Entry<Tag, TagState>> ranked = new ArrayList<>(tags.entrySet());
        ranked.sort(Comparator.<Map.Entry<Tag, TagState>>comparingDouble(e -> e.getValue().confidence).reversed()
                .thenComparing(Comparator.<Map.Entry<Tag, TagState>>comparingInt(e -> e.getValue().sources.size()).reversed())
                .thenComparingInt(e -> e.getKey().ordinal()));
        List<ScoredTag> kept = new ArrayList<>();
        Set<Tag> keptLabels = EnumSet.noneOf(Tag.class);
        List<String> dropped = new ArrayList<>();
        for (Map.Entry<Tag, TagState> e : ranked) {
            Tag tag = e.getKey();
            Tag winner = firstConflict(tag, keptLabels);
            if (winner != null) {
                dropped.add(tag.label() + " (conflicts with " + winner.label() + ")");
                continue;
            }
            keptLabels.add(tag);
            kept.add(e.getValue().toScored(tag));
        }

        // overall
        int expected = expectedSources == null ? 0 : expectedSources.size();
        double coverage = expected == 0 ? 1.0 : Math.min(1.0, (double) contributing.size() / expected);
        double overall = clamp(strength * (settings.coverageFloor() + (1.0 - settings.coverageFloor()) * coverage));

        List<String> reasons = new ArrayList<>(3);
        if (overall < settings.reviewThreshold()) {
            reasons.add(String.format(Locale.ROOT, "low confidence (%.2f < %.2f)", overall, settings.reviewThreshold()));
        }
        if (!dropped.isEmpty()) {
            reasons.add("conflicting tags resolved: " + String.join(", ", dropped));
        }
        if (requiredSources != null) {
            Set<EvidenceSource> silent = new TreeSet<>(requiredSources);
            silent.removeAll(producing);
            if (!silent.isEmpty()) {
                reasons.add("no evidence from required source(s): " + silent.stream()
                        .map(s -> s.name().toLowerCase(Locale.ROOT))
                        .collect(Collectors.joining(", ")));
            }
        }

        return new Classification(
                category,
                categoryScores,
                kept,
                overall,
                !reasons.isEmpty(),
                reasons.isEmpty() ? null : String.join("; ", reasons),
                dropped);
    }

    private Category selectCategory(Map<Category, Aggregate> categories) {
        Category best = Category.UNKNOWN;
        double bestScore = 0.0;
        double bestFragment = 0.0;
        // EnumMap iterates in declaration order, so the priority order wins remaining ties
        for (Map.Entry<Category, Aggregate> e : categories.entrySet()) {
            double score = e.getValue().combined();
            double fragment = e.getValue().bestFragment;
            if (score > bestScore + EPSILON
                    || (Math.abs(score - bestScore) <= EPSILON && fragment > bestFragment + EPSILON)) {
                best = e.getKey();
                bestScore = score;
                bestFragment = fragment;
            }
        }
        return bestScore > 0.0 ? best : Category.UNKNOWN;
    }

    // implied tags under the threshold are neither kept nor allowed to imply further
    private boolean offer(Map<Tag, TagState> tags, Tag tag, double confidence, String impliedBy) {
        if (confidence < settings.tagThreshold()) {
            return false;
        }
        TagState existing = tags.get(tag);
        if (existing == null) {
            tags.put(tag, TagState.implied(confidence, impliedBy));
            return true;
        }
        if (confidence > existing.confidence + EPSILON) {
            existing.confidence = confidence;
            if (existing.impliedBy != null) {
                existing.impliedBy = impliedBy;
            }
            return true;
        }
        return false;
    }

    private Tag firstConflict(Tag tag, Collection<Tag> kept) {
        for (Tag other : kept) {
            if (relationships.conflicts(tag, other)) {
                return other;
            }
        }
        return null;
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }

    /**
     * Best weighted fragment per source for one label.
     */
    private static final class Aggregate {
        private final Map<EvidenceSource, Double> perSource = new EnumMap<>(EvidenceSource.class);
        private final Set<String> excerpts = new LinkedHashSet<>();
        private final Set<Integer> frameRefs = new TreeSet<>();
        private double bestFragment;

        void add(EvidenceFragment f, double weight) {
            double weighted = clamp(f.confidence() * weight);
            perSource.merge(f.source(), weighted, Math::max);
            bestFragment = Math.max(bestFragment, weighted);
            if (f.excerpt() != null && !f.excerpt().isBlank()) {
                excerpts.add(f.excerpt());
            }
            frameRefs.addAll(f.frameRefs());
        }

        double combined() {
            double miss = 1.0;
            for (double c : perSource.values()) {
                miss *= (1.0 - c);
            }
            return clamp(1.0 - miss);
        }
    }

    private static final class TagState {
        private double confidence;
        private String impliedBy;
        private final Set<EvidenceSource> sources;
        private final List<String> evidence;
        private final List<Integer> frameRefs;

        private TagState(double confidence, String impliedBy, Set<EvidenceSource> sources,
                         List<String> evidence, List<Integer> frameRefs) {
            this.confidence = confidence;
            this.impliedBy = impliedBy;
            this.sources = sources;
            this.evidence = evidence;
            this.frameRefs = frameRefs;
        }

        static TagState direct(double confidence, Aggregate agg) {
            return new TagState(confidence, null, EnumSet.copyOf(agg.perSource.keySet()),
                    List.copyOf(agg.excerpts), List.copyOf(agg.frameRefs));
        }

        static TagState implied(double confidence, String impliedBy) {
            return new TagState(confidence, impliedBy, EnumSet.noneOf(EvidenceSource.class), List.of(), List.of());
        }

        ScoredTag toScored(Tag tag) {
            return new ScoredTag(tag, clamp(confidence), sources, evidence, frameRefs, impliedBy);
        }
    }
}
