package io.vidsort4j.fusion;

import io.vidsort4j.core.Category;
import io.vidsort4j.core.Tag;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Static relationships between tags: hierarchy, implication, conflicts and visual evidence labels.
 * Read-only once built.
 */
public final class TagRelationships {

    /**
     * @param parents       broader tags implied by this one
     * @param impliedBy     tags whose presence implies this one
     * @param conflictsWith tags that cannot coexist with this one
     * @param visualLabels  phrases in frame descriptions that count as evidence for this tag
     */
    public record TagRule(Set<Tag> parents, Set<Tag> impliedBy, Set<Tag> conflictsWith, List<String> visualLabels) {
        public TagRule {
            parents = parents == null ? Set.of() : Set.copyOf(parents);
            impliedBy = impliedBy == null ? Set.of() : Set.copyOf(impliedBy);
            conflictsWith = conflictsWith == null ? Set.of() : Set.copyOf(conflictsWith);
            visualLabels = visualLabels == null ? List.of() : List.copyOf(visualLabels);
        }

        static final TagRule EMPTY = new TagRule(Set.of(), Set.of(), Set.of(), List.of());
    }

    private static final TagRelationships EMPTY = new TagRelationships(Map.of(), Map.of());

    private final Map<Tag, TagRule> rules;
    private final Map<Tag, Set<Tag>> implications;
    private final Map<Tag, Set<Tag>> conflicts;
    private final Map<Category, Set<Tag>> categoryImplies;

    public TagRelationships(Map<Tag, TagRule> rules, Map<Category, Set<Tag>> categoryImplies) {
        Objects.requireNonNull(rules, "rules must not be null");
        Objects.requireNonNull(categoryImplies, "categoryImplies must not be null");
        this.rules = rules.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(rules));

        Map<Tag, Set<Tag>> implied = new EnumMap<>(Tag.class);
        Map<Tag, Set<Tag>> conflicting = new EnumMap<>(Tag.class);
        for (Tag t : Tag.values()) {
            implied.put(t, EnumSet.noneOf(Tag.class));
            conflicting.put(t, EnumSet.noneOf(Tag.class));
        }
        this.rules.forEach((tag, rule) -> {
            implied.get(tag).addAll(rule.parents());
            for (Tag trigger : rule.impliedBy()) {
                implied.get(trigger).add(tag);
            }
            // conflicts are symmetric even when declared on one side only
            for (Tag other : rule.conflictsWith()) {
                conflicting.get(tag).add(other);
                conflicting.get(other).add(tag);
            }
        });
        implied.forEach((tag, set) -> set.remove(tag));
        conflicting.forEach((tag, set) -> set.remove(tag));
        this.implications = freeze(implied);
        this.conflicts = freeze(conflicting);

        Map<Category, Set<Tag>> byCategory = new EnumMap<>(Category.class);
        categoryImplies.forEach((c, tags) -> byCategory.put(c, Set.copyOf(tags)));
        this.categoryImplies = byCategory.isEmpty() ? Map.of() : Map.copyOf(byCategory);
    }

    public static TagRelationships empty() {
        return EMPTY;
    }

    public TagRule rule(Tag tag) {
        return rules.getOrDefault(tag, TagRule.EMPTY);
    }

    /**
     * Tags directly implied by {@code tag}: its parents plus every tag that lists it under impliedBy.
     */
    public Set<Tag> implicationsOf(Tag tag) {
        return implications.getOrDefault(tag, Set.of());
    }

    public boolean conflicts(Tag a, Tag b) {
        return conflicts.getOrDefault(a, Set.of()).contains(b);
    }

    public Set<Tag> conflictsOf(Tag tag) {
        return conflicts.getOrDefault(tag, Set.of());
    }

    public List<String> visualLabels(Tag tag) {
        return rule(tag).visualLabels();
    }

    public Set<Tag> impliedByCategory(Category category) {
        return categoryImplies.getOrDefault(category, Set.of());
    }

    private static Map<Tag, Set<Tag>> freeze(Map<Tag, Set<Tag>> source) {
        Map<Tag, Set<Tag>> out = new EnumMap<>(Tag.class);
        source.forEach((k, v) -> out.put(k, v.isEmpty() ? Set.of() : Set.copyOf(v)));
        return Map.copyOf(out);
    }
}
