package io.vidsort4j.fusion;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vidsort4j.core.Category;
import io.vidsort4j.core.Tag;

import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads {@link TagRelationships} from JSON.
 *
 * <pre>{@code
 * {
 *   "tags": {
 *     "Torture": { "parents": ["Repression"], "conflictsWith": [], "impliedBy": [], "visualLabels": ["bound hands"] }
 *   },
 *   "categoryImplies": { "Imprisonment": ["Prisoners"] }
 * }
 * }</pre>
 *
 * Every label must belong to the closed vocabulary; new labels go through the proposed-tag log instead.
 */
public class TagRelationshipsLoader {

    public static final String DEFAULT_RESOURCE = "vidsort/tag-relationships.json";

    private final ObjectMapper objectMapper;

    public TagRelationshipsLoader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public TagRelationships loadDefault() throws IOException {
        ClassLoader cl = TagRelationshipsLoader.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IOException("classpath resource not found: " + DEFAULT_RESOURCE);
            }
            return load(in);
        }
    }

    public TagRelationships load(InputStream in) throws IOException {
        Objects.requireNonNull(in, "in must not be null");
        RelationshipsFile file = objectMapper.readValue(in, RelationshipsFile.class);

        Map<Tag, TagRelationships.TagRule> rules = new EnumMap<>(Tag.class);
        if (file.tags() != null) {
            file.tags().forEach((label, rule) -> {
                Tag tag = tag(label);
                if (rule == null) {
                    return;
                }
                rules.put(tag, new TagRelationships.TagRule(
                        tags(rule.parents()),
                        tags(rule.impliedBy()),
                        tags(rule.conflictsWith()),
                        rule.visualLabels()));
            });
        }

        Map<Category, Set<Tag>> categoryImplies = new EnumMap<>(Category.class);
        if (file.categoryImplies() != null) {
            file.categoryImplies().forEach((label, tags) -> {
                Category category = Category.fromLabel(label)
                        .orElseThrow(() -> new IllegalArgumentException("unknown category label in tag relationships: " + label));
                categoryImplies.put(category, tags(tags));
            });
        }
        return new TagRelationships(rules, categoryImplies);
    }

    private static Set<Tag> tags(List<String> labels) {
        Set<Tag> out = EnumSet.noneOf(Tag.class);
        if (labels != null) {
            for (String label : labels) {
                out.add(tag(label));
            }
        }
        return out;
    }

    private static Tag tag(String label) {
        return Tag.fromLabel(label)
                .orElseThrow(() -> new IllegalArgumentException("unknown tag label in tag relationships: " + label));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RelationshipsFile(Map<String, RuleEntry> tags, Map<String, List<String>> categoryImplies) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RuleEntry(List<String> parents, List<String> impliedBy, List<String> conflictsWith, List<String> visualLabels) {
    }
}
