package io.vidsort4j.extract;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vidsort4j.core.Category;
import io.vidsort4j.core.EvidenceFragment;
import io.vidsort4j.core.EvidenceSource;
import io.vidsort4j.core.Tag;
import io.vidsort4j.fusion.TagRelationships;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword-based labeler over English and Arabic lexicons.
 *
 * <p>Each keyword occurrence counts as one hit; a label's confidence is {@code 1 - 0.55^hits}, capped at
 * 0.95. Latin keywords must start on a word boundary so "war" does not match "toward"; Arabic keywords
 * match anywhere because articles and conjunctions attach to the word. For {@link EvidenceSource#VISION}
 * the visual-evidence labels of each tag count as extra keywords.
 */
public class KeywordEvidenceLabeler implements EvidenceLabeler {

    public static final String DEFAULT_RESOURCE = "vidsort/keyword-lexicon.json";

    static final double MISS_PER_HIT = 0.55;
    static final double MAX_CONFIDENCE = 0.95;
    static final int EXCERPT_CHARS = 120;

    private static final int CASE_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private final Map<Category, List<Pattern>> categoryPatterns = new EnumMap<>(Category.class);
    private final Map<Tag, List<Pattern>> tagPatterns = new EnumMap<>(Tag.class);
    private final Map<Tag, List<Pattern>> visualPatterns = new EnumMap<>(Tag.class);

    public KeywordEvidenceLabeler(Lexicon lexicon, TagRelationships relationships) {
        Objects.requireNonNull(lexicon, "lexicon must not be null");
        Objects.requireNonNull(relationships, "relationships must not be null");
        if (lexicon.categories() != null) {
            lexicon.categories().forEach((label, words) -> {
                Category c = Category.fromLabel(label)
                        .orElseThrow(() -> new IllegalArgumentException("unknown category label in lexicon: " + label));
                categoryPatterns.put(c, compile(words));
            });
        }
        if (lexicon.tags() != null) {
            lexicon.tags().forEach((label, words) -> {
                Tag t = Tag.fromLabel(label)
                        .orElseThrow(() -> new IllegalArgumentException("unknown tag label in lexicon: " + label));
                tagPatterns.put(t, compile(words));
            });
        }
        for (Tag t : Tag.values()) {
            List<String> visual = relationships.visualLabels(t);
            if (!visual.isEmpty()) {
                visualPatterns.put(t, compile(visual));
            }
        }
    }

    public static KeywordEvidenceLabeler fromClasspath(ObjectMapper objectMapper, TagRelationships relationships)
            throws IOException {
        try (InputStream in = KeywordEvidenceLabeler.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IOException("classpath resource not found: " + DEFAULT_RESOURCE);
            }
            return new KeywordEvidenceLabeler(objectMapper.readValue(in, Lexicon.class), relationships);
        }
    }

    @Override
    public List<EvidenceFragment> label(EvidenceSource source, List<TextSegment> segments) {
        if (segments == null || segments.isEmpty()) {
            return List.of();
        }
        List<EvidenceFragment> hints = new ArrayList<>();
        categoryPatterns.forEach((category, patterns) -> {
            Hits h = scan(patterns, segments);
            if (h.count > 0) {
                hints.add(EvidenceFragment.categoryHint(category.label(), source, confidence(h.count),
                        List.copyOf(h.frames), h.excerpt));
            }
        });
        for (Tag tag : Tag.values()) {
            List<Pattern> patterns = new ArrayList<>(tagPatterns.getOrDefault(tag, List.of()));
            if (source == EvidenceSource.VISION) {
                patterns.addAll(visualPatterns.getOrDefault(tag, List.of()));
            }
            if (patterns.isEmpty()) {
                continue;
            }
            Hits h = scan(patterns, segments);
            if (h.count > 0) {
                hints.add(EvidenceFragment.tagHint(tag.label(), source, confidence(h.count),
                        List.copyOf(h.frames), h.excerpt));
            }
        }
        return hints;
    }

    static double confidence(int hits) {
        return Math.min(MAX_CONFIDENCE, 1.0 - Math.pow(MISS_PER_HIT, hits));
    }

    private static Hits scan(List<Pattern> patterns, List<TextSegment> segments) {
        Hits hits = new Hits();
        for (TextSegment segment : segments) {
            String text = segment.text();
            boolean matched = false;
            for (Pattern p : patterns) {
                Matcher m = p.matcher(text);
                while (m.find()) {
                    hits.count++;
                    matched = true;
                    if (hits.excerpt == null) {
                        hits.excerpt = excerpt(text, m.start(), m.end());
                    }
                }
            }
            if (matched) {
                hits.frames.addAll(segment.frameRefs());
            }
        }
        return hits;
    }

    static String excerpt(String text, int start, int end) {
        int pad = Math.max(0, (EXCERPT_CHARS - (end - start)) / 2);
        int from = Math.max(0, start - pad);
        int to = Math.min(text.length(), end + pad);
        return text.substring(from, to).replaceAll("\\s+", " ").trim();
    }

    private static List<Pattern> compile(List<String> words) {
        List<Pattern> out = new ArrayList<>();
        if (words == null) {
            return out;
        }
        for (String w : words) {
            if (w == null || w.isBlank()) {
                continue;
            }
            String kw = w.trim().toLowerCase(Locale.ROOT);
            String quoted = Pattern.quote(kw);
            // matched against the original text so offsets stay valid for the excerpt
            out.add(isLatin(kw)
                    ? Pattern.compile("(?<![\\p{L}\\p{N}])" + quoted, CASE_FLAGS)
                    : Pattern.compile(quoted, CASE_FLAGS));
        }
        return out;
    }

    private static boolean isLatin(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isLetter(c) && Character.UnicodeScript.of(c) != Character.UnicodeScript.LATIN) {
                return false;
            }
        }
        return true;
    }

    private static final class Hits {
        private int count;
        private String excerpt;
        private final Set<Integer> frames = new TreeSet<>();
    }

    /**
     * Keyword lists keyed by category and tag label.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Lexicon(Map<String, List<String>> categories, Map<String, List<String>> tags) {
    }
}
