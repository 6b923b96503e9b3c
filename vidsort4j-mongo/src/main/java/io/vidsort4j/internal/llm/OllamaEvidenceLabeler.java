package io.vidsort4j.internal.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vidsort4j.core.Category;
import io.vidsort4j.core.EvidenceFragment;
import io.vidsort4j.core.EvidenceSource;
import io.vidsort4j.core.Tag;
import io.vidsort4j.extract.EvidenceLabeler;
import io.vidsort4j.extract.TextSegment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Labels extracted text with a local LLM served by Ollama.
 *
 * <p>The model sees one source's text together with the closed category and tag vocabulary and answers
 * with JSON: {@code {"category": ..., "tags": [...], "confidence": "high|medium|low", "reasoning": ...}}.
 * The category and every tag become hint fragments at the answer's confidence. Labels outside the
 * vocabulary are passed through unchanged so the pipeline can record them as proposals.
 *
 * <p>When Ollama is unreachable, answers with an error status or returns something that is not the
 * expected JSON, the text is labeled by {@code fallback} instead.
 */
public class OllamaEvidenceLabeler implements EvidenceLabeler {
    private static final Logger log = LoggerFactory.getLogger(OllamaEvidenceLabeler.class);

    static final double HIGH = 0.85;
    static final double MEDIUM = 0.6;
    static final double LOW = 0.35;
    static final int EXCERPT_CHARS = 200;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final LlmLabelerSettings settings;
    private final EvidenceLabeler fallback;

    public OllamaEvidenceLabeler(RestTemplate restTemplate, ObjectMapper objectMapper,
                                 LlmLabelerSettings settings, EvidenceLabeler fallback) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
    }

    /**
     * A {@link RestTemplate} whose read timeout is the configured call timeout.
     */
    public static RestTemplate restTemplate(LlmLabelerSettings settings) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) Duration.ofSeconds(10).toMillis());
        factory.setReadTimeout((int) settings.timeout().toMillis());
        return new RestTemplate(factory);
    }

    @Override
    public List<EvidenceFragment> label(EvidenceSource source, List<TextSegment> segments) {
        if (segments == null || segments.isEmpty()) {
            return List.of();
        }
        String text = segments.stream()
                .map(TextSegment::text)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining("\n"));
        if (text.isEmpty()) {
            return List.of();
        }
        Set<Integer> frames = new TreeSet<>();
        segments.stream().filter(s -> !s.text().isBlank()).forEach(s -> frames.addAll(s.frameRefs()));

        JsonNode verdict;
        try {
            verdict = classify(source, text);
        } catch (RestClientException | IOException e) {
            log.warn("vidsort llm labeling failed, using fallback source={} model={} msg={}",
                    source, settings.model(), e.getMessage());
            return fallback.label(source, segments);
        }
        return toFragments(verdict, source, List.copyOf(frames));
    }

    private JsonNode classify(EvidenceSource source, String text) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", settings.model());
        body.put("prompt", prompt(source, text));
        body.put("stream", false);
        body.put("format", "json");

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<String> response = restTemplate.exchange(
                settings.url(),
                HttpMethod.POST,
                new HttpEntity<>(body, headers),
                String.class);
        String payload = response.getBody();
        if (payload == null || payload.isBlank()) {
            throw new IOException("empty body from " + settings.url());
        }

        String answer = objectMapper.readTree(payload).path("response").asText("");
        int open = answer.indexOf('{');
        int close = answer.lastIndexOf('}');
        if (open < 0 || close < open) {
            throw new IOException("model answer is not a JSON object: " + abbreviate(answer, 80));
        }
        JsonNode verdict = objectMapper.readTree(answer.substring(open, close + 1));
        if (!verdict.isObject()) {
            throw new IOException("model answer is not a JSON object: " + abbreviate(answer, 80));
        }
        log.debug("vidsort llm verdict source={} category={} confidence={}",
                source, verdict.path("category").asText(""), verdict.path("confidence").asText(""));
        return verdict;
    }

    String prompt(EvidenceSource source, String text) {
        List<String> categories = Arrays.stream(Category.values())
                .filter(c -> c != Category.UNKNOWN)
                .map(Category::label)
                .toList();
        List<String> tags = Arrays.stream(Tag.values()).map(Tag::label).toList();

        StringBuilder sb = new StringBuilder(text.length() + 1024);
        sb.append("You are analyzing journalist reports about Gaza to classify them into categories and tags.\n\n");
        sb.append("CATEGORIES (choose exactly ONE):\n").append(toJson(categories)).append("\n\n");
        sb.append("TAGS (choose ALL that apply, can be multiple or none):\n").append(toJson(tags)).append("\n\n");
        sb.append("If a clearly relevant tag is missing from the list, you may add it with a short name.\n");
        sb.append("If the content does not fit any category, answer \"Unknown\".\n\n");
        sb.append("Respond with valid JSON only in this exact format:\n");
        sb.append("{\n")
                .append("  \"category\": \"category name here\",\n")
                .append("  \"tags\": [\"tag1\", \"tag2\"],\n")
                .append("  \"confidence\": \"high/medium/low\",\n")
                .append("  \"reasoning\": \"brief explanation mentioning key details\"\n")
                .append("}\n\n");
        sb.append("Content to classify:\n\n");
        sb.append(heading(source)).append(":\n").append(abbreviate(text, settings.maxCharacters()));
        return sb.toString();
    }

    private List<EvidenceFragment> toFragments(JsonNode verdict, EvidenceSource source, List<Integer> frames) {
        double confidence = confidence(verdict.path("confidence"));
        String reasoning = verdict.path("reasoning").asText("").trim();
        String excerpt = reasoning.isEmpty() ? null : abbreviate(reasoning, EXCERPT_CHARS);

        List<EvidenceFragment> out = new ArrayList<>();
        String category = verdict.path("category").asText("").trim();
        if (!category.isEmpty() && Category.fromLabel(category).orElse(null) != Category.UNKNOWN) {
            out.add(EvidenceFragment.categoryHint(category, source, confidence, frames, excerpt));
        }

        Set<String> seen = new LinkedHashSet<>();
        JsonNode tags = verdict.path("tags");
        if (tags.isArray()) {
            for (JsonNode t : tags) {
                String label = t.asText("").trim();
                if (!label.isEmpty() && seen.add(label.toLowerCase(Locale.ROOT))) {
                    out.add(EvidenceFragment.tagHint(label, source, confidence, frames, excerpt));
                }
            }
        }
        return out;
    }

    /**
     * high / medium / low, or a number in [0, 1]. Anything else counts as medium.
     */
    static double confidence(JsonNode node) {
        if (node.isNumber()) {
            return Math.max(0.0, Math.min(1.0, node.asDouble()));
        }
        switch (node.asText("").trim().toLowerCase(Locale.ROOT)) {
            case "high":
                return HIGH;
            case "low":
                return LOW;
            default:
                return MEDIUM;
        }
    }

    private static String heading(EvidenceSource source) {
        switch (source) {
            case AUDIO:
                return "AUDIO TRANSCRIPT";
            case OCR:
                return "ON-SCREEN TEXT (from video frames)";
            default:
                return "VISUAL DESCRIPTION (from video frames)";
        }
    }

    private String toJson(List<String> labels) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(labels);
        } catch (IOException e) {
            throw new IllegalStateException("cannot render label list", e);
        }
    }

    private static String abbreviate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }
}
