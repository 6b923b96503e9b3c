package io.vidsort4j.fusion;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.vidsort4j.core.Category;
import io.vidsort4j.core.Classification;
import io.vidsort4j.core.EvidenceFragment;
import io.vidsort4j.core.EvidenceSource;
import io.vidsort4j.core.ScoredTag;
import io.vidsort4j.core.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EvidenceFusionTest {

    private static final TagRelationships RELATIONSHIPS = new TagRelationships(
            Map.of(
                    Tag.TORTURE, new TagRelationships.TagRule(Set.of(Tag.REPRESSION), Set.of(), Set.of(), List.of()),
                    Tag.OTHER, new TagRelationships.TagRule(Set.of(), Set.of(), Set.of(Tag.TORTURE), List.of())
            ),
            Map.of(Category.IMPRISONMENT, Set.of(Tag.PRISONERS))
    );

    private final EvidenceFusion fusion = new EvidenceFusion(FusionSettings.DEFAULTS, RELATIONSHIPS);

    @Test
    void agreeingSourcesShouldOutscoreASingleSource() {
        Classification single = fusion.fuse(List.of(
                category("Willful Killing", EvidenceSource.AUDIO, 0.6)));
        Classification both = fusion.fuse(List.of(
                category("Willful Killing", EvidenceSource.AUDIO, 0.6),
                category("Willful Killing", EvidenceSource.OCR, 0.6)));

        assertEquals(0.6, single.categoryScores().get(Category.WILLFUL_KILLING), 1e-9);
        assertEquals(0.84, both.categoryScores().get(Category.WILLFUL_KILLING), 1e-9);
        assertTrue(both.overallConfidence() > single.overallConfidence());
    }

    @Test
    void repeatedFragmentsFromOneSourceShouldNotCompound() {
        Classification result = fusion.fuse(List.of(
                category("Displacement", EvidenceSource.OCR, 0.5),
                category("Displacement", EvidenceSource.OCR, 0.4)));

        assertEquals(0.5, result.categoryScores().get(Category.DISPLACEMENT), 1e-9);
    }

    @Test
    void overallConfidenceShouldScaleWithSourceCoverage() {
        Classification result = fusion.fuse(
                List.of(category("Willful Killing", EvidenceSource.AUDIO, 0.9)),
                EnumSet.of(EvidenceSource.AUDIO, EvidenceSource.OCR),
                Set.of());

        assertEquals(Category.WILLFUL_KILLING, result.category());
        assertEquals(0.9 * (0.7 + 0.3 * 0.5), result.overallConfidence(), 1e-9);
        assertFalse(result.requiresReview());
        assertNull(result.reviewReason());
    }

    @Test
    void categoryTieShouldPreferDeclarationOrder() {
        Classification result = fusion.fuse(List.of(
                category("Displacement", EvidenceSource.AUDIO, 0.7),
                category("Willful Killing", EvidenceSource.AUDIO, 0.7)));

        assertEquals(Category.WILLFUL_KILLING, result.category());
    }

    @Test
    void conflictingTagsShouldKeepTheStrongerAndRequireReview() {
        Classification result = fusion.fuse(List.of(
                category("Inhumane Acts", EvidenceSource.AUDIO, 0.9),
                category("Inhumane Acts", EvidenceSource.OCR, 0.9),
                tag("Torture", EvidenceSource.AUDIO, 0.8),
                tag("Other", EvidenceSource.OCR, 0.5)));

        assertTrue(result.hasTag(Tag.TORTURE));
        assertFalse(result.hasTag(Tag.OTHER));
        assertEquals(List.of("Other (conflicts with Torture)"), result.droppedTags());
        assertTrue(result.requiresReview());
        assertTrue(result.reviewReason().contains("conflicting tags resolved: Other (conflicts with Torture)"));
    }

    @Test
    void parentTagShouldBeImpliedAtADiscount() {
        Classification result = fusion.fuse(List.of(
                category("Inhumane Acts", EvidenceSource.AUDIO, 0.9),
                tag("Torture", EvidenceSource.AUDIO, 0.8)));

        ScoredTag repression = result.tag(Tag.REPRESSION).orElseThrow();
        assertEquals(0.8 * 0.6, repression.confidence(), 1e-9);
        assertEquals("Torture", repression.impliedBy());
        assertTrue(repression.sources().isEmpty());

        ScoredTag torture = result.tag(Tag.TORTURE).orElseThrow();
        assertNull(torture.impliedBy());
        assertEquals(Set.of(EvidenceSource.AUDIO), torture.sources());
    }

    @Test
    void categoryShouldImplyItsTags() {
        Classification result = fusion.fuse(List.of(
                category("Imprisonment", EvidenceSource.OCR, 0.8)));

        ScoredTag prisoners = result.tag(Tag.PRISONERS).orElseThrow();
        assertEquals(0.8 * 0.6, prisoners.confidence(), 1e-9);
        assertEquals("Imprisonment", prisoners.impliedBy());
    }

    @Test
    void impliedTagsBelowThresholdShouldNeitherBeKeptNorImplyFurther() throws IOException {
        EvidenceFusion bundled = new EvidenceFusion(FusionSettings.DEFAULTS,
                new TagRelationshipsLoader(new ObjectMapper()).loadDefault());

        Classification weak = bundled.fuse(List.of(category("Imprisonment", EvidenceSource.AUDIO, 0.4)));

        assertEquals(Category.IMPRISONMENT, weak.category());
        assertFalse(weak.hasTag(Tag.PRISONERS));
        assertFalse(weak.hasTag(Tag.REPRESSION));
        assertTrue(weak.tags().isEmpty());
    }

    @Test
    void implicationChainShouldStopWhereConfidenceFallsBelowThreshold() throws IOException {
        EvidenceFusion bundled = new EvidenceFusion(FusionSettings.DEFAULTS,
                new TagRelationshipsLoader(new ObjectMapper()).loadDefault());

        Classification result = bundled.fuse(List.of(category("Imprisonment", EvidenceSource.AUDIO, 0.6)));

        ScoredTag prisoners = result.tag(Tag.PRISONERS).orElseThrow();
        assertEquals(0.6 * 0.6, prisoners.confidence(), 1e-9);
        assertFalse(result.hasTag(Tag.REPRESSION));
        for (ScoredTag t : result.tags()) {
            assertTrue(t.confidence() >= FusionSettings.DEFAULTS.tagThreshold(), t.label().label());
        }
    }

    @Test
    void agreeingAudioAndOnScreenTextShouldSettleTheCategory() {
        FusionSettings settings = FusionSettings.DEFAULTS;
        double audio = 0.7 * settings.weight(EvidenceSource.AUDIO);
        double ocr = 0.6 * settings.weight(EvidenceSource.OCR);

        Classification result = fusion.fuse(
                List.of(category("Displacement", EvidenceSource.AUDIO, 0.7),
                        category("Displacement", EvidenceSource.OCR, 0.6)),
                EnumSet.of(EvidenceSource.AUDIO, EvidenceSource.OCR),
                EnumSet.of(EvidenceSource.AUDIO, EvidenceSource.OCR));

        assertEquals(Category.DISPLACEMENT, result.category());
        assertEquals(1.0 - (1.0 - audio) * (1.0 - ocr), result.overallConfidence(), 1e-9);
        assertTrue(result.overallConfidence() > 0.7);
        assertFalse(result.requiresReview());
    }

    @Test
    void weakTagsShouldBeDiscarded() {
        Classification result = fusion.fuse(List.of(
                category("Willful Killing", EvidenceSource.AUDIO, 0.9),
                tag("Children", EvidenceSource.AUDIO, 0.2)));

        assertTrue(result.tags().isEmpty());
    }

    @Test
    void unknownLabelsShouldBeIgnored() {
        Classification result = fusion.fuse(List.of(
                category("Willful Killing", EvidenceSource.AUDIO, 0.9),
                tag("Drone Strike", EvidenceSource.AUDIO, 0.9)));

        assertTrue(result.tags().isEmpty());
        assertEquals(Category.WILLFUL_KILLING, result.category());
    }

    @Test
    void noEvidenceShouldYieldUnknownForReview() {
        Classification result = fusion.fuse(List.of());

        assertEquals(Category.UNKNOWN, result.category());
        assertEquals(0.0, result.overallConfidence());
        assertTrue(result.requiresReview());
        assertEquals(EvidenceFusion.NO_EVIDENCE, result.reviewReason());
    }

    @Test
    void rawTextAloneShouldYieldUnknownCategory() {
        Classification result = fusion.fuse(List.of(
                EvidenceFragment.text("some words", EvidenceSource.AUDIO, List.of())));

        assertEquals(Category.UNKNOWN, result.category());
        assertTrue(result.requiresReview());
        assertTrue(result.reviewReason().startsWith("low confidence"));
    }

    @Test
    void silentRequiredSourceShouldRequireReview() {
        Classification result = fusion.fuse(
                List.of(category("Willful Killing", EvidenceSource.OCR, 0.95),
                        category("Willful Killing", EvidenceSource.VISION, 0.95)),
                EnumSet.of(EvidenceSource.AUDIO, EvidenceSource.OCR, EvidenceSource.VISION),
                EnumSet.of(EvidenceSource.AUDIO, EvidenceSource.OCR));

        assertTrue(result.requiresReview());
        assertTrue(result.reviewReason().contains("no evidence from required source(s): audio"));
    }

    private static EvidenceFragment category(String label, EvidenceSource source, double confidence) {
        return EvidenceFragment.categoryHint(label, source, confidence, List.of(), label.toLowerCase());
    }

    private static EvidenceFragment tag(String label, EvidenceSource source, double confidence) {
        return EvidenceFragment.tagHint(label, source, confidence, List.of(), label.toLowerCase());
    }
}
