package io.vidsort4j.extract;

import io.vidsort4j.TextRecognizer;
import io.vidsort4j.core.EvidenceFragment;
import io.vidsort4j.core.EvidenceSource;
import io.vidsort4j.core.FragmentKind;
import io.vidsort4j.core.MediaAsset;
import io.vidsort4j.core.error.ExtractionException;
import io.vidsort4j.fusion.TagRelationships;
import io.vidsort4j.media.FrameGrabber;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OnScreenTextExtractorTest {

    @TempDir
    Path tmp;

    private final EvidenceLabeler labeler = new KeywordEvidenceLabeler(
            new KeywordEvidenceLabeler.Lexicon(Map.of("Displacement", List.of("evacuation")), Map.of()),
            TagRelationships.empty());

    @Test
    void recognizedTextShouldCarryItsFrameIndex() throws Exception {
        FrameGrabber grabber = (media, offset, target) -> Files.writeString(target, "png");
        AtomicInteger calls = new AtomicInteger();
        TextRecognizer recognizer = (frames, languages) ->
                calls.getAndIncrement() == 3 ? "EVACUATION ORDER for the north" : "";

        OnScreenTextExtractor extractor = new OnScreenTextExtractor(grabber, recognizer, labeler,
                new FrameSampler(5), List.of("ara", "eng"), tmp);
        List<EvidenceFragment> fragments = extractor.extract(asset());

        assertEquals(2, fragments.size());
        EvidenceFragment text = fragments.get(0);
        assertEquals(FragmentKind.TEXT, text.kind());
        assertEquals(List.of(3), text.frameRefs());
        EvidenceFragment hint = fragments.get(1);
        assertEquals(FragmentKind.CATEGORY, hint.kind());
        assertEquals("Displacement", hint.text());
        assertEquals(EvidenceSource.OCR, hint.source());
        assertEquals(List.of(3), hint.frameRefs());
        assertEquals(5, calls.get());
    }

    @Test
    void framesShouldBeDeletedAfterExtraction() throws Exception {
        FrameGrabber grabber = (media, offset, target) -> Files.writeString(target, "png");
        OnScreenTextExtractor extractor = new OnScreenTextExtractor(grabber, (frames, languages) -> "",
                labeler, new FrameSampler(5), List.of("eng"), tmp);

        assertTrue(extractor.extract(asset()).isEmpty());
        try (Stream<Path> left = Files.list(tmp)) {
            assertFalse(left.anyMatch(p -> p.getFileName().toString().startsWith("ocr-")));
        }
    }

    @Test
    void noReadableFrameShouldBePermanent() {
        FrameGrabber grabber = (media, offset, target) -> {
            throw new IOException("invalid data found when processing input");
        };
        OnScreenTextExtractor extractor = new OnScreenTextExtractor(grabber, (frames, languages) -> "x",
                labeler, new FrameSampler(5), List.of("eng"), tmp);

        ExtractionException e = assertThrows(ExtractionException.class, () -> extractor.extract(asset()));
        assertFalse(e.isTransient());
    }

    private MediaAsset asset() {
        return new MediaAsset(tmp.resolve("clip.mp4").toString(), 60.0, 1280, 720, true, null);
    }
}
