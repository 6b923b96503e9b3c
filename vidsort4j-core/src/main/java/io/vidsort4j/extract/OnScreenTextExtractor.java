package io.vidsort4j.extract;

import io.vidsort4j.TextRecognizer;
import io.vidsort4j.core.EvidenceFragment;
import io.vidsort4j.core.EvidenceSource;
import io.vidsort4j.core.MediaAsset;
import io.vidsort4j.core.error.ExtractionException;
import io.vidsort4j.media.FrameGrabber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recognizes overlay text on sampled frames. Each frame with text yields one raw fragment referencing
 * that frame.
 */
public class OnScreenTextExtractor implements SignalExtractor {
    private static final Logger log = LoggerFactory.getLogger(OnScreenTextExtractor.class);

    private final FrameGrabber frameGrabber;
    private final TextRecognizer recognizer;
    private final EvidenceLabeler labeler;
    private final FrameSampler sampler;
    private final List<String> languages;
    private final Path workDir;

    public OnScreenTextExtractor(FrameGrabber frameGrabber, TextRecognizer recognizer, EvidenceLabeler labeler,
                                 FrameSampler sampler, List<String> languages, Path workDir) {
        this.frameGrabber = Objects.requireNonNull(frameGrabber, "frameGrabber must not be null");
        this.recognizer = Objects.requireNonNull(recognizer, "recognizer must not be null");
        this.labeler = Objects.requireNonNull(labeler, "labeler must not be null");
        this.sampler = Objects.requireNonNull(sampler, "sampler must not be null");
        this.languages = List.copyOf(Objects.requireNonNull(languages, "languages must not be null"));
        this.workDir = Objects.requireNonNull(workDir, "workDir must not be null");
    }

    @Override
    public EvidenceSource source() {
        return EvidenceSource.OCR;
    }

    @Override
    public List<EvidenceFragment> extract(MediaAsset asset) throws ExtractionException {
        List<Double> offsets = sampler.offsets(asset.durationSeconds());
        try (SampledFrames frames = grab(asset, offsets)) {
            if (frames.isEmpty()) {
                throw ExtractionException.permanent("no readable frames in " + asset.path());
            }

            List<EvidenceFragment> out = new ArrayList<>();
            List<TextSegment> segments = new ArrayList<>();
            for (SampledFrames.Frame frame : frames.frames()) {
                String text = recognizer.recognize(List.of(frame.path()), languages);
                if (text == null || text.isBlank()) {
                    continue;
                }
                List<Integer> refs = List.of(frame.index());
                out.add(EvidenceFragment.text(text.strip(), EvidenceSource.OCR, refs));
                segments.add(new TextSegment(text, refs));
            }
            log.debug("ocr finished media={} frames={}/{} withText={}",
                    asset.path(), frames.frames().size(), frames.requested(), segments.size());
            out.addAll(labeler.label(EvidenceSource.OCR, segments));
            return out;
        }
    }

    private SampledFrames grab(MediaAsset asset, List<Double> offsets) throws ExtractionException {
        try {
            return SampledFrames.grab(frameGrabber, Path.of(asset.path()), offsets, workDir, "ocr-");
        } catch (IOException e) {
            throw ExtractionException.transientFailure("cannot prepare frame directory: " + e.getMessage(), e);
        }
    }
}
