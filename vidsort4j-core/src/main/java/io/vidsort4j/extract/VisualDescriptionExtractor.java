package io.vidsort4j.extract;

import io.vidsort4j.VisionDescriber;
import io.vidsort4j.core.EvidenceFragment;
import io.vidsort4j.core.EvidenceSource;
import io.vidsort4j.core.MediaAsset;
import io.vidsort4j.core.error.ExtractionException;
import io.vidsort4j.media.FrameGrabber;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Optional natural-language description of sampled frames. Only run when the vision policy allows it.
 */
public class VisualDescriptionExtractor implements SignalExtractor {

    private final FrameGrabber frameGrabber;
    private final VisionDescriber describer;
    private final EvidenceLabeler labeler;
    private final FrameSampler sampler;
    private final Path workDir;

    public VisualDescriptionExtractor(FrameGrabber frameGrabber, VisionDescriber describer, EvidenceLabeler labeler,
                                      FrameSampler sampler, Path workDir) {
        this.frameGrabber = Objects.requireNonNull(frameGrabber, "frameGrabber must not be null");
        this.describer = Objects.requireNonNull(describer, "describer must not be null");
        this.labeler = Objects.requireNonNull(labeler, "labeler must not be null");
        this.sampler = Objects.requireNonNull(sampler, "sampler must not be null");
        this.workDir = Objects.requireNonNull(workDir, "workDir must not be null");
    }

    @Override
    public EvidenceSource source() {
        return EvidenceSource.VISION;
    }

    @Override
    public boolean required() {
        return false;
    }

    @Override
    public List<EvidenceFragment> extract(MediaAsset asset) throws ExtractionException {
        List<Double> offsets = sampler.offsets(asset.durationSeconds());
        SampledFrames frames;
        try {
            frames = SampledFrames.grab(frameGrabber, Path.of(asset.path()), offsets, workDir, "vision-");
        } catch (IOException e) {
            throw ExtractionException.transientFailure("cannot prepare frame directory: " + e.getMessage(), e);
        }
        try (frames) {
            if (frames.isEmpty()) {
                throw ExtractionException.permanent("no readable frames in " + asset.path());
            }
            String description = describer.describe(frames.paths());
            if (description == null || description.isBlank()) {
                return List.of();
            }
            List<Integer> refs = frames.indices();
            List<EvidenceFragment> out = new ArrayList<>();
            out.add(EvidenceFragment.text(description.strip(), EvidenceSource.VISION, refs));
            out.addAll(labeler.label(EvidenceSource.VISION, List.of(new TextSegment(description, refs))));
            return out;
        }
    }
}
