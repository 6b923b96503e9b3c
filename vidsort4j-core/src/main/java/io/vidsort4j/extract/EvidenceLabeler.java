package io.vidsort4j.extract;

import io.vidsort4j.core.EvidenceFragment;
import io.vidsort4j.core.EvidenceSource;

import java.util.List;

/**
 * Turns extracted text into category and tag hint fragments.
 *
 * <p>Hint labels are normally drawn from the closed vocabulary; implementations may propose labels
 * outside it, which the pipeline records in the proposed-tag log and leaves out of fusion.
 */
public interface EvidenceLabeler {

    List<EvidenceFragment> label(EvidenceSource source, List<TextSegment> segments);
}
