package io.vidsort4j.extract;

import io.vidsort4j.core.EvidenceFragment;
import io.vidsort4j.core.EvidenceSource;
import io.vidsort4j.core.MediaAsset;
import io.vidsort4j.core.error.ExtractionException;

import java.util.List;

/**
 * One evidence-producing step over a downloaded media asset.
 *
 * <p>Extractors are independent of each other and may run concurrently for the same asset; their
 * fragments are combined by fusion regardless of arrival order.
 */
public interface SignalExtractor {

    EvidenceSource source();

    /**
     * Whether silence from this extractor alone requires review of the result.
     */
    default boolean required() {
        return true;
    }

    /**
     * @return raw text fragments followed by label hints; empty when the media simply carries no signal
     * @throws ExtractionException on unrecoverable input (no audio track, unreadable frames) or a failed backend
     */
    List<EvidenceFragment> extract(MediaAsset asset) throws ExtractionException;
}
