package io.vidsort4j.fingerprint;

import io.vidsort4j.core.MediaAsset;
import io.vidsort4j.core.error.FingerprintException;

/**
 * Computes a deterministic perceptual hash for a media asset.
 */
public interface ContentFingerprinter {

    /**
     * @return 16 hex characters (64 bits)
     * @throws FingerprintException when the sampled frame is missing or unreadable
     */
    String fingerprint(MediaAsset asset) throws FingerprintException;
}
