package io.vidsort4j.core;

/**
 * What an {@link EvidenceFragment#text()} carries.
 */
public enum FragmentKind {
    /**
     * Free-form extracted content (transcript, recognized text, frame description).
     */
    TEXT,
    /**
     * A category label hint.
     */
    CATEGORY,
    /**
     * A tag label hint.
     */
    TAG
}
