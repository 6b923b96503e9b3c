package io.vidsort4j.store;

import io.vidsort4j.core.EvidenceSource;

import java.time.Instant;

/**
 * A hint label outside the known vocabulary, kept for later vocabulary curation.
 */
public record ProposedTag(String label, EvidenceSource source, double confidence, String jobUrl, Instant at) {
}
