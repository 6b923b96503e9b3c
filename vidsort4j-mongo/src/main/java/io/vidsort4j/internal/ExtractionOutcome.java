package io.vidsort4j.internal;

import io.vidsort4j.core.EvidenceFragment;
import io.vidsort4j.core.EvidenceSource;
import io.vidsort4j.core.error.ExtractionException;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything the extractors produced for one job.
 *
 * @param fragments    all fragments from every extractor that succeeded
 * @param expected     sources whose extractors were invoked
 * @param required     invoked sources whose silence requires review
 * @param failures     per-source failure
 * @param allTransient every invoked extractor failed and every failure was transient
 */
record ExtractionOutcome(
        List<EvidenceFragment> fragments,
        Set<EvidenceSource> expected,
        Set<EvidenceSource> required,
        Map<EvidenceSource, ExtractionException> failures,
        boolean allTransient
) {
    ExtractionOutcome {
        fragments = List.copyOf(fragments);
        expected = Set.copyOf(expected);
        required = Set.copyOf(required);
        failures = Map.copyOf(failures);
    }

    ExtractionException firstFailure() {
        return failures.values().stream().findFirst().orElse(null);
    }
}
