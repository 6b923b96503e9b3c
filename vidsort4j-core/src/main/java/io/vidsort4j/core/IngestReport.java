package io.vidsort4j.core;

import java.util.List;

/**
 * Outcome of ingesting a URL list.
 *
 * created  : new jobs
 * existing : URLs that already had a job (no reprocessing)
 * rejected : malformed lines, as "line N: reason"
 */
public record IngestReport(
        int created,
        int existing,
        List<String> rejected
) {
    public IngestReport {
        rejected = rejected == null ? List.of() : List.copyOf(rejected);
    }
}
