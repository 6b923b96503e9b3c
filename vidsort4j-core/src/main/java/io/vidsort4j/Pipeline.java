package io.vidsort4j;

import io.vidsort4j.core.Classification;
import io.vidsort4j.core.IngestReport;
import io.vidsort4j.core.IngestResult;
import io.vidsort4j.core.Job;
import io.vidsort4j.core.JobStatus;
import io.vidsort4j.core.Priority;

import java.io.IOException;
import java.io.Reader;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Main ingestion and classification API.
 *
 * <p>Jobs are keyed by URL. Ingesting a URL that already has a job never creates a second one and never
 * re-triggers processing. Every job ends in exactly one of COMPLETED, DUPLICATE or FAILED (cancellation is
 * FAILED with reason "cancelled").
 */
public interface Pipeline {

    /**
     * Start polling and processing due jobs. Idempotent.
     */
    void start();

    /**
     * Stop polling; in-flight jobs are given the claim lifetime to finish. Idempotent.
     */
    void stop();

    IngestResult ingest(String url);

    IngestResult ingest(String url, Priority priority);

    /**
     * Ingest a URL list: one URL per line, blank lines and {@code #} comments ignored, optional trailing
     * priority token.
     */
    IngestReport ingestAll(Reader lines) throws IOException;

    /**
     * Request cancellation. An unclaimed pending job fails immediately; a claimed job fails at its next
     * stage boundary.
     *
     * @return false when the URL is unknown or already terminal
     */
    boolean cancel(String url);

    Optional<Job> job(String url);

    Optional<Classification> result(String url);

    Map<JobStatus, Long> summary();

    /**
     * All terminal jobs with their outcomes.
     */
    List<Job> export();

    /**
     * Claim and run due jobs on the calling thread until none are due.
     *
     * @return number of job attempts processed
     */
    int processDueJobs();

    /**
     * Wait until every job is terminal.
     *
     * @return false on timeout
     */
    boolean awaitIdle(Duration timeout) throws InterruptedException;
}
