package io.vidsort4j.store;

import io.vidsort4j.core.IngestResult;
import io.vidsort4j.core.Job;
import io.vidsort4j.core.JobPatch;
import io.vidsort4j.core.JobStatus;
import io.vidsort4j.core.Platform;
import io.vidsort4j.core.Priority;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable table of per-URL job records.
 *
 * <p>Every mutation is an atomic check-and-set keyed by URL. Writes made by a worker are guarded by its
 * claim ({@code lockedBy}) and the expected current status, so a worker whose lease expired and whose job
 * was re-claimed elsewhere cannot write stale state back.
 */
public interface JobStore {

    /**
     * Create a PENDING job for {@code url} unless one exists. Never resets an existing job.
     */
    IngestResult ingest(String url, Platform platform, Priority priority, Instant now);

    Optional<Job> find(String url);

    /**
     * Atomically claims at most {@code batchSize} jobs.
     *
     * <p>A job is claimable when:
     * <ul>
     *   <li>it is PENDING, not cancelled, and {@code nextAttemptAt <= now}; or</li>
     *   <li>it is in flight but its lease expired ({@code lockUntil <= now}), i.e. its worker died</li>
     * </ul>
     * Claiming sets status FETCHING, increments {@code attempts}, stamps {@code lastAttemptAt} and takes
     * the lease. URGENT jobs are claimed first, then the longest-waiting.
     *
     * <p>With {@code maxAttempts > 0}, an in-flight job whose lease expired after it already used
     * {@code maxAttempts} attempts is not claimed; it is failed with {@link io.vidsort4j.core.ErrorKind#INTERNAL}
     * instead. {@code maxAttempts <= 0} reclaims without limit.
     */
    List<Job> claimDue(Instant now, int batchSize, Duration claimLifetime, String workerId, int maxAttempts);

    default List<Job> claimDue(Instant now, int batchSize, Duration claimLifetime, String workerId) {
        return claimDue(now, batchSize, claimLifetime, workerId, 0);
    }

    /**
     * Compare-and-set transition {@code from -> to} for a job claimed by {@code workerId}.
     *
     * <p>Moving to PENDING or a terminal status releases the claim.
     *
     * @return false when the job is not in {@code from}, not held by {@code workerId}, or the transition
     * is not allowed
     */
    boolean advance(String url, String workerId, JobStatus from, JobStatus to, JobPatch patch, Instant now);

    /**
     * Flag the job for cancellation. An unclaimed PENDING job is failed right away with reason "cancelled".
     *
     * @return false when the job does not exist or is already terminal
     */
    boolean requestCancel(String url, Instant now);

    boolean isCancelRequested(String url);

    /**
     * Jobs with status PENDING, FETCHING or EXTRACTING whose backoff has elapsed, for resume after restart.
     */
    List<Job> findResumable(Instant now);

    List<Job> findByStatus(JobStatus status);

    Map<JobStatus, Long> countByStatus();

    default long countIncomplete() {
        return countByStatus().entrySet().stream()
                .filter(e -> !e.getKey().isTerminal())
                .mapToLong(Map.Entry::getValue)
                .sum();
    }
}
