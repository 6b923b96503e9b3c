package io.vidsort4j.store;

import java.util.Optional;

/**
 * Index of fingerprints of every accepted (non-duplicate) job.
 *
 * <p>A candidate matches a stored entry when the Hamming distance between hashes is at most
 * {@link DedupSettings#maxHammingDistance()} and durations differ by strictly less than
 * {@link DedupSettings#durationTolerance()} seconds. Resolution is stored but never used for matching.
 * Among several matches the nearest hash wins, then the earliest insertion.
 */
public interface ArchiveIndex {

    /**
     * @return the job id of the best matching entry, if any
     */
    Optional<String> lookup(String perceptualHash, double durationSeconds, int width, int height);

    /**
     * Record a fingerprint. Re-inserting the same job id is a no-op.
     */
    void insert(String jobId, String perceptualHash, double durationSeconds, int width, int height);

    /**
     * Atomic lookup-then-insert. Returns the matching original when there is one (and does not insert);
     * otherwise inserts {@code jobId} and returns empty. An entry already stored under {@code jobId}
     * never matches itself, so a resumed job re-running this check is not marked a duplicate of itself.
     */
    Optional<String> checkAndInsert(String jobId, String perceptualHash, double durationSeconds, int width, int height);

    long size();
}
