package io.vidsort4j.store;

import io.vidsort4j.core.IngestResult;
import io.vidsort4j.core.Job;
import io.vidsort4j.core.JobError;
import io.vidsort4j.core.JobPatch;
import io.vidsort4j.core.JobStatus;
import io.vidsort4j.core.Platform;
import io.vidsort4j.core.Priority;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link JobStore}. Per-URL atomicity comes from {@link ConcurrentHashMap#compute}.
 */
public class InMemoryJobStore implements JobStore {

    private static final Set<JobStatus> RESUMABLE = EnumSet.of(JobStatus.PENDING, JobStatus.FETCHING, JobStatus.EXTRACTING);

    // earliest-due first within a priority
    static final Comparator<Job> CLAIM_ORDER = Comparator
            .comparingInt((Job j) -> j.priority().value()).reversed()
            .thenComparing(InMemoryJobStore::dueAt)
            .thenComparing(Job::createdAt, Comparator.nullsLast(Comparator.naturalOrder()));

    private final ConcurrentHashMap<String, Job> jobs = new ConcurrentHashMap<>();

    @Override
    public IngestResult ingest(String url, Platform platform, Priority priority, Instant now) {
        requireUrl(url);
        Objects.requireNonNull(platform, "platform must not be null");
        Objects.requireNonNull(priority, "priority must not be null");
        Objects.requireNonNull(now, "now must not be null");

        Job fresh = Job.pending(url, platform, priority, now);
        Job existing = jobs.putIfAbsent(url, fresh);
        return existing == null ? IngestResult.createdResult(url) : IngestResult.existing(url, existing.status());
    }

    @Override
    public Optional<Job> find(String url) {
        return Optional.ofNullable(jobs.get(url));
    }

    @Override
    public List<Job> claimDue(Instant now, int batchSize, Duration claimLifetime, String workerId, int maxAttempts) {
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(claimLifetime, "claimLifetime must not be null");
        if (batchSize <= 0) {
            return List.of();
        }
        if (claimLifetime.isZero() || claimLifetime.isNegative()) {
            throw new IllegalArgumentException("claimLifetime must be a positive duration");
        }
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }

        failExhaustedLeases(now, maxAttempts);

        List<Job> candidates = jobs.values().stream()
                .filter(j -> isClaimable(j, now, maxAttempts))
                .sorted(CLAIM_ORDER)
                .toList();

        Instant lockUntil = now.plus(claimLifetime);
        List<Job> claimed = new ArrayList<>(Math.min(batchSize, candidates.size()));
        for (Job candidate : candidates) {
            if (claimed.size() >= batchSize) {
                break;
            }
            boolean[] won = {false};
            Job updated = jobs.computeIfPresent(candidate.url(), (url, current) -> {
                if (!isClaimable(current, now, maxAttempts)) {
                    return current;
                }
                won[0] = true;
                return current.toBuilder()
                        .status(JobStatus.FETCHING)
                        .attempts(current.attempts() + 1)
                        .lastAttemptAt(now)
                        .claim(workerId, lockUntil)
                        .build();
            });
            if (won[0] && updated != null) {
                claimed.add(updated);
            }
        }
        return claimed;
    }

    @Override
    public boolean advance(String url, String workerId, JobStatus from, JobStatus to, JobPatch patch, Instant now) {
        requireUrl(url);
        Objects.requireNonNull(workerId, "workerId must not be null");
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(now, "now must not be null");
        if (!from.canTransitionTo(to)) {
            return false;
        }
        JobPatch p = patch == null ? JobPatch.none() : patch;

        boolean[] applied = {false};
        jobs.computeIfPresent(url, (key, current) -> {
            if (current.status() != from || !workerId.equals(current.lockedBy())) {
                return current;
            }
            Job.Builder b = p.applyTo(current.toBuilder()).status(to);
            if (to == JobStatus.PENDING || to.isTerminal()) {
                b.unlock();
            }
            applied[0] = true;
            return b.build();
        });
        return applied[0];
    }

    @Override
    public boolean requestCancel(String url, Instant now) {
        requireUrl(url);
        boolean[] accepted = {false};
        jobs.computeIfPresent(url, (key, current) -> {
            if (current.isTerminal()) {
                return current;
            }
            accepted[0] = true;
            Job.Builder b = current.toBuilder().cancelRequested(true);
            boolean unclaimed = current.lockUntil() == null || !current.lockUntil().isAfter(now);
            if (current.status() == JobStatus.PENDING && unclaimed) {
                b.status(JobStatus.FAILED).lastError(JobError.cancelled(now)).unlock();
            }
            return b.build();
        });
        return accepted[0];
    }

    @Override
    public boolean isCancelRequested(String url) {
        Job job = jobs.get(url);
        return job != null && job.cancelRequested();
    }

    @Override
    public List<Job> findResumable(Instant now) {
        return jobs.values().stream()
                .filter(j -> RESUMABLE.contains(j.status()))
                .filter(j -> j.status() == JobStatus.PENDING
                        ? !dueAt(j).isAfter(now)
                        : j.lockUntil() == null || !j.lockUntil().isAfter(now))
                .sorted(CLAIM_ORDER)
                .toList();
    }

    @Override
    public List<Job> findByStatus(JobStatus status) {
        return jobs.values().stream()
                .filter(j -> j.status() == status)
                .sorted(Comparator.comparing(Job::createdAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    @Override
    public Map<JobStatus, Long> countByStatus() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus s : JobStatus.values()) {
            counts.put(s, 0L);
        }
        for (Job j : jobs.values()) {
            counts.merge(j.status(), 1L, Long::sum);
        }
        return counts;
    }

    private void failExhaustedLeases(Instant now, int maxAttempts) {
        if (maxAttempts <= 0) {
            return;
        }
        for (Job job : jobs.values()) {
            if (!isLeaseExhausted(job, now, maxAttempts)) {
                continue;
            }
            jobs.computeIfPresent(job.url(), (url, current) -> {
                if (!isLeaseExhausted(current, now, maxAttempts)) {
                    return current;
                }
                return current.toBuilder()
                        .status(JobStatus.FAILED)
                        .lastError(JobError.leaseExhausted(current.attempts(), now))
                        .unlock()
                        .build();
            });
        }
    }

    static boolean isClaimable(Job job, Instant now, int maxAttempts) {
        if (job.status() == JobStatus.PENDING) {
            return !job.cancelRequested() && !dueAt(job).isAfter(now);
        }
        return isLeaseExpired(job, now) && (maxAttempts <= 0 || job.attempts() < maxAttempts);
    }

    private static boolean isLeaseExhausted(Job job, Instant now, int maxAttempts) {
        return isLeaseExpired(job, now) && job.attempts() >= maxAttempts;
    }

    private static boolean isLeaseExpired(Job job, Instant now) {
        return job.status().isInFlight() && (job.lockUntil() == null || !job.lockUntil().isAfter(now));
    }

    private static Instant dueAt(Job job) {
        if (job.status() == JobStatus.PENDING) {
            return job.nextAttemptAt() != null ? job.nextAttemptAt() : Instant.EPOCH;
        }
        return job.lockUntil() != null ? job.lockUntil() : Instant.EPOCH;
    }

    private static void requireUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
    }
}
