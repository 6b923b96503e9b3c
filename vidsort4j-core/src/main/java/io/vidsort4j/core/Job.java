package io.vidsort4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of one URL's lifecycle record. Stores hand out fresh snapshots; a {@code Job} is never
 * mutated in place.
 *
 * <p>The claim fields ({@code lockedBy}, {@code lockUntil}) mirror the lease a worker holds while the
 * job is in flight.
 */
public record Job(

        // identity
        String url,
        Platform platform,
        Priority priority,

        // lifecycle
        JobStatus status,
        int attempts,
        Instant createdAt,
        Instant lastAttemptAt,
        Instant nextAttemptAt,
        JobError lastError,
        boolean cancelRequested,

        // claim
        String lockedBy,
        Instant lockUntil,

        // outputs
        MediaAsset media,
        SourceMetadata source,
        String duplicateOf,
        Classification result
) {
    public Job {
        Objects.requireNonNull(url, "url must not be null");
        Objects.requireNonNull(platform, "platform must not be null");
        Objects.requireNonNull(priority, "priority must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must not be negative");
        }
    }

    public static Job pending(String url, Platform platform, Priority priority, Instant now) {
        return new Job(url, platform, priority, JobStatus.PENDING, 0, now, null, now, null, false,
                null, null, null, null, null, null);
    }

    public String mediaPath() {
        return media == null ? null : media.path();
    }

    public String contentHash() {
        return media == null ? null : media.perceptualHash();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isClaimedBy(String workerId, Instant now) {
        return workerId != null
                && workerId.equals(lockedBy)
                && lockUntil != null
                && lockUntil.isAfter(now);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static final class Builder {
        private final String url;
        private final Platform platform;
        private Priority priority;
        private JobStatus status;
        private int attempts;
        private final Instant createdAt;
        private Instant lastAttemptAt;
        private Instant nextAttemptAt;
        private JobError lastError;
        private boolean cancelRequested;
        private String lockedBy;
        private Instant lockUntil;
        private MediaAsset media;
        private SourceMetadata source;
        private String duplicateOf;
        private Classification result;

        private Builder(Job job) {
            this.url = job.url;
            this.platform = job.platform;
            this.priority = job.priority;
            this.status = job.status;
            this.attempts = job.attempts;
            this.createdAt = job.createdAt;
            this.lastAttemptAt = job.lastAttemptAt;
            this.nextAttemptAt = job.nextAttemptAt;
            this.lastError = job.lastError;
            this.cancelRequested = job.cancelRequested;
            this.lockedBy = job.lockedBy;
            this.lockUntil = job.lockUntil;
            this.media = job.media;
            this.source = job.source;
            this.duplicateOf = job.duplicateOf;
            this.result = job.result;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder lastAttemptAt(Instant lastAttemptAt) {
            this.lastAttemptAt = lastAttemptAt;
            return this;
        }

        public Builder nextAttemptAt(Instant nextAttemptAt) {
            this.nextAttemptAt = nextAttemptAt;
            return this;
        }

        public Builder lastError(JobError lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder cancelRequested(boolean cancelRequested) {
            this.cancelRequested = cancelRequested;
            return this;
        }

        public Builder claim(String lockedBy, Instant lockUntil) {
            this.lockedBy = lockedBy;
            this.lockUntil = lockUntil;
            return this;
        }

        public Builder unlock() {
            return claim(null, null);
        }

        public Builder media(MediaAsset media) {
            this.media = media;
            return this;
        }

        public Builder source(SourceMetadata source) {
            this.source = source;
            return this;
        }

        public Builder duplicateOf(String duplicateOf) {
            this.duplicateOf = duplicateOf;
            return this;
        }

        public Builder result(Classification result) {
            this.result = result;
            return this;
        }

        public Job build() {
            return new Job(url, platform, priority, status, attempts, createdAt, lastAttemptAt, nextAttemptAt,
                    lastError, cancelRequested, lockedBy, lockUntil, media, source, duplicateOf, result);
        }
    }
}
