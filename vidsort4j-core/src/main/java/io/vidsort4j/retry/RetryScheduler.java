package io.vidsort4j.retry;

import io.vidsort4j.core.ErrorKind;
import io.vidsort4j.core.Job;
import io.vidsort4j.core.JobError;

import java.time.Duration;
import java.util.Objects;

/**
 * Decides whether a failed attempt is retried and after how long.
 *
 * <p>Terminal when:
 * <ul>
 *   <li>the error kind is not retryable (auth required, not found, removed, unsupported, cancelled)</li>
 *   <li>a fingerprint failure follows a fingerprint failure on the previous attempt</li>
 *   <li>the job already used {@code maxAttempts} attempts</li>
 * </ul>
 * Otherwise the delay is {@code base * 2^attempts}, capped at {@code maxDelay}.
 */
public class RetryScheduler {

    private final RetryPolicy policy;

    public RetryScheduler(RetryPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    public RetryPolicy policy() {
        return policy;
    }

    public RetryDecision decide(Job job, JobError error) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(error, "error must not be null");

        ErrorKind kind = error.kind();
        if (!kind.retryable()) {
            return RetryDecision.terminal(kind + " is not retryable");
        }
        if (kind == ErrorKind.FINGERPRINT && job.lastError() != null && job.lastError().kind() == ErrorKind.FINGERPRINT) {
            return RetryDecision.terminal("repeated fingerprint failure");
        }
        int maxAttempts = policy.maxAttempts();
        if (maxAttempts > 0 && job.attempts() >= maxAttempts) {
            return RetryDecision.terminal("attempts exhausted (" + job.attempts() + "/" + maxAttempts + ")");
        }
        return RetryDecision.retryAfter(delayFor(job.attempts()));
    }

    /**
     * Default: 20s, 40s, 80s... for attempts 1, 2, 3, capped at 10 minutes.
     */
    public Duration delayFor(int attempts) {
        int exp = Math.max(0, Math.min(attempts, 30)); // avoid overflow
        long baseMs = policy.baseDelay().toMillis();
        long maxMs = policy.maxDelay().toMillis();
        if (baseMs > (maxMs >> exp)) {
            return policy.maxDelay();
        }
        return Duration.ofMillis(Math.min(baseMs << exp, maxMs));
    }
}
