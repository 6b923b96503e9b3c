package io.vidsort4j.retry;

import java.time.Duration;

/**
 * Outcome of {@link RetryScheduler#decide}.
 *
 * @param retry  whether the job goes back to PENDING
 * @param delay  backoff before the next attempt; null when terminal
 * @param reason short explanation, logged and kept for terminal decisions
 */
public record RetryDecision(boolean retry, Duration delay, String reason) {

    public static RetryDecision retryAfter(Duration delay) {
        return new RetryDecision(true, delay, "retry in " + delay);
    }

    public static RetryDecision terminal(String reason) {
        return new RetryDecision(false, null, reason);
    }

    public boolean isTerminal() {
        return !retry;
    }
}
