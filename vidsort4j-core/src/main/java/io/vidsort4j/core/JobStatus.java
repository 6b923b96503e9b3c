package io.vidsort4j.core;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a {@link Job}.
 *
 * <pre>
 * PENDING -> FETCHING -> DEDUP_CHECKING -> (DUPLICATE | EXTRACTING) -> FUSING -> COMPLETED
 * </pre>
 * FAILED is reachable from every non-terminal state. FETCHING, DEDUP_CHECKING and EXTRACTING may
 * fall back to PENDING when a failed attempt is rescheduled with backoff.
 */
public enum JobStatus {
    PENDING,
    FETCHING,
    DEDUP_CHECKING,
    EXTRACTING,
    FUSING,
    COMPLETED,
    DUPLICATE,
    FAILED;

    private static final Set<JobStatus> IN_FLIGHT = EnumSet.of(FETCHING, DEDUP_CHECKING, EXTRACTING, FUSING);
    private static final Set<JobStatus> TERMINAL = EnumSet.of(COMPLETED, DUPLICATE, FAILED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /**
     * True while a worker holds (or held, before a crash) the claim on the job.
     */
    public boolean isInFlight() {
        return IN_FLIGHT.contains(this);
    }

    public boolean canTransitionTo(JobStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return switch (this) {
            case PENDING -> next == FETCHING;
            case FETCHING -> next == DEDUP_CHECKING || next == PENDING;
            case DEDUP_CHECKING -> next == DUPLICATE || next == EXTRACTING || next == PENDING;
            case EXTRACTING -> next == FUSING || next == PENDING;
            case FUSING -> next == COMPLETED;
            default -> false;
        };
    }

    public static Set<JobStatus> inFlight() {
        return EnumSet.copyOf(IN_FLIGHT);
    }

    public static Set<JobStatus> terminal() {
        return EnumSet.copyOf(TERMINAL);
    }
}
