package de.bsommerfeld.eventpulse.core.domain;

/**
 * Lifecycle of a job row.
 *
 * <pre>
 * PENDING → CLAIMED → PROCESSED
 *                   → ERRORED   (retryable, returns to the claimable pool)
 *                   → ABANDONED (attempts exhausted, never claimed again)
 * </pre>
 */
public enum JobState {
    PENDING,
    CLAIMED,
    PROCESSED,
    ERRORED,
    ABANDONED;

    public boolean isTerminal() {
        return this == PROCESSED || this == ABANDONED;
    }
}
