package de.bsommerfeld.eventpulse.core.domain;

import java.time.Instant;

/**
 * A unit of pending work linking an {@link Event} to processing attempts.
 * Jobs are created externally and never deleted by the worker.
 *
 * @param id        job identifier
 * @param eventId   referenced event
 * @param processed {@code true} once the pipeline completed for this job
 * @param attempts  number of claims so far, never decreases
 * @param lastError reason of the most recent failure, {@code null} if none
 * @param state     last recorded lifecycle state
 * @param createdAt creation time, drives oldest-first claiming
 */
public record Job(
        String id,
        String eventId,
        boolean processed,
        int attempts,
        String lastError,
        JobState state,
        Instant createdAt) {

    public Job {
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be >= 0, was " + attempts);
        }
        state = state != null ? state : JobState.PENDING;
    }

    /** Returns a copy reflecting one more consumed attempt. */
    public Job withClaim() {
        return new Job(id, eventId, processed, attempts + 1, lastError, JobState.CLAIMED, createdAt);
    }
}
