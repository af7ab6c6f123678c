package de.bsommerfeld.eventpulse.core.event;

import java.time.Duration;

/**
 * Notifications published by the schedulers. Consumers only observe; the
 * scheduler never waits for them.
 */
public class WorkerEvents {

    /** A job completed its pipeline run and is marked processed. */
    public record JobProcessedEvent(String jobId, String eventId, int inserted, int duplicates) {
    }

    /** A job failed and stays claimable until it runs out of attempts. */
    public record JobFailedEvent(String jobId, String eventId, int attempts, String reason) {
    }

    /** A job exceeded the attempt ceiling and will never be retried. */
    public record JobAbandonedEvent(String jobId, String eventId, int attempts) {
    }

    /** An event was processed outside the job queue (watermark mode). */
    public record EventProcessedEvent(String eventId, int inserted, int duplicates, boolean skipped) {
    }

    /**
     * Summary of one scheduler cycle.
     *
     * @param handled   number of jobs or events looked at
     * @param succeeded completed (or legitimately skipped) units
     * @param failed    units that ended in an error
     * @param duration  wall-clock time of the cycle
     */
    public record CycleCompletedEvent(String scheduler, int handled, int succeeded, int failed,
            Duration duration) {
    }

    /** The cycle itself broke (e.g. storage unreachable while claiming). */
    public record CycleFailedEvent(String scheduler, String reason) {
    }
}
