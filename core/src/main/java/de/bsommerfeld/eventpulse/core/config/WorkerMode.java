package de.bsommerfeld.eventpulse.core.config;

/**
 * How the worker discovers pending work.
 */
public enum WorkerMode {

    /** Claims rows from the {@code event_jobs} table with bounded retries. */
    QUEUE,

    /**
     * Scans events created since a persisted watermark. Failed events are
     * not retried automatically.
     */
    WATERMARK
}
