package de.bsommerfeld.eventpulse.pipeline;

/**
 * An event finished only partially: some records could not be persisted or
 * some targets failed transiently. Records that did make it are kept; a retry
 * re-runs the event and relies on uniqueness to skip them.
 */
public class RetryableProcessingException extends RuntimeException {

    private final int failedRecords;
    private final int transientTargets;

    public RetryableProcessingException(String message, int failedRecords) {
        this(message, failedRecords, 0);
    }

    public RetryableProcessingException(String message, int failedRecords, int transientTargets) {
        super(message);
        this.failedRecords = failedRecords;
        this.transientTargets = transientTargets;
    }

    public int getFailedRecords() {
        return failedRecords;
    }

    public int getTransientTargets() {
        return transientTargets;
    }
}
