package de.bsommerfeld.eventpulse.pipeline;

/**
 * What a single {@link EventPipeline#process} run did.
 *
 * @param eventId       processed event
 * @param outcome       how the run ended
 * @param targets       targets in the plan
 * @param failedTargets targets that could not be read
 * @param fetched       raw items fetched across all targets
 * @param dropped       malformed items that never became records
 * @param inserted      records written
 * @param duplicates    records that already existed
 */
public record PipelineResult(
        String eventId,
        Outcome outcome,
        int targets,
        int failedTargets,
        int fetched,
        int dropped,
        int inserted,
        int duplicates) {

    public enum Outcome {
        /** The plan was executed. */
        COMPLETED,
        /** Records already existed and the caller allowed the shortcut. */
        ALREADY_PROCESSED,
        /** No keyword could be derived; nothing to search for. */
        NO_KEYWORDS
    }

    static PipelineResult skipped(String eventId, Outcome outcome) {
        return new PipelineResult(eventId, outcome, 0, 0, 0, 0, 0, 0);
    }

    public boolean isSkipped() {
        return outcome != Outcome.COMPLETED;
    }
}
