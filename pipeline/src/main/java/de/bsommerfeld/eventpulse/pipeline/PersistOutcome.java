package de.bsommerfeld.eventpulse.pipeline;

import de.bsommerfeld.eventpulse.core.domain.MatchRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Tally of one {@link PersistenceGate#persist} call.
 *
 * @param inserted         records written by this call
 * @param skippedDuplicate records that already existed
 * @param failed           records that could not be written, with the reason
 */
public record PersistOutcome(int inserted, int skippedDuplicate, List<FailedRecord> failed) {

    public PersistOutcome {
        failed = List.copyOf(failed);
    }

    public static PersistOutcome empty() {
        return new PersistOutcome(0, 0, List.of());
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }

    /** Sums two outcomes, keeping failures in order. */
    public PersistOutcome plus(PersistOutcome other) {
        List<FailedRecord> allFailed = new ArrayList<>(failed);
        allFailed.addAll(other.failed);
        return new PersistOutcome(inserted + other.inserted, skippedDuplicate + other.skippedDuplicate, allFailed);
    }

    public record FailedRecord(MatchRecord record, String reason) {
    }
}
