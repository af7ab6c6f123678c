package de.bsommerfeld.eventpulse.pipeline;

import com.google.inject.Singleton;
import de.bsommerfeld.eventpulse.core.domain.MatchRecord;
import de.bsommerfeld.eventpulse.core.result.CallResult;
import de.bsommerfeld.eventpulse.core.result.CallStatus;
import de.bsommerfeld.eventpulse.db.MatchRecordRepository;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes match records at most once per {@code (event_id, external_id)}.
 *
 * <p>
 * There is no locking here. Two workers may race on the same record; the
 * storage uniqueness constraint lets exactly one insert through and the other
 * sees {@link CallStatus#DUPLICATE}, which is counted and otherwise ignored.
 */
@Singleton
public class PersistenceGate {

    private static final Logger LOG = LoggerFactory.getLogger(PersistenceGate.class);

    private final MatchRecordRepository records;

    @Inject
    public PersistenceGate(MatchRecordRepository records) {
        this.records = records;
    }

    /**
     * True once any record exists for the event. Only a shortcut to save
     * fetches; correctness never depends on it.
     */
    public boolean alreadyProcessed(String eventId) {
        return records.existsForEvent(eventId);
    }

    public PersistOutcome persist(List<MatchRecord> batch) {
        int inserted = 0;
        int duplicates = 0;
        List<PersistOutcome.FailedRecord> failed = new ArrayList<>();

        for (MatchRecord record : batch) {
            CallResult<Integer> result;
            try {
                result = records.insert(record);
            } catch (RuntimeException e) {
                LOG.warn("Insert of {} for event {} threw: {}", record.externalId(), record.eventId(), e.getMessage());
                failed.add(new PersistOutcome.FailedRecord(record, e.getClass().getSimpleName() + ": " + e.getMessage()));
                continue;
            }

            switch (result.status()) {
                case OK:
                    inserted++;
                    break;
                case DUPLICATE:
                    duplicates++;
                    LOG.debug("Skipping duplicate {} for event {}", record.externalId(), record.eventId());
                    break;
                default:
                    LOG.warn("Insert of {} for event {} failed ({}): {}",
                            record.externalId(), record.eventId(), result.status(), result.detail());
                    failed.add(new PersistOutcome.FailedRecord(record, result.status() + ": " + result.detail()));
                    break;
            }
        }
        return new PersistOutcome(inserted, duplicates, failed);
    }
}
