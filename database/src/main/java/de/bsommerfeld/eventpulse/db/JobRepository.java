package de.bsommerfeld.eventpulse.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.eventpulse.core.domain.Job;
import de.bsommerfeld.eventpulse.core.domain.JobState;
import de.bsommerfeld.eventpulse.core.result.CallResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Access to the {@code event_jobs} queue.
 *
 * <h3>Claiming</h3>
 * Claims use an optimistic compare-and-set on {@code attempts}: the update
 * only matches while the row still carries the attempt count that was read.
 * Two workers racing for the same job therefore cannot both claim it; the
 * loser sees zero affected rows and skips the job. No locks are held between
 * statements.
 */
@Singleton
public class JobRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JobRepository.class);

    static final String TABLE = "event_jobs";
    private static final int MAX_ERROR_LENGTH = 1000;

    private final StorageGateway storage;

    @Inject
    public JobRepository(StorageGateway storage) {
        this.storage = storage;
    }

    /**
     * Unprocessed jobs with {@code attempts <= maxAttempts}, oldest first.
     * Includes jobs at the ceiling so the scheduler can move them to
     * ABANDONED on their next claim.
     */
    public List<Job> findClaimable(int maxAttempts, int limit) {
        List<Map<String, Object>> rows = storage.select(TABLE, Query.where()
                .eq("processed", false)
                .lte("attempts", maxAttempts)
                .orderBy("created_at", true)
                .limit(limit));

        List<Job> jobs = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Job job = toJob(row);
            if (job != null)
                jobs.add(job);
        }
        return jobs;
    }

    /**
     * Consumes one attempt of {@code job} if no other worker got there first.
     *
     * @return the claimed job with incremented attempts, or {@code null} if the
     *         compare-and-set lost
     * @throws StorageException if the backend rejected the update
     */
    public Job tryClaim(Job job, Instant now) {
        Job claimed = job.withClaim();
        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put("attempts", claimed.attempts());
        patch.put("state", JobState.CLAIMED.name());
        patch.put("claimed_at", now);

        int affected = requireOk("claim", job, storage.update(TABLE, patch, List.of(
                Query.Filter.eq("id", job.id()),
                Query.Filter.eq("attempts", job.attempts()))));
        if (affected == 0) {
            LOG.debug("Lost claim race for job {} at attempt {}", job.id(), job.attempts());
            return null;
        }
        return claimed;
    }

    public void markProcessed(Job job, Instant now) {
        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put("processed", true);
        patch.put("state", JobState.PROCESSED.name());
        patch.put("processed_at", now);
        patch.put("last_error", null);
        requireOk("mark processed", job, storage.update(TABLE, patch, byId(job)));
    }

    public void markErrored(Job job, String reason) {
        markFailed(job, JobState.ERRORED, reason);
    }

    public void markAbandoned(Job job, String reason) {
        markFailed(job, JobState.ABANDONED, reason);
    }

    private void markFailed(Job job, JobState state, String reason) {
        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put("state", state.name());
        patch.put("last_error", truncate(reason));
        requireOk("mark " + state.name().toLowerCase(Locale.ROOT), job, storage.update(TABLE, patch, byId(job)));
    }

    /** Inserts a new pending job. Used by TEST mode seeding and tests. */
    public CallResult<Integer> enqueue(String jobId, String eventId, Instant createdAt) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", jobId);
        row.put("event_id", eventId);
        row.put("processed", false);
        row.put("attempts", 0);
        row.put("state", JobState.PENDING.name());
        row.put("created_at", createdAt);
        return storage.insert(TABLE, row);
    }

    public Job findById(String jobId) {
        List<Map<String, Object>> rows = storage.select(TABLE, Query.where().eq("id", jobId).limit(1));
        return rows.isEmpty() ? null : toJob(rows.get(0));
    }

    private static List<Query.Filter> byId(Job job) {
        return List.of(Query.Filter.eq("id", job.id()));
    }

    private static int requireOk(String operation, Job job, CallResult<Integer> result) {
        if (!result.isOk()) {
            throw new StorageException("Failed to " + operation + " job " + job.id()
                    + " (" + result.status() + "): " + result.detail());
        }
        return result.value();
    }

    static Job toJob(Map<String, Object> row) {
        String id = Rows.string(row, "id");
        String eventId = Rows.string(row, "event_id");
        if (id == null || eventId == null) {
            LOG.warn("Skipping malformed job row: {}", row);
            return null;
        }
        return new Job(
                id,
                eventId,
                Rows.bool(row, "processed"),
                Math.max(0, Rows.integer(row, "attempts", 0)),
                Rows.string(row, "last_error"),
                parseState(Rows.string(row, "state")),
                Rows.instant(row, "created_at"));
    }

    private static JobState parseState(String value) {
        if (value == null)
            return JobState.PENDING;
        try {
            return JobState.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown job state '{}', treating as PENDING", value);
            return JobState.PENDING;
        }
    }

    private static String truncate(String reason) {
        if (reason == null || reason.length() <= MAX_ERROR_LENGTH)
            return reason;
        return reason.substring(0, MAX_ERROR_LENGTH);
    }
}
