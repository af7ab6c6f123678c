package de.bsommerfeld.eventpulse.pipeline.schedule;

import com.google.inject.Singleton;
import de.bsommerfeld.eventpulse.core.config.WorkerConfig;
import de.bsommerfeld.eventpulse.core.domain.Event;
import de.bsommerfeld.eventpulse.core.domain.Job;
import de.bsommerfeld.eventpulse.core.event.ApplicationEventBus;
import de.bsommerfeld.eventpulse.core.event.WorkerEvents.CycleCompletedEvent;
import de.bsommerfeld.eventpulse.core.event.WorkerEvents.JobAbandonedEvent;
import de.bsommerfeld.eventpulse.core.event.WorkerEvents.JobFailedEvent;
import de.bsommerfeld.eventpulse.core.event.WorkerEvents.JobProcessedEvent;
import de.bsommerfeld.eventpulse.db.EventRepository;
import de.bsommerfeld.eventpulse.db.JobRepository;
import de.bsommerfeld.eventpulse.db.StorageException;
import de.bsommerfeld.eventpulse.pipeline.EventPipeline;
import de.bsommerfeld.eventpulse.pipeline.PipelineResult;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Works off the {@code event_jobs} queue.
 *
 * <h3>Job lifecycle</h3>
 * <pre>
 * PENDING ── claim ──▶ CLAIMED ──▶ PROCESSED
 *                          ├──▶ ERRORED   (claimable again)
 *                          └──▶ ABANDONED (attempts exhausted)
 * </pre>
 * Every claim consumes an attempt through a compare-and-set, so a job that
 * keeps failing is claimed at most {@code maxAttempts} times for real work.
 * The claim after that pushes it past the ceiling and it is abandoned without
 * running the pipeline.
 *
 * <p>
 * The "already has matches" shortcut is only taken on the first attempt. A
 * retry means an earlier run stopped half way, so the whole event is run
 * again and per-record uniqueness absorbs the overlap.
 */
@Singleton
public class JobScheduler extends PollingWorker {

    private static final Logger LOG = LoggerFactory.getLogger(JobScheduler.class);

    static final String NAME = "jobs";

    private final JobRepository jobs;
    private final EventRepository events;
    private final EventPipeline pipeline;
    private final ApplicationEventBus eventBus;
    private final Clock clock;
    private final int batchSize;
    private final int maxAttempts;

    @Inject
    public JobScheduler(JobRepository jobs, EventRepository events, EventPipeline pipeline,
            ApplicationEventBus eventBus, Clock clock, WorkerConfig config) {
        this(jobs, events, pipeline, eventBus, clock, config.getJobBatchSize(), config.getMaxAttempts(),
                new JitteredInterval(config.getPollInterval(), config.getJitterCap()));
    }

    JobScheduler(JobRepository jobs, EventRepository events, EventPipeline pipeline, ApplicationEventBus eventBus,
            Clock clock, int batchSize, int maxAttempts, JitteredInterval interval) {
        super(NAME, interval, eventBus);
        this.jobs = jobs;
        this.events = events;
        this.pipeline = pipeline;
        this.eventBus = eventBus;
        this.clock = clock;
        this.batchSize = batchSize;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Claims and handles one batch. A storage failure while listing jobs
     * propagates to the loop; everything after that is contained per job.
     */
    @Override
    public void runCycle() {
        Instant start = clock.instant();
        List<Job> batch = jobs.findClaimable(maxAttempts, batchSize);
        if (batch.isEmpty()) {
            LOG.debug("No claimable jobs");
        }

        int handled = 0;
        int succeeded = 0;
        int failed = 0;
        for (Job candidate : batch) {
            Job claimed;
            try {
                claimed = jobs.tryClaim(candidate, clock.instant());
            } catch (StorageException e) {
                LOG.warn("Could not claim job {}: {}", candidate.id(), e.getMessage());
                continue;
            }
            if (claimed == null)
                continue;

            handled++;
            if (handle(claimed))
                succeeded++;
            else
                failed++;
        }

        Duration took = Duration.between(start, clock.instant());
        if (handled > 0) {
            LOG.info("Job cycle: {} handled, {} succeeded, {} failed in {} ms", handled, succeeded, failed,
                    took.toMillis());
        }
        eventBus.post(new CycleCompletedEvent(NAME, handled, succeeded, failed, took));
    }

    /**
     * Handles a job that this worker has already claimed.
     *
     * @return whether the job ended up PROCESSED
     */
    boolean handle(Job job) {
        if (job.attempts() > maxAttempts) {
            String reason = "Exceeded " + maxAttempts + " attempts";
            LOG.warn("Abandoning job {} for event {}: {}", job.id(), job.eventId(), reason);
            recordFailure(job, reason, true);
            eventBus.post(new JobAbandonedEvent(job.id(), job.eventId(), job.attempts()));
            return false;
        }

        try {
            Optional<Event> event = events.findById(job.eventId());
            if (event.isEmpty()) {
                String reason = "Event " + job.eventId() + " not found";
                LOG.error("Job {} failed on attempt {}: {}", job.id(), job.attempts(), reason);
                recordFailure(job, reason, false);
                eventBus.post(new JobFailedEvent(job.id(), job.eventId(), job.attempts(), reason));
                return false;
            }

            PipelineResult result = pipeline.process(event.get(), job.attempts() <= 1);
            jobs.markProcessed(job, clock.instant());
            eventBus.post(new JobProcessedEvent(job.id(), job.eventId(), result.inserted(), result.duplicates()));
            return true;
        } catch (Exception e) {
            String reason = summarize(e);
            LOG.error("Job {} failed on attempt {}/{}", job.id(), job.attempts(), maxAttempts, e);
            recordFailure(job, reason, false);
            eventBus.post(new JobFailedEvent(job.id(), job.eventId(), job.attempts(), reason));
            return false;
        }
    }

    private void recordFailure(Job job, String reason, boolean abandon) {
        try {
            if (abandon)
                jobs.markAbandoned(job, reason);
            else
                jobs.markErrored(job, reason);
        } catch (StorageException e) {
            // The consumed attempt stays recorded, so the job is retried later
            LOG.error("Could not record failure of job {}", job.id(), e);
        }
    }

    static String summarize(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank()
                ? e.getClass().getSimpleName()
                : e.getClass().getSimpleName() + ": " + message;
    }
}
