package de.bsommerfeld.eventpulse.pipeline.schedule;

import com.google.inject.Singleton;
import de.bsommerfeld.eventpulse.core.config.WorkerConfig;
import de.bsommerfeld.eventpulse.core.domain.Event;
import de.bsommerfeld.eventpulse.core.event.ApplicationEventBus;
import de.bsommerfeld.eventpulse.core.event.WorkerEvents.CycleCompletedEvent;
import de.bsommerfeld.eventpulse.core.event.WorkerEvents.EventProcessedEvent;
import de.bsommerfeld.eventpulse.db.EventRepository;
import de.bsommerfeld.eventpulse.db.WatermarkRepository;
import de.bsommerfeld.eventpulse.pipeline.EventPipeline;
import de.bsommerfeld.eventpulse.pipeline.PipelineResult;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Discovers events directly from {@code event_submissions} instead of a job
 * queue. Each cycle processes the events created since the stored watermark
 * and then moves the watermark to the instant the cycle started.
 *
 * <p>
 * Failed events are logged and not retried. Events created while a cycle runs
 * are newer than its start, so the next cycle still sees them. If listing
 * events fails the watermark stays where it was.
 */
@Singleton
public class WatermarkScheduler extends PollingWorker {

    private static final Logger LOG = LoggerFactory.getLogger(WatermarkScheduler.class);

    static final String NAME = "watermark";
    static final String WATERMARK_KEY = "event_discovery";

    private final EventRepository events;
    private final WatermarkRepository watermarks;
    private final EventPipeline pipeline;
    private final ApplicationEventBus eventBus;
    private final Clock clock;
    private final List<String> statuses;

    @Inject
    public WatermarkScheduler(EventRepository events, WatermarkRepository watermarks, EventPipeline pipeline,
            ApplicationEventBus eventBus, Clock clock, WorkerConfig config) {
        this(events, watermarks, pipeline, eventBus, clock, config.getEventStatuses(),
                new JitteredInterval(config.getPollInterval(), config.getJitterCap()));
    }

    WatermarkScheduler(EventRepository events, WatermarkRepository watermarks, EventPipeline pipeline,
            ApplicationEventBus eventBus, Clock clock, List<String> statuses, JitteredInterval interval) {
        super(NAME, interval, eventBus);
        this.events = events;
        this.watermarks = watermarks;
        this.pipeline = pipeline;
        this.eventBus = eventBus;
        this.clock = clock;
        this.statuses = List.copyOf(statuses);
    }

    @Override
    public void runCycle() {
        Instant cycleStart = clock.instant();
        Instant since = watermarks.read(WATERMARK_KEY).orElse(Instant.EPOCH);
        List<Event> discovered = events.findCreatedSince(since, statuses);
        LOG.debug("Discovered {} event(s) since {}", discovered.size(), since);

        int succeeded = 0;
        int failed = 0;
        for (Event event : discovered) {
            try {
                PipelineResult result = pipeline.process(event, true);
                eventBus.post(new EventProcessedEvent(event.id(), result.inserted(), result.duplicates(),
                        result.isSkipped()));
                succeeded++;
            } catch (Exception e) {
                failed++;
                LOG.error("Processing event {} failed", event.id(), e);
            }
        }

        watermarks.write(WATERMARK_KEY, cycleStart, clock.instant());

        Duration took = Duration.between(cycleStart, clock.instant());
        if (!discovered.isEmpty()) {
            LOG.info("Watermark cycle: {} event(s), {} succeeded, {} failed in {} ms; watermark now {}",
                    discovered.size(), succeeded, failed, took.toMillis(), cycleStart);
        }
        eventBus.post(new CycleCompletedEvent(NAME, discovered.size(), succeeded, failed, took));
    }
}
