package de.bsommerfeld.eventpulse.worker;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.eventpulse.core.event.ApplicationEventBus;
import de.bsommerfeld.eventpulse.core.event.WorkerEvents.CycleCompletedEvent;
import de.bsommerfeld.eventpulse.core.event.WorkerEvents.CycleFailedEvent;
import de.bsommerfeld.eventpulse.core.event.WorkerEvents.EventProcessedEvent;
import de.bsommerfeld.eventpulse.core.event.WorkerEvents.JobAbandonedEvent;
import de.bsommerfeld.eventpulse.core.event.WorkerEvents.JobFailedEvent;
import de.bsommerfeld.eventpulse.core.event.WorkerEvents.JobProcessedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps running totals of what the worker did since startup and logs them
 * after every cycle that had work.
 */
@Singleton
public class WorkerStatistics {

    private static final Logger LOG = LoggerFactory.getLogger(WorkerStatistics.class);

    private final AtomicLong cycles = new AtomicLong();
    private final AtomicLong failedCycles = new AtomicLong();
    private final AtomicLong processedUnits = new AtomicLong();
    private final AtomicLong failedUnits = new AtomicLong();
    private final AtomicLong abandonedJobs = new AtomicLong();
    private final AtomicLong inserted = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();

    @Inject
    public WorkerStatistics(ApplicationEventBus eventBus) {
        eventBus.register(this);
    }

    @Subscribe
    public void onJobProcessed(JobProcessedEvent event) {
        processedUnits.incrementAndGet();
        inserted.addAndGet(event.inserted());
        duplicates.addAndGet(event.duplicates());
    }

    @Subscribe
    public void onEventProcessed(EventProcessedEvent event) {
        processedUnits.incrementAndGet();
        inserted.addAndGet(event.inserted());
        duplicates.addAndGet(event.duplicates());
    }

    @Subscribe
    public void onJobFailed(JobFailedEvent event) {
        failedUnits.incrementAndGet();
    }

    @Subscribe
    public void onJobAbandoned(JobAbandonedEvent event) {
        abandonedJobs.incrementAndGet();
    }

    @Subscribe
    public void onCycleFailed(CycleFailedEvent event) {
        cycles.incrementAndGet();
        failedCycles.incrementAndGet();
    }

    @Subscribe
    public void onCycleCompleted(CycleCompletedEvent event) {
        cycles.incrementAndGet();
        if (event.handled() > 0) {
            LOG.info("Totals: {}", snapshot());
        }
    }

    public Snapshot snapshot() {
        return new Snapshot(cycles.get(), failedCycles.get(), processedUnits.get(), failedUnits.get(),
                abandonedJobs.get(), inserted.get(), duplicates.get());
    }

    public record Snapshot(long cycles, long failedCycles, long processed, long failed, long abandoned,
            long inserted, long duplicates) {
    }
}
