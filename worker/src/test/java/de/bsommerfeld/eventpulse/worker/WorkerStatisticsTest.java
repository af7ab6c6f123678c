package de.bsommerfeld.eventpulse.worker;

import de.bsommerfeld.eventpulse.core.event.ApplicationEventBus;
import de.bsommerfeld.eventpulse.core.event.WorkerEvents.CycleCompletedEvent;
import de.bsommerfeld.eventpulse.core.event.WorkerEvents.CycleFailedEvent;
import de.bsommerfeld.eventpulse.core.event.WorkerEvents.EventProcessedEvent;
import de.bsommerfeld.eventpulse.core.event.WorkerEvents.JobAbandonedEvent;
import de.bsommerfeld.eventpulse.core.event.WorkerEvents.JobFailedEvent;
import de.bsommerfeld.eventpulse.core.event.WorkerEvents.JobProcessedEvent;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class WorkerStatisticsTest {

    @Test
    void snapshot_shouldAccumulatePostedEvents() {
        var eventBus = new ApplicationEventBus();
        var statistics = new WorkerStatistics(eventBus);

        eventBus.post(new JobProcessedEvent("j1", "E1", 3, 1));
        eventBus.post(new EventProcessedEvent("E2", 2, 0, false));
        eventBus.post(new JobFailedEvent("j2", "E3", 1, "boom"));
        eventBus.post(new JobAbandonedEvent("j3", "E4", 6));
        eventBus.post(new CycleCompletedEvent("jobs", 3, 1, 2, Duration.ofMillis(120)));
        eventBus.post(new CycleFailedEvent("jobs", "StorageException: down"));

        WorkerStatistics.Snapshot snapshot = statistics.snapshot();
        assertEquals(2, snapshot.processed());
        assertEquals(5, snapshot.inserted());
        assertEquals(1, snapshot.duplicates());
        assertEquals(1, snapshot.failed());
        assertEquals(1, snapshot.abandoned());
        assertEquals(2, snapshot.cycles());
        assertEquals(1, snapshot.failedCycles());
    }

    @Test
    void snapshot_shouldStartAtZero() {
        var snapshot = new WorkerStatistics(new ApplicationEventBus()).snapshot();

        assertEquals(new WorkerStatistics.Snapshot(0, 0, 0, 0, 0, 0, 0), snapshot);
    }
}
