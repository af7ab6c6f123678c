package de.bsommerfeld.eventpulse.pipeline.schedule;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.eventpulse.core.event.ApplicationEventBus;
import de.bsommerfeld.eventpulse.core.event.WorkerEvents.CycleFailedEvent;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PollingWorkerTest {

    private static final JitteredInterval FAST = new JitteredInterval(Duration.ofMillis(10), Duration.ZERO);

    /** Fails on the first cycle, succeeds afterwards. */
    private static final class FlakyWorker extends PollingWorker {

        private final AtomicInteger cycles = new AtomicInteger();
        private final CountDownLatch threeCycles = new CountDownLatch(3);

        FlakyWorker(ApplicationEventBus eventBus) {
            super("flaky", FAST, eventBus);
        }

        @Override
        public void runCycle() {
            int cycle = cycles.incrementAndGet();
            threeCycles.countDown();
            if (cycle == 1)
                throw new IllegalStateException("storage unreachable");
        }
    }

    @Test
    void start_shouldKeepCyclingAfterAFailedCycle() throws InterruptedException {
        var eventBus = new ApplicationEventBus();
        List<CycleFailedEvent> failures = new CopyOnWriteArrayList<>();
        eventBus.register(new Object() {
            @Subscribe
            public void onFailure(CycleFailedEvent event) {
                failures.add(event);
            }
        });
        var worker = new FlakyWorker(eventBus);

        worker.start();
        try {
            assertTrue(worker.threeCycles.await(5, TimeUnit.SECONDS), "loop stopped after failure");
        } finally {
            worker.stop(Duration.ofSeconds(5));
        }

        assertEquals(1, failures.size());
        assertEquals("flaky", failures.get(0).scheduler());
        assertTrue(failures.get(0).reason().contains("storage unreachable"));
    }

    @Test
    void stop_shouldPreventFurtherCycles() throws InterruptedException {
        var worker = new FlakyWorker(new ApplicationEventBus());

        worker.start();
        assertTrue(worker.threeCycles.await(5, TimeUnit.SECONDS));
        worker.stop(Duration.ofSeconds(5));
        int afterStop = worker.cycles.get();
        Thread.sleep(100);

        assertFalse(worker.isRunning());
        assertEquals(afterStop, worker.cycles.get());
    }
}
