package de.bsommerfeld.eventpulse.pipeline.schedule;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import de.bsommerfeld.eventpulse.core.event.ApplicationEventBus;
import de.bsommerfeld.eventpulse.core.event.WorkerEvents.CycleFailedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Base for the background loops. Runs {@link #runCycle()} on a single worker
 * thread and, after each cycle, schedules the next one with a jittered delay.
 *
 * <p>
 * A cycle that throws is logged and reported on the event bus; the loop keeps
 * going. {@link #stop()} lets a running cycle finish and prevents the next one.
 */
public abstract class PollingWorker {

    private static final Logger LOG = LoggerFactory.getLogger(PollingWorker.class);

    private final String name;
    private final JitteredInterval interval;
    private final ApplicationEventBus eventBus;
    private final ScheduledExecutorService executor;
    private volatile boolean running;

    protected PollingWorker(String name, JitteredInterval interval, ApplicationEventBus eventBus) {
        this.name = name;
        this.interval = interval;
        this.eventBus = eventBus;
        this.executor = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat(name + "-%d")
                .build());
    }

    /** One unit of work. Exceptions are contained by the loop. */
    public abstract void runCycle();

    public String getName() {
        return name;
    }

    public boolean isRunning() {
        return running;
    }

    /** Starts the loop; the first cycle runs immediately. */
    public synchronized void start() {
        if (running)
            return;
        running = true;
        LOG.info("Starting {} worker", name);
        executor.execute(this::guardedCycle);
    }

    /**
     * Stops scheduling new cycles and waits up to {@code timeout} for the
     * current one to finish.
     */
    public synchronized void stop(Duration timeout) {
        if (!running && executor.isShutdown())
            return;
        running = false;
        LOG.info("Stopping {} worker", name);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("{} worker did not finish its cycle within {}s, interrupting", name, timeout.toSeconds());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    void guardedCycle() {
        if (!running)
            return;
        try {
            runCycle();
        } catch (Exception e) {
            LOG.error("{} cycle failed", name, e);
            eventBus.post(new CycleFailedEvent(name, e.getClass().getSimpleName() + ": " + e.getMessage()));
        } finally {
            scheduleNext();
        }
    }

    private void scheduleNext() {
        if (!running || executor.isShutdown())
            return;
        Duration delay = interval.next();
        LOG.debug("Next {} cycle in {} ms", name, delay.toMillis());
        try {
            executor.schedule(this::guardedCycle, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.debug("{} worker shut down before the next cycle was scheduled", name);
        }
    }
}
