package de.bsommerfeld.eventpulse.worker;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.eventpulse.core.config.ConfigurationException;
import de.bsommerfeld.eventpulse.core.config.WorkerConfig;
import de.bsommerfeld.eventpulse.pipeline.schedule.PollingWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Process entry point. Resolves the configuration, builds the injector and
 * starts the polling worker selected by {@code WORKER_MODE}. The worker
 * thread keeps the JVM alive; a shutdown hook stops it between cycles.
 */
public final class WorkerMain {

    private static final Logger LOG = LoggerFactory.getLogger(WorkerMain.class);

    static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private WorkerMain() {
    }

    public static void main(String[] args) {
        WorkerConfig config;
        try {
            config = WorkerConfig.fromEnvironment();
        } catch (ConfigurationException e) {
            LOG.error(e.getMessage());
            System.exit(1);
            return;
        }

        LOG.info("Starting {}: {}", WorkerConfig.APP_NAME, config);
        Injector injector = bootstrap(config);
        PollingWorker worker = injector.getInstance(PollingWorker.class);
        WorkerStatistics statistics = injector.getInstance(WorkerStatistics.class);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutdown requested");
            worker.stop(SHUTDOWN_GRACE);
            LOG.info("Stopped. Totals: {}", statistics.snapshot());
        }, "shutdown"));

        worker.start();
    }

    /**
     * Builds the injector, registers the statistics listener and, in TEST
     * mode, seeds demo data.
     */
    static Injector bootstrap(WorkerConfig config) {
        Injector injector = Guice.createInjector(new WorkerModule(config));
        injector.getInstance(WorkerStatistics.class);
        if (config.getApplicationMode().isTest()) {
            injector.getInstance(DemoData.class).seed();
        }
        return injector;
    }
}
