package de.bsommerfeld.eventpulse.worker;

import com.google.inject.AbstractModule;
import com.google.inject.Provider;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.eventpulse.core.config.ApplicationMode;
import de.bsommerfeld.eventpulse.core.config.WorkerConfig;
import de.bsommerfeld.eventpulse.db.InMemoryStorageGateway;
import de.bsommerfeld.eventpulse.db.RestStorageGateway;
import de.bsommerfeld.eventpulse.db.SqlStorageGateway;
import de.bsommerfeld.eventpulse.db.StorageGateway;
import de.bsommerfeld.eventpulse.pipeline.schedule.JobScheduler;
import de.bsommerfeld.eventpulse.pipeline.schedule.PollingWorker;
import de.bsommerfeld.eventpulse.pipeline.schedule.WatermarkScheduler;
import de.bsommerfeld.eventpulse.pipeline.sentiment.LexiconSentimentScorer;
import de.bsommerfeld.eventpulse.pipeline.sentiment.SentimentScorer;
import de.bsommerfeld.eventpulse.reddit.OfflineSocialClient;
import de.bsommerfeld.eventpulse.reddit.RedditApiClient;
import de.bsommerfeld.eventpulse.reddit.SocialClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Locale;

/**
 * Guice module wiring the worker. The configuration is resolved before the
 * injector is built so that configuration errors surface as a plain
 * {@link de.bsommerfeld.eventpulse.core.config.ConfigurationException}.
 */
public class WorkerModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(WorkerModule.class);

    private final WorkerConfig config;

    public WorkerModule(WorkerConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(WorkerConfig.class).toInstance(config);
        bind(Clock.class).toInstance(Clock.systemUTC());
        bind(SentimentScorer.class).to(LexiconSentimentScorer.class);

        // --- MODE SWITCHING (PROD vs TEST) ---
        ApplicationMode mode = config.getApplicationMode();
        LOG.info("Application Mode initialized: {}", mode);

        if (mode.isTest()) {
            // TEST MODE: offline Reddit, nothing leaves the process
            bind(SocialClient.class).to(OfflineSocialClient.class);
        } else {
            bind(SocialClient.class).to(RedditApiClient.class);
        }
    }

    @Provides
    @Singleton
    StorageGateway storageGateway() {
        StorageGateway storage = createStorage(config);
        LOG.info("Storage backend: {}", storage.describe());
        return storage;
    }

    @Provides
    @Singleton
    PollingWorker pollingWorker(Provider<JobScheduler> jobScheduler, Provider<WatermarkScheduler> watermarkScheduler) {
        switch (config.getWorkerMode()) {
            case WATERMARK:
                return watermarkScheduler.get();
            case QUEUE:
            default:
                return jobScheduler.get();
        }
    }

    /**
     * TEST mode always stays in memory. Otherwise the URL scheme picks the
     * adapter: {@code jdbc:} for SQL databases, {@code http(s)://} for a
     * PostgREST endpoint.
     */
    static StorageGateway createStorage(WorkerConfig config) {
        if (config.getApplicationMode().isTest()) {
            LOG.warn("#######################################################");
            LOG.warn("#  TEST MODE ENABLED: storage is IN-MEMORY            #");
            LOG.warn("#  Nothing will be persisted across restarts          #");
            LOG.warn("#######################################################");
            return new InMemoryStorageGateway();
        }

        String url = config.getStorageUrl();
        if (url.toLowerCase(Locale.ROOT).startsWith("jdbc:")) {
            return new SqlStorageGateway(url, config.getStorageUser(), config.getStorageKey(),
                    config.getRequestTimeout());
        }
        return new RestStorageGateway(url, config.getStorageKey(), config.getRequestTimeout());
    }
}
