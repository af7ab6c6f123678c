package de.bsommerfeld.eventpulse.pipeline;

import com.google.inject.Singleton;
import de.bsommerfeld.eventpulse.core.config.WorkerConfig;
import de.bsommerfeld.eventpulse.core.domain.Event;
import de.bsommerfeld.eventpulse.core.domain.MatchRecord;
import de.bsommerfeld.eventpulse.core.domain.RawItem;
import de.bsommerfeld.eventpulse.core.domain.SearchPlan;
import de.bsommerfeld.eventpulse.core.result.CallStatus;
import de.bsommerfeld.eventpulse.reddit.MatchFetcher;
import de.bsommerfeld.eventpulse.reddit.TargetFetch;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs one event end to end: plan, fetch per target, transform, persist.
 *
 * <p>
 * Target and item problems are contained: a target that does not exist or
 * is forbidden is logged and skipped, a malformed item is dropped. Records
 * are persisted per target so the work of healthy targets survives a later
 * failure. Persistence failures and targets that failed with
 * {@link CallStatus#TRANSIENT_ERROR} escape as a
 * {@link RetryableProcessingException}, raised after every target was
 * attempted.
 */
@Singleton
public class EventPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(EventPipeline.class);

    private final KeywordPlanner planner;
    private final MatchFetcher fetcher;
    private final RowTransformer transformer;
    private final PersistenceGate gate;
    private final int maxPosts;
    private final int maxComments;

    @Inject
    public EventPipeline(KeywordPlanner planner, MatchFetcher fetcher, RowTransformer transformer,
            PersistenceGate gate, WorkerConfig config) {
        this(planner, fetcher, transformer, gate, config.getMaxPostsPerTarget(), config.getMaxCommentsPerPost());
    }

    public EventPipeline(KeywordPlanner planner, MatchFetcher fetcher, RowTransformer transformer,
            PersistenceGate gate, int maxPosts, int maxComments) {
        this.planner = planner;
        this.fetcher = fetcher;
        this.transformer = transformer;
        this.gate = gate;
        this.maxPosts = maxPosts;
        this.maxComments = maxComments;
    }

    /**
     * @param allowShortCircuit skip the event entirely when records for it
     *                          already exist
     * @throws RetryableProcessingException if any record failed to persist or
     *                                      any target failed transiently
     */
    public PipelineResult process(Event event, boolean allowShortCircuit) {
        if (allowShortCircuit && gate.alreadyProcessed(event.id())) {
            LOG.debug("Event {} already has matches, skipping", event.id());
            return PipelineResult.skipped(event.id(), PipelineResult.Outcome.ALREADY_PROCESSED);
        }

        Optional<SearchPlan> maybePlan = planner.buildPlan(event);
        if (maybePlan.isEmpty()) {
            LOG.info("Event {} ('{}') has no usable keywords, skipping", event.id(), event.title());
            return PipelineResult.skipped(event.id(), PipelineResult.Outcome.NO_KEYWORDS);
        }
        SearchPlan plan = maybePlan.get();
        LOG.debug("Event {} plan: query='{}' targets={}", event.id(), plan.query(), plan.targets());

        int failedTargets = 0;
        List<String> transientTargets = new ArrayList<>();
        int fetched = 0;
        int dropped = 0;
        PersistOutcome outcome = PersistOutcome.empty();

        for (String target : plan.targets()) {
            TargetFetch fetch = fetcher.fetch(target, plan.query(), maxPosts, maxComments);
            if (!fetch.isOk()) {
                failedTargets++;
                if (fetch.status() == CallStatus.TRANSIENT_ERROR)
                    transientTargets.add(target);
                LOG.debug("Event {}: r/{} unavailable ({})", event.id(), target, fetch.status());
                continue;
            }
            fetched += fetch.items().size();

            List<MatchRecord> records = new ArrayList<>(fetch.items().size());
            for (RawItem item : fetch.items()) {
                try {
                    records.add(transformer.toRecord(event.id(), item, target));
                } catch (ItemTransformException e) {
                    dropped++;
                    LOG.warn(e.getMessage());
                }
            }
            outcome = outcome.plus(gate.persist(records));
        }

        if (outcome.hasFailures()) {
            PersistOutcome.FailedRecord first = outcome.failed().get(0);
            throw new RetryableProcessingException(outcome.failed().size() + " record(s) of event " + event.id()
                    + " failed to persist, first: " + first.record().externalId() + " (" + first.reason() + ")",
                    outcome.failed().size(), transientTargets.size());
        }
        if (!transientTargets.isEmpty()) {
            throw new RetryableProcessingException("Event " + event.id() + ": " + transientTargets.size()
                    + " target(s) failed transiently " + transientTargets + ", " + outcome.inserted() + " new",
                    0, transientTargets.size());
        }

        LOG.info("Event {}: {} target(s), {} failed, {} item(s), {} new, {} duplicate(s)",
                event.id(), plan.targets().size(), failedTargets, fetched, outcome.inserted(),
                outcome.skippedDuplicate());
        return new PipelineResult(event.id(), PipelineResult.Outcome.COMPLETED, plan.targets().size(),
                failedTargets, fetched, dropped, outcome.inserted(), outcome.skippedDuplicate());
    }
}
