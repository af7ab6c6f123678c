package de.bsommerfeld.eventpulse.pipeline;

import com.google.inject.Singleton;
import de.bsommerfeld.eventpulse.core.domain.MatchKind;
import de.bsommerfeld.eventpulse.core.domain.MatchRecord;
import de.bsommerfeld.eventpulse.core.domain.RawItem;
import de.bsommerfeld.eventpulse.pipeline.sentiment.SentimentScorer;
import jakarta.inject.Inject;

import java.time.Clock;
import java.time.Instant;

/**
 * Turns a fetched {@link RawItem} into the {@link MatchRecord} that gets
 * stored, scoring its sentiment on the way.
 */
@Singleton
public class RowTransformer {

    private final SentimentScorer scorer;
    private final Clock clock;

    @Inject
    public RowTransformer(SentimentScorer scorer, Clock clock) {
        this.scorer = scorer;
        this.clock = clock;
    }

    /**
     * @param sourceTarget the target the item was requested through; the
     *                     item's own source is used when this is blank
     * @throws ItemTransformException if the item has no id
     */
    public MatchRecord toRecord(String eventId, RawItem item, String sourceTarget) {
        if (item.externalId() == null || item.externalId().isBlank()) {
            throw new ItemTransformException("Dropping " + item.kind().value() + " without id for event " + eventId);
        }

        String title = item.kind() == MatchKind.POST ? item.title() : null;
        String body = item.kind() == MatchKind.POST ? blankToNull(item.body()) : item.body();
        String scored = item.kind() == MatchKind.POST
                ? orEmpty(title) + " " + orEmpty(body)
                : orEmpty(body);

        Instant observedAt = item.createdAt() != null ? item.createdAt() : clock.instant();
        String source = sourceTarget != null && !sourceTarget.isBlank() ? sourceTarget : item.sourceTarget();

        return new MatchRecord(
                eventId,
                item.kind().prefix() + item.externalId(),
                source,
                item.kind(),
                title,
                body,
                item.author(),
                scorer.score(scored),
                observedAt,
                item.extra());
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
