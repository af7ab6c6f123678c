package de.bsommerfeld.eventpulse.core.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalized, stored match between an event and a Reddit post or comment.
 * {@code (eventId, externalId)} is the idempotency key: the storage layer
 * rejects a second row with the same pair.
 *
 * @param eventId    owning event
 * @param externalId kind-prefixed Reddit id (e.g. {@code post_abc123})
 * @param source     subreddit the item was found through
 * @param kind       post or comment
 * @param title      post title, {@code null} for comments
 * @param body       post self text or comment text, may be {@code null}
 * @param author     Reddit username, {@code null} if deleted
 * @param sentiment  compound sentiment in {@code [-1, 1]}
 * @param observedAt item creation time, or fetch time if unknown
 * @param extra      opaque payload (permalink, url, link_id)
 */
public record MatchRecord(
        String eventId,
        String externalId,
        String source,
        MatchKind kind,
        String title,
        String body,
        String author,
        double sentiment,
        Instant observedAt,
        Map<String, Object> extra) {

    public MatchRecord {
        extra = extra != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(extra))
                : Collections.emptyMap();
    }
}
