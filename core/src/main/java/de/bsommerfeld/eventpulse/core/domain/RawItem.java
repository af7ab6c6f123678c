package de.bsommerfeld.eventpulse.core.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A post or comment as fetched from Reddit, before normalization.
 *
 * @param kind         post or comment
 * @param sourceTarget subreddit the item was found through
 * @param externalId   bare Reddit id without kind prefix
 * @param title        post title, {@code null} for comments
 * @param body         self text or comment text
 * @param author       author name, {@code null} if deleted
 * @param createdAt    reported creation time, {@code null} if absent
 * @param extra        source-specific payload carried into the record
 * @param parentPostId for comments, the id of the post they belong to
 */
public record RawItem(
        MatchKind kind,
        String sourceTarget,
        String externalId,
        String title,
        String body,
        String author,
        Instant createdAt,
        Map<String, Object> extra,
        String parentPostId) {

    public RawItem {
        // LinkedHashMap instead of Map.copyOf: payload values may be null
        extra = extra != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(extra))
                : Collections.emptyMap();
    }
}
