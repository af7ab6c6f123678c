package de.bsommerfeld.eventpulse.reddit;

import java.time.Instant;

/**
 * A single comment.
 *
 * @param id        bare base36 id (without the {@code t1_} prefix)
 * @param body      comment text
 * @param author    author name, {@code null} if deleted
 * @param createdAt creation time, {@code null} if not reported
 * @param linkId    fullname of the owning post ({@code t3_...})
 */
public record RedditComment(
        String id,
        String body,
        String author,
        Instant createdAt,
        String linkId) {
}
