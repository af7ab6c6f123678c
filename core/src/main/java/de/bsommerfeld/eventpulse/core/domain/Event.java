package de.bsommerfeld.eventpulse.core.domain;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of an event submission. Events are owned by the
 * submission front end; the worker only ever reads them.
 *
 * @param id          unique, immutable identifier; never blank
 * @param title       event title as entered by the organizer
 * @param description free-text description, may be {@code null}
 * @param tags        organizer tags in their original order
 * @param subreddits  explicit subreddit targets, may be empty
 * @param status      moderation status (e.g. {@code approved})
 * @param createdAt   submission time, {@code null} if unknown
 */
public record Event(
        String id,
        String title,
        String description,
        List<String> tags,
        List<String> subreddits,
        String status,
        Instant createdAt) {

    public Event {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Event id must not be blank");
        }
        tags = tags != null ? List.copyOf(tags) : List.of();
        subreddits = subreddits != null ? List.copyOf(subreddits) : List.of();
    }

    /**
     * Convenience constructor for events without description, status or
     * timestamp.
     */
    public Event(String id, String title, List<String> tags, List<String> subreddits) {
        this(id, title, null, tags, subreddits, null, null);
    }
}
