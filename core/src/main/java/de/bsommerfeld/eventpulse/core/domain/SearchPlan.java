package de.bsommerfeld.eventpulse.core.domain;

import java.util.List;

/**
 * What to search for and where, derived from a single event.
 *
 * @param keywords derived keywords in priority order
 * @param query    keywords joined with {@code OR}
 * @param targets  subreddits to search, in order
 */
public record SearchPlan(List<String> keywords, String query, List<String> targets) {

    public SearchPlan {
        keywords = List.copyOf(keywords);
        targets = List.copyOf(targets);
    }
}
