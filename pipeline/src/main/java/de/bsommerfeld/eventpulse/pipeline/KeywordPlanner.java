package de.bsommerfeld.eventpulse.pipeline;

import com.google.inject.Singleton;
import de.bsommerfeld.eventpulse.core.domain.Event;
import de.bsommerfeld.eventpulse.core.domain.SearchPlan;
import de.bsommerfeld.eventpulse.core.util.StringLists;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Derives the search plan for an event from its own metadata. Pure: no
 * network, no storage.
 *
 * <h3>Keywords</h3>
 * Tags first, then the lower-cased title words, deduplicated
 * case-insensitively (the first spelling wins) and cut to
 * {@value #MAX_KEYWORDS}. Title words shorter than
 * {@value #MIN_TITLE_WORD_LENGTH} characters are noise. When nothing is
 * left the first {@value #FALLBACK_TITLE_WORDS} title words are used as-is.
 *
 * <h3>Targets</h3>
 * Explicit subreddits win. Otherwise each tag is mapped through
 * {@link CategoryTargets}; if that yields nothing the campus fallback list
 * is searched.
 */
@Singleton
public class KeywordPlanner {

    static final int MAX_KEYWORDS = 8;
    static final int MIN_TITLE_WORD_LENGTH = 3;
    static final int FALLBACK_TITLE_WORDS = 5;

    /**
     * @return the plan, or empty if the event carries no usable keyword at
     *         all
     */
    public Optional<SearchPlan> buildPlan(Event event) {
        List<String> tags = flatten(event.tags());
        List<String> keywords = keywords(tags, event.title());
        if (keywords.isEmpty())
            return Optional.empty();

        String query = String.join(" OR ", keywords);
        return Optional.of(new SearchPlan(keywords, query, targets(event, tags)));
    }

    static List<String> keywords(List<String> tags, String title) {
        List<String> titleWords = titleWords(title);

        Map<String, String> unique = new LinkedHashMap<>();
        for (String tag : tags) {
            unique.putIfAbsent(tag.toLowerCase(Locale.ROOT), tag);
        }
        for (String word : titleWords) {
            if (word.length() >= MIN_TITLE_WORD_LENGTH)
                unique.putIfAbsent(word, word);
        }

        List<String> keywords = unique.values().stream()
                .limit(MAX_KEYWORDS)
                .collect(Collectors.toList());
        if (!keywords.isEmpty())
            return keywords;

        return titleWords.stream()
                .limit(FALLBACK_TITLE_WORDS)
                .collect(Collectors.toList());
    }

    static List<String> targets(Event event, List<String> tags) {
        List<String> explicit = dedupe(flatten(event.subreddits()));
        if (!explicit.isEmpty())
            return explicit;

        List<String> mapped = new ArrayList<>();
        for (String tag : tags) {
            mapped.addAll(CategoryTargets.forCategory(tag));
        }
        mapped = dedupe(mapped);
        return mapped.isEmpty() ? CategoryTargets.FALLBACK : mapped;
    }

    /** An element may itself hold a serialized JSON list. */
    private static List<String> flatten(List<String> values) {
        List<String> result = new ArrayList<>();
        for (String value : values) {
            result.addAll(StringLists.parse(value));
        }
        return result;
    }

    private static List<String> titleWords(String title) {
        if (title == null || title.isBlank())
            return List.of();
        return Arrays.stream(title.toLowerCase(Locale.ROOT).trim().split("\\s+"))
                .collect(Collectors.toList());
    }

    // Subreddit names are case-insensitive on Reddit
    private static List<String> dedupe(List<String> targets) {
        Map<String, String> unique = new LinkedHashMap<>();
        for (String target : targets) {
            unique.putIfAbsent(target.toLowerCase(Locale.ROOT), target);
        }
        return new ArrayList<>(unique.values());
    }
}
