package de.bsommerfeld.eventpulse.pipeline;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Static mapping from event categories (tags) to the subreddits where such
 * events get discussed. Lookups are case-insensitive and treat spaces and
 * dashes like underscores, so {@code "Career Fair"} finds {@code career_fair}.
 */
final class CategoryTargets {

    static final List<String> FALLBACK = List.of("college", "university", "technology", "CampusLife");

    private static final Map<String, List<String>> TABLE = Map.ofEntries(
            Map.entry("hackathon", List.of("programming", "technology")),
            Map.entry("coding", List.of("programming", "learnprogramming")),
            Map.entry("programming", List.of("programming", "learnprogramming")),
            Map.entry("ai", List.of("artificial", "MachineLearning")),
            Map.entry("machine_learning", List.of("MachineLearning", "datascience")),
            Map.entry("data_science", List.of("datascience")),
            Map.entry("robotics", List.of("robotics", "technology")),
            Map.entry("cybersecurity", List.of("cybersecurity", "netsec")),
            Map.entry("startup", List.of("startups", "Entrepreneur")),
            Map.entry("entrepreneurship", List.of("Entrepreneur", "startups")),
            Map.entry("career_fair", List.of("cscareerquestions", "jobs", "college")),
            Map.entry("career", List.of("jobs", "careerguidance")),
            Map.entry("research", List.of("GradSchool", "AskAcademia")),
            Map.entry("study", List.of("GetStudying", "college")),
            Map.entry("workshop", List.of("college", "GetStudying")),
            Map.entry("music", List.of("Music", "concerts")),
            Map.entry("concert", List.of("concerts", "Music")),
            Map.entry("sports", List.of("sports", "college")),
            Map.entry("fitness", List.of("Fitness")),
            Map.entry("gaming", List.of("gaming", "esports")),
            Map.entry("esports", List.of("esports", "gaming")),
            Map.entry("art", List.of("Art")),
            Map.entry("film", List.of("movies", "Filmmakers")),
            Map.entry("theater", List.of("theatre")),
            Map.entry("photography", List.of("photography")),
            Map.entry("design", List.of("Design")),
            Map.entry("food", List.of("food", "college")),
            Map.entry("party", List.of("college", "CampusLife")),
            Map.entry("social", List.of("CampusLife", "college")),
            Map.entry("club", List.of("college", "CampusLife")),
            Map.entry("volunteering", List.of("volunteer")),
            Map.entry("sustainability", List.of("sustainability", "environment")));

    private CategoryTargets() {
    }

    /** Subreddits for {@code category}, empty if the category is unknown. */
    static List<String> forCategory(String category) {
        if (category == null)
            return List.of();
        return TABLE.getOrDefault(normalize(category), List.of());
    }

    static String normalize(String category) {
        return category.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
    }
}
