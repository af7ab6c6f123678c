package de.bsommerfeld.eventpulse.pipeline;

import de.bsommerfeld.eventpulse.core.domain.Event;
import de.bsommerfeld.eventpulse.core.domain.SearchPlan;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class KeywordPlannerTest {

    private final KeywordPlanner planner = new KeywordPlanner();

    private SearchPlan plan(String title, List<String> tags, List<String> subreddits) {
        Optional<SearchPlan> plan = planner.buildPlan(new Event("E1", title, tags, subreddits));
        assertTrue(plan.isPresent(), "expected a plan");
        return plan.get();
    }

    // -- Keywords --

    @Test
    void buildPlan_shouldDedupeKeywordsCaseInsensitivelyKeepingFirstSpelling() {
        SearchPlan plan = plan("ai meetup", List.of("AI", "AI", "ml"), List.of());

        assertEquals(List.of("AI", "ml", "meetup"), plan.keywords());
        assertEquals("AI OR ml OR meetup", plan.query());
    }

    @Test
    void buildPlan_shouldDeriveHackathonPlan() {
        SearchPlan plan = plan("AI Hackathon", List.of("hackathon"), List.of());

        assertEquals(List.of("hackathon"), plan.keywords());
        assertEquals("hackathon", plan.query());
        assertEquals(List.of("programming", "technology"), plan.targets());
    }

    @Test
    void buildPlan_shouldTruncateKeywordsToEight() {
        SearchPlan plan = plan("alpha bravo charlie delta echo foxtrot golf hotel india juliet",
                List.of(), List.of());

        assertEquals(8, plan.keywords().size());
        assertEquals("alpha", plan.keywords().get(0));
        assertEquals("hotel", plan.keywords().get(7));
    }

    @Test
    void buildPlan_shouldFallBackToShortTitleWordsWhenNothingElseRemains() {
        SearchPlan plan = plan("UX AI ML", List.of(), List.of());

        assertEquals(List.of("ux", "ai", "ml"), plan.keywords());
    }

    @Test
    void buildPlan_shouldParseSerializedTags() {
        Event event = new Event("E1", "Demo", List.of("[\"robotics\", \" \", \"design\"]"), List.of());

        SearchPlan plan = planner.buildPlan(event).orElseThrow();

        assertEquals(List.of("robotics", "design", "demo"), plan.keywords());
    }

    @Test
    void buildPlan_shouldReturnEmptyWhenNoKeywordExists() {
        assertTrue(planner.buildPlan(new Event("E1", "   ", List.of(), List.of())).isEmpty());
        assertTrue(planner.buildPlan(new Event("E2", null, List.of(" "), List.of())).isEmpty());
    }

    // -- Targets --

    @Test
    void buildPlan_shouldPreferExplicitSubreddits() {
        SearchPlan plan = plan("AI Hackathon", List.of("hackathon"), List.of("foo", "Foo", "bar"));

        assertEquals(List.of("foo", "bar"), plan.targets());
    }

    @Test
    void buildPlan_shouldMapTagsThroughCategoryTable() {
        SearchPlan plan = plan("Spring fair", List.of("Career Fair", "coding"), List.of());

        assertEquals(List.of("cscareerquestions", "jobs", "college", "programming", "learnprogramming"),
                plan.targets());
    }

    @Test
    void buildPlan_shouldUseCampusFallbackForUnknownCategories() {
        SearchPlan plan = plan("Knitting circle", List.of("knitting"), List.of());

        assertEquals(List.of("college", "university", "technology", "CampusLife"), plan.targets());
    }

    @Test
    void normalize_shouldTreatSpacesAndDashesAsUnderscores() {
        assertEquals("machine_learning", CategoryTargets.normalize(" Machine-Learning "));
        assertEquals("career_fair", CategoryTargets.normalize("career  fair"));
    }
}
