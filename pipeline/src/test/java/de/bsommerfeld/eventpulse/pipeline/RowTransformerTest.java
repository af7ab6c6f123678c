package de.bsommerfeld.eventpulse.pipeline;

import de.bsommerfeld.eventpulse.core.domain.MatchKind;
import de.bsommerfeld.eventpulse.core.domain.MatchRecord;
import de.bsommerfeld.eventpulse.core.domain.RawItem;
import de.bsommerfeld.eventpulse.pipeline.sentiment.SentimentScorer;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RowTransformerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T08:00:00Z");
    private static final Instant CREATED = Instant.parse("2024-05-01T12:00:00Z");

    private final List<String> scoredTexts = new ArrayList<>();
    private final SentimentScorer recordingScorer = text -> {
        scoredTexts.add(text);
        return 0.5;
    };
    private final RowTransformer transformer = new RowTransformer(recordingScorer, Clock.fixed(NOW, ZoneOffset.UTC));

    private static RawItem post(String id, String body, Instant createdAt) {
        return new RawItem(MatchKind.POST, "programming", id, "AI Hackathon", body, "alice", createdAt,
                Map.of("permalink", "/r/programming/comments/" + id), null);
    }

    @Test
    void toRecord_shouldPrefixPostIdAndScoreTitleWithBody() {
        MatchRecord record = transformer.toRecord("E1", post("p1", "Who is going?", CREATED), "programming");

        assertEquals("E1", record.eventId());
        assertEquals("post_p1", record.externalId());
        assertEquals(MatchKind.POST, record.kind());
        assertEquals("programming", record.source());
        assertEquals("AI Hackathon", record.title());
        assertEquals("Who is going?", record.body());
        assertEquals(0.5, record.sentiment());
        assertEquals(CREATED, record.observedAt());
        assertEquals("/r/programming/comments/p1", record.extra().get("permalink"));
        assertEquals(List.of("AI Hackathon Who is going?"), scoredTexts);
    }

    @Test
    void toRecord_shouldNullBlankPostBodyAndScoreTitleOnly() {
        MatchRecord record = transformer.toRecord("E1", post("p2", "  ", CREATED), "programming");

        assertNull(record.body());
        assertEquals(List.of("AI Hackathon "), scoredTexts);
    }

    @Test
    void toRecord_shouldScoreCommentBodyAndDropTitle() {
        RawItem comment = new RawItem(MatchKind.COMMENT, "programming", "c1", null, "Count me in", "bob",
                CREATED, Map.of("link_id", "t3_p1"), "p1");

        MatchRecord record = transformer.toRecord("E1", comment, "programming");

        assertEquals("comment_c1", record.externalId());
        assertNull(record.title());
        assertEquals("Count me in", record.body());
        assertEquals(List.of("Count me in"), scoredTexts);
    }

    @Test
    void toRecord_shouldUseClockWhenCreationTimeIsMissing() {
        MatchRecord record = transformer.toRecord("E1", post("p3", null, null), "programming");

        assertEquals(NOW, record.observedAt());
    }

    @Test
    void toRecord_shouldPreferRequestedTargetAsSource() {
        RawItem fromAll = new RawItem(MatchKind.POST, "all", "p4", "t", null, null, CREATED, null, null);

        assertEquals("hackathons", transformer.toRecord("E1", fromAll, "hackathons").source());
        assertEquals("all", transformer.toRecord("E1", fromAll, null).source());
    }

    @Test
    void toRecord_shouldRejectItemWithoutId() {
        assertThrows(ItemTransformException.class,
                () -> transformer.toRecord("E1", post(null, "body", CREATED), "programming"));
        assertThrows(ItemTransformException.class,
                () -> transformer.toRecord("E1", post(" ", "body", CREATED), "programming"));
    }
}
