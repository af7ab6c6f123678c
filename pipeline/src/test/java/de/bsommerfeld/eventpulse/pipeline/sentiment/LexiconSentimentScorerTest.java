package de.bsommerfeld.eventpulse.pipeline.sentiment;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LexiconSentimentScorerTest {

    private final LexiconSentimentScorer scorer = new LexiconSentimentScorer();

    @Test
    void score_shouldReturnZeroForBlankOrUnknownText() {
        assertEquals(0.0, scorer.score(null));
        assertEquals(0.0, scorer.score("   "));
        assertEquals(0.0, scorer.score("the meeting is in room 204"));
    }

    @Test
    void score_shouldBePositiveForPraise() {
        assertTrue(scorer.score("This hackathon was awesome, loved it") > 0.5);
    }

    @Test
    void score_shouldBeNegativeForComplaints() {
        assertTrue(scorer.score("Terrible organization, what a waste of time") < -0.3);
    }

    @Test
    void score_shouldFlipPolarityWhenNegated() {
        double plain = scorer.score("the talk was good");
        double negated = scorer.score("the talk was not good");
        double contracted = scorer.score("the talk wasn't good");

        assertTrue(plain > 0);
        assertTrue(negated < 0);
        assertTrue(contracted < 0);
    }

    @Test
    void score_shouldAmplifyWithBoosterWords() {
        assertTrue(scorer.score("really good") > scorer.score("good"));
        assertTrue(scorer.score("slightly good") < scorer.score("good"));
    }

    @Test
    void score_shouldWeightClauseAfterBut() {
        assertTrue(scorer.score("the food was good but the music was terrible") < 0);
        assertTrue(scorer.score("the food was terrible but the music was great") > 0);
    }

    @Test
    void score_shouldIntensifyWithExclamationMarks() {
        assertTrue(scorer.score("great!!!") > scorer.score("great"));
        assertEquals(scorer.score("great!!!!"), scorer.score("great!!!!!!!!"), 1e-9);
    }

    @Test
    void score_shouldStayWithinUnitInterval() {
        String gushing = "amazing awesome fantastic great love best perfect ".repeat(50);
        String ranting = "terrible awful worst hate horrible scam ".repeat(50);

        assertTrue(scorer.score(gushing) <= 1.0);
        assertTrue(scorer.score(gushing) > 0.99);
        assertTrue(scorer.score(ranting) >= -1.0);
        assertTrue(scorer.score(ranting) < -0.99);
    }

    @Test
    void score_shouldUseInjectedLexicon() {
        LexiconSentimentScorer custom = new LexiconSentimentScorer(Map.of("hype", 2.0));

        assertTrue(custom.score("so much hype") > 0);
        assertEquals(0.0, custom.score("great"));
    }

    // -- Tokenizer --

    @Test
    void tokenize_shouldLowerCaseAndKeepContractions() {
        assertEquals(List.of("don't", "miss", "it", "ai", "2024"), LexiconSentimentScorer.tokenize("Don't miss it -- AI 2024!"));
    }

    @Test
    void tokenize_shouldStripSurroundingQuotes() {
        assertEquals(List.of("great"), LexiconSentimentScorer.tokenize("'great'"));
    }
}
