package de.bsommerfeld.eventpulse.pipeline.sentiment;

/**
 * Scores free text on a single polarity axis.
 */
public interface SentimentScorer {

    /**
     * @return compound polarity in {@code [-1, 1]}; {@code 0} for empty or
     *         neutral text
     */
    double score(String text);
}
