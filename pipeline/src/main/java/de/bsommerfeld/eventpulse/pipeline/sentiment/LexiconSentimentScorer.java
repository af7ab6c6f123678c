package de.bsommerfeld.eventpulse.pipeline.sentiment;

import com.google.inject.Singleton;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rule-based polarity scorer in the style of VADER: word valences from a
 * lexicon, adjusted by preceding boosters and negations, the contrastive
 * "but" and trailing exclamation marks, then squashed into {@code [-1, 1]}.
 *
 * <p>
 * Good enough to rank short social posts; it knows nothing about sarcasm,
 * emoji or multi-word idioms.
 */
@Singleton
public class LexiconSentimentScorer implements SentimentScorer {

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}']+");

    // Normalization constant for sum / sqrt(sum^2 + ALPHA)
    private static final double ALPHA = 15.0;
    private static final double NEGATION_SCALAR = -0.74;
    private static final double BOOST = 0.293;
    private static final double EXCLAMATION_BOOST = 0.292;
    private static final int MAX_EXCLAMATIONS = 4;
    private static final int LOOKBACK = 3;
    private static final double[] LOOKBACK_DECAY = { 1.0, 0.95, 0.9 };

    private static final Set<String> NEGATIONS = Set.of(
            "not", "no", "never", "none", "nobody", "nothing", "neither", "nor", "nowhere",
            "cannot", "cant", "dont", "doesnt", "didnt", "isnt", "arent", "wasnt", "werent",
            "wont", "wouldnt", "shouldnt", "couldnt", "aint", "without", "hardly");

    private static final Map<String, Double> BOOSTERS = Map.ofEntries(
            Map.entry("very", BOOST), Map.entry("really", BOOST), Map.entry("extremely", BOOST),
            Map.entry("so", BOOST), Map.entry("super", BOOST), Map.entry("incredibly", BOOST),
            Map.entry("totally", BOOST), Map.entry("absolutely", BOOST), Map.entry("highly", BOOST),
            Map.entry("hugely", BOOST), Map.entry("most", BOOST), Map.entry("completely", BOOST),
            Map.entry("slightly", -BOOST), Map.entry("somewhat", -BOOST), Map.entry("kinda", -BOOST),
            Map.entry("barely", -BOOST), Map.entry("marginally", -BOOST), Map.entry("partly", -BOOST),
            Map.entry("sorta", -BOOST), Map.entry("little", -BOOST));

    private final Map<String, Double> lexicon;

    @Inject
    public LexiconSentimentScorer() {
        this(SentimentLexicon.load(SentimentLexicon.DEFAULT_RESOURCE));
    }

    LexiconSentimentScorer(Map<String, Double> lexicon) {
        this.lexicon = lexicon;
    }

    @Override
    public double score(String text) {
        if (text == null || text.isBlank())
            return 0.0;

        List<String> tokens = tokenize(text);
        double[] valences = new double[tokens.size()];
        for (int i = 0; i < tokens.size(); i++) {
            valences[i] = valenceAt(tokens, i);
        }
        applyContrast(tokens, valences);

        double sum = 0.0;
        for (double v : valences) {
            sum += v;
        }
        if (sum == 0.0)
            return 0.0;

        long bangs = Math.min(MAX_EXCLAMATIONS, text.chars().filter(c -> c == '!').count());
        sum += Math.signum(sum) * bangs * EXCLAMATION_BOOST;

        double compound = sum / Math.sqrt(sum * sum + ALPHA);
        return Math.max(-1.0, Math.min(1.0, compound));
    }

    private double valenceAt(List<String> tokens, int index) {
        Double base = lexicon.get(tokens.get(index));
        if (base == null)
            return 0.0;

        double valence = base;
        boolean negated = false;
        for (int back = 1; back <= LOOKBACK && index - back >= 0; back++) {
            String previous = tokens.get(index - back);
            Double boost = BOOSTERS.get(previous);
            if (boost != null) {
                double scaled = boost * LOOKBACK_DECAY[back - 1];
                valence += valence > 0 ? scaled : -scaled;
            }
            if (isNegation(previous))
                negated = true;
        }
        return negated ? valence * NEGATION_SCALAR : valence;
    }

    /** Words before the last "but" count half, words after it one and a half. */
    private static void applyContrast(List<String> tokens, double[] valences) {
        int but = tokens.lastIndexOf("but");
        if (but < 0)
            return;
        for (int i = 0; i < valences.length; i++) {
            if (i < but)
                valences[i] *= 0.5;
            else if (i > but)
                valences[i] *= 1.5;
        }
    }

    private static boolean isNegation(String token) {
        return NEGATIONS.contains(token) || token.endsWith("n't");
    }

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        for (String raw : TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            String token = stripQuotes(raw);
            if (!token.isEmpty())
                tokens.add(token);
        }
        return tokens;
    }

    private static String stripQuotes(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && token.charAt(start) == '\'')
            start++;
        while (end > start && token.charAt(end - 1) == '\'')
            end--;
        return token.substring(start, end);
    }
}
