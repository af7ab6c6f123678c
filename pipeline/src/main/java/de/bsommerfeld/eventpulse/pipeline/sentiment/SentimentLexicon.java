package de.bsommerfeld.eventpulse.pipeline.sentiment;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches word valence tables from classpath resources.
 *
 * <p>
 * Format: one {@code word<TAB>valence} pair per line, valence roughly in
 * {@code [-4, 4]}. Blank lines and lines starting with {@code #} are ignored.
 */
final class SentimentLexicon {

    static final String DEFAULT_RESOURCE = "sentiment/lexicon.tsv";

    private static final ConcurrentHashMap<String, Map<String, Double>> CACHE = new ConcurrentHashMap<>();

    private SentimentLexicon() {
    }

    static Map<String, Double> load(String path) {
        return CACHE.computeIfAbsent(path, SentimentLexicon::readResource);
    }

    private static Map<String, Double> readResource(String path) {
        try (InputStream in = SentimentLexicon.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("Lexicon resource not found: " + path);
            }
            return parse(new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)), path);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read lexicon resource: " + path, e);
        }
    }

    private static Map<String, Double> parse(BufferedReader reader, String path) throws IOException {
        Map<String, Double> valences = new HashMap<>();
        String line;
        int lineNo = 0;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#"))
                continue;

            String[] parts = trimmed.split("\t");
            if (parts.length != 2) {
                throw new IllegalStateException(path + ":" + lineNo + " expected 'word<TAB>valence'");
            }
            try {
                valences.put(parts[0].trim().toLowerCase(Locale.ROOT), Double.parseDouble(parts[1].trim()));
            } catch (NumberFormatException e) {
                throw new IllegalStateException(path + ":" + lineNo + " has a malformed valence", e);
            }
        }
        return Collections.unmodifiableMap(valences);
    }
}
