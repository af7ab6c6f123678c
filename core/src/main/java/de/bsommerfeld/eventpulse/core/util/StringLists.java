package de.bsommerfeld.eventpulse.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Normalizes list-valued columns ({@code tags}, {@code subreddits}) that
 * arrive in different shapes depending on the backend: a JSON array from
 * PostgREST, a serialized JSON string from SQLite, or a plain string written
 * by hand.
 */
public final class StringLists {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private StringLists() {
    }

    /**
     * Converts a raw column value into a list of trimmed, non-blank strings.
     *
     * <ul>
     * <li>{@code null} → empty list</li>
     * <li>collection → its elements as strings</li>
     * <li>string holding a JSON array → the array elements</li>
     * <li>any other string → a single-element list</li>
     * </ul>
     */
    public static List<String> parse(Object raw) {
        if (raw == null)
            return Collections.emptyList();

        if (raw instanceof Collection<?> collection) {
            List<String> result = new ArrayList<>();
            for (Object element : collection) {
                addIfPresent(result, element == null ? null : element.toString());
            }
            return result;
        }

        String text = raw.toString().trim();
        if (text.isEmpty())
            return Collections.emptyList();

        if (text.startsWith("[")) {
            try {
                JsonNode node = MAPPER.readTree(text);
                if (node.isArray()) {
                    List<String> result = new ArrayList<>();
                    for (JsonNode element : node) {
                        addIfPresent(result, element.isNull() ? null : element.asText());
                    }
                    return result;
                }
            } catch (JsonProcessingException e) {
                // Not valid JSON, treated as a single tag below
            }
        }
        return List.of(text);
    }

    /** Serializes a list to the JSON array form stored in TEXT columns. */
    public static String toJson(List<String> values) {
        try {
            return MAPPER.writeValueAsString(values == null ? List.of() : values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize string list", e);
        }
    }

    private static void addIfPresent(List<String> target, String value) {
        if (value != null && !value.isBlank()) {
            target.add(value.trim());
        }
    }
}
