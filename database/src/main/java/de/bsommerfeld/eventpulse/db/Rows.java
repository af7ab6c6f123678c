package de.bsommerfeld.eventpulse.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.eventpulse.core.util.Timestamps;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed accessors for column maps returned by a {@link StorageGateway}, plus
 * the value normalization applied before values are written. Backends
 * disagree on representations (SQLite has no boolean, PostgREST returns
 * {@code jsonb} as objects and SQLite as text), so every conversion is
 * lenient.
 */
public final class Rows {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Rows() {
    }

    public static String string(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value == null ? null : value.toString();
    }

    public static int integer(Map<String, Object> row, String column, int fallback) {
        Object value = row.get(column);
        if (value instanceof Number number)
            return number.intValue();
        if (value == null)
            return fallback;
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public static double decimal(Map<String, Object> row, String column, double fallback) {
        Object value = row.get(column);
        if (value instanceof Number number)
            return number.doubleValue();
        if (value == null)
            return fallback;
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public static boolean bool(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value instanceof Boolean b)
            return b;
        if (value instanceof Number number)
            return number.intValue() != 0;
        if (value == null)
            return false;
        String text = value.toString().trim();
        return text.equalsIgnoreCase("true") || text.equals("1") || text.equalsIgnoreCase("t");
    }

    public static Instant instant(Map<String, Object> row, String column) {
        return Timestamps.parse(row.get(column));
    }

    /** Reads a JSON object column that may arrive as a map or as serialized text. */
    public static Map<String, Object> json(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null)
            return new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return copy;
        }
        try {
            return MAPPER.readValue(value.toString(), new TypeReference<LinkedHashMap<String, Object>>() {
            });
        } catch (JsonProcessingException e) {
            throw new StorageException("Column '" + column + "' does not hold a JSON object", e);
        }
    }

    /**
     * Converts a value into the form written to TEXT-typed storage:
     * instants become fixed-width ISO strings, collections and maps become
     * JSON. Everything else is returned unchanged.
     */
    static Object toStorable(Object value) {
        if (value instanceof Instant instant)
            return Timestamps.format(instant);
        if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
            try {
                return MAPPER.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new StorageException("Value is not serializable to JSON: " + value, e);
            }
        }
        return value;
    }
}
