package de.bsommerfeld.eventpulse.core.util;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Date;

/**
 * Canonical timestamp handling for storage rows.
 *
 * <p>
 * Timestamps are written as fixed-width UTC ISO-8601 strings with millisecond
 * precision ({@code 2024-05-01T12:00:00.000Z}). The fixed width matters for
 * SQLite, which compares TEXT columns lexicographically: {@link Instant#toString()}
 * drops trailing zero fractions and would sort {@code ...00Z} after
 * {@code ...00.500Z}.
 */
public final class Timestamps {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'")
            .withZone(ZoneOffset.UTC);

    private Timestamps() {
    }

    public static String format(Instant instant) {
        return instant == null ? null : FORMAT.format(instant);
    }

    /**
     * Best-effort conversion of a stored value into an {@link Instant}.
     * Accepts ISO-8601 instants and offset date-times (PostgREST renders
     * {@code timestamptz} as {@code 2024-05-01T12:00:00+00:00}), JDBC
     * timestamps and epoch seconds.
     *
     * @return the instant, or {@code null} if absent or unparseable
     */
    public static Instant parse(Object value) {
        if (value == null)
            return null;
        if (value instanceof Instant instant)
            return instant;
        if (value instanceof Date date)
            return date.toInstant();
        if (value instanceof Number number)
            return Instant.ofEpochSecond(number.longValue());

        String text = value.toString().trim();
        if (text.isEmpty())
            return null;
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException ignored) {
            // not a plain instant, try the offset form below
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException ignored) {
            // try the space-separated SQL form below
        }
        try {
            return OffsetDateTime.parse(text.replace(' ', 'T')).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
