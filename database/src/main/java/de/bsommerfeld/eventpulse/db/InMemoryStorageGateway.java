package de.bsommerfeld.eventpulse.db;

import de.bsommerfeld.eventpulse.core.result.CallResult;
import de.bsommerfeld.eventpulse.core.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * In-memory {@link StorageGateway} for TEST mode and unit tests. No disk I/O,
 * no schema. Tables spring into existence on first insert.
 *
 * <p>
 * Uniqueness mirrors {@code schema.sql}: each known table has a key whose
 * duplicate insert yields {@code DUPLICATE}. Values are normalized before
 * comparison so an {@link Instant} filter matches a timestamp stored as
 * string and {@code 1} matches {@code 1L}.
 */
public class InMemoryStorageGateway implements StorageGateway {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryStorageGateway.class);

    private static final Map<String, List<String>> DEFAULT_UNIQUE_KEYS = Map.of(
            "event_submissions", List.of("id"),
            "event_jobs", List.of("id"),
            "reddit_comments", List.of("event_id", "reddit_id"),
            "worker_state", List.of("key"));

    private final Map<String, List<Map<String, Object>>> tables = new HashMap<>();
    private final Map<String, List<String>> uniqueKeys = new HashMap<>(DEFAULT_UNIQUE_KEYS);

    /** Declares (or replaces) the unique key of a table. */
    public synchronized void defineUniqueKey(String table, List<String> columns) {
        uniqueKeys.put(table, List.copyOf(columns));
    }

    @Override
    public synchronized List<Map<String, Object>> select(String table, Query query) {
        List<Map<String, Object>> matching = rows(table).stream()
                .filter(row -> matchesAll(row, query.filters()))
                .collect(Collectors.toList());

        Query.Order order = query.order();
        if (order != null) {
            Comparator<Map<String, Object>> comparator = (a, b) -> compare(
                    a.get(order.column()), b.get(order.column()));
            matching.sort(order.ascending() ? comparator : comparator.reversed());
        }
        if (query.limit() != null && matching.size() > query.limit()) {
            matching = matching.subList(0, query.limit());
        }
        return matching.stream()
                .map(row -> new LinkedHashMap<>(row))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized CallResult<Integer> insert(String table, Map<String, Object> row) {
        Query.requireIdentifier(table);
        List<String> key = uniqueKeys.get(table);
        if (key != null) {
            for (Map<String, Object> existing : rows(table)) {
                if (sameKey(existing, row, key)) {
                    LOG.debug("Duplicate key {} in {}", key, table);
                    return CallResult.duplicate("duplicate key " + key + " in " + table);
                }
            }
        }
        tables.computeIfAbsent(table, t -> new ArrayList<>()).add(new LinkedHashMap<>(row));
        return CallResult.ok(1);
    }

    @Override
    public synchronized CallResult<Integer> update(String table, Map<String, Object> patch,
            List<Query.Filter> filters) {
        int affected = 0;
        for (Map<String, Object> row : rows(table)) {
            if (matchesAll(row, filters)) {
                row.putAll(patch);
                affected++;
            }
        }
        return CallResult.ok(affected);
    }

    @Override
    public String describe() {
        return "in-memory";
    }

    /** Number of rows currently held for {@code table}. */
    public synchronized int count(String table) {
        return rows(table).size();
    }

    private List<Map<String, Object>> rows(String table) {
        return tables.getOrDefault(table, List.of());
    }

    // =====================================================================
    // Matching
    // =====================================================================

    private static boolean sameKey(Map<String, Object> a, Map<String, Object> b, List<String> key) {
        for (String column : key) {
            if (!Objects.equals(normalize(a.get(column)), normalize(b.get(column))))
                return false;
        }
        return true;
    }

    private static boolean matchesAll(Map<String, Object> row, List<Query.Filter> filters) {
        for (Query.Filter filter : filters) {
            if (!matches(row.get(filter.column()), filter))
                return false;
        }
        return true;
    }

    private static boolean matches(Object actual, Query.Filter filter) {
        switch (filter.operator()) {
            case EQ:
                return Objects.equals(normalize(actual), normalize(filter.value()));
            case IN:
                Object needle = normalize(actual);
                for (Object candidate : (Collection<?>) filter.value()) {
                    if (Objects.equals(needle, normalize(candidate)))
                        return true;
                }
                return false;
            case GT:
                return actual != null && compare(actual, filter.value()) > 0;
            case GTE:
                return actual != null && compare(actual, filter.value()) >= 0;
            case LT:
                return actual != null && compare(actual, filter.value()) < 0;
            case LTE:
                return actual != null && compare(actual, filter.value()) <= 0;
            default:
                throw new IllegalArgumentException("Unsupported operator " + filter.operator());
        }
    }

    /** Nulls sort first, as in SQLite. Numbers compare by value, everything else as text. */
    private static int compare(Object a, Object b) {
        Object left = normalize(a);
        Object right = normalize(b);
        if (left == null || right == null) {
            return left == right ? 0 : (left == null ? -1 : 1);
        }
        if (left instanceof BigDecimal leftNumber && right instanceof BigDecimal rightNumber) {
            return leftNumber.compareTo(rightNumber);
        }
        return left.toString().compareTo(right.toString());
    }

    private static Object normalize(Object value) {
        if (value instanceof Instant instant)
            return Timestamps.format(instant);
        if (value instanceof BigDecimal decimal)
            return decimal.stripTrailingZeros();
        if (value instanceof Number number)
            return new BigDecimal(number.toString()).stripTrailingZeros();
        return value;
    }
}
