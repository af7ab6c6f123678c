package de.bsommerfeld.eventpulse.db;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Backend-neutral row selection: a conjunction of column filters, an optional
 * single-column order and an optional limit.
 *
 * <pre>{@code
 * Query.where()
 *         .eq("processed", false)
 *         .lte("attempts", 5)
 *         .orderBy("created_at", true)
 *         .limit(10);
 * }</pre>
 */
public final class Query {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public enum Operator {
        EQ,
        IN,
        GT,
        GTE,
        LT,
        LTE
    }

    /**
     * A single column predicate. For {@link Operator#IN} the value is a
     * {@link Collection}; an empty collection matches nothing.
     */
    public record Filter(String column, Operator operator, Object value) {

        public Filter {
            requireIdentifier(column);
            Objects.requireNonNull(operator, "operator");
            if (operator == Operator.IN) {
                if (!(value instanceof Collection<?> values)) {
                    throw new IllegalArgumentException("IN filter on '" + column + "' requires a collection");
                }
                value = List.copyOf(values);
            }
        }

        public static Filter eq(String column, Object value) {
            return new Filter(column, Operator.EQ, value);
        }
    }

    public record Order(String column, boolean ascending) {

        public Order {
            requireIdentifier(column);
        }
    }

    private final List<Filter> filters = new ArrayList<>();
    private Order order;
    private Integer limit;

    private Query() {
    }

    public static Query where() {
        return new Query();
    }

    public static Query all() {
        return new Query();
    }

    public Query eq(String column, Object value) {
        filters.add(new Filter(column, Operator.EQ, value));
        return this;
    }

    public Query in(String column, Collection<?> values) {
        filters.add(new Filter(column, Operator.IN, values));
        return this;
    }

    public Query gt(String column, Object value) {
        filters.add(new Filter(column, Operator.GT, value));
        return this;
    }

    public Query gte(String column, Object value) {
        filters.add(new Filter(column, Operator.GTE, value));
        return this;
    }

    public Query lt(String column, Object value) {
        filters.add(new Filter(column, Operator.LT, value));
        return this;
    }

    public Query lte(String column, Object value) {
        filters.add(new Filter(column, Operator.LTE, value));
        return this;
    }

    public Query orderBy(String column, boolean ascending) {
        this.order = new Order(column, ascending);
        return this;
    }

    public Query limit(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, was " + limit);
        }
        this.limit = limit;
        return this;
    }

    public List<Filter> filters() {
        return Collections.unmodifiableList(filters);
    }

    /** @return the order, or {@code null} for backend order */
    public Order order() {
        return order;
    }

    /** @return the limit, or {@code null} for no limit */
    public Integer limit() {
        return limit;
    }

    /**
     * Table and column names are interpolated into SQL and URLs, so only plain
     * identifiers are accepted.
     */
    static String requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Illegal identifier: " + name);
        }
        return name;
    }

    @Override
    public String toString() {
        return "Query{filters=" + filters + ", order=" + order + ", limit=" + limit + "}";
    }
}
