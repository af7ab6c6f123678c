package de.bsommerfeld.eventpulse.db;

import de.bsommerfeld.eventpulse.core.result.CallResult;

import java.util.List;
import java.util.Map;

/**
 * Table-oriented access to the relational backend. Rows travel as plain
 * column maps so the same repositories run on SQLite, PostgREST and the
 * in-memory store.
 *
 * <p>
 * Expected outcomes of writes ({@code DUPLICATE}, {@code NOT_FOUND},
 * {@code TRANSIENT_ERROR}) are reported through {@link CallResult}. Reads have
 * no expected failure mode and throw {@link StorageException} instead.
 */
public interface StorageGateway {

    /**
     * Returns the rows of {@code table} matching {@code query}, in the
     * requested order.
     *
     * @throws StorageException if the backend cannot be read
     */
    List<Map<String, Object>> select(String table, Query query);

    /**
     * Inserts one row.
     *
     * @return {@code OK} with the number of inserted rows, or {@code DUPLICATE}
     *         when a uniqueness constraint rejected the row
     */
    CallResult<Integer> insert(String table, Map<String, Object> row);

    /**
     * Applies {@code patch} to every row matching all {@code filters}.
     *
     * @return {@code OK} with the number of affected rows (possibly zero)
     */
    CallResult<Integer> update(String table, Map<String, Object> patch, List<Query.Filter> filters);

    /** Human-readable backend description for startup logging. */
    String describe();
}
