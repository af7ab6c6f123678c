package de.bsommerfeld.eventpulse.db;

import de.bsommerfeld.eventpulse.core.result.CallResult;
import de.bsommerfeld.eventpulse.core.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * JDBC-backed {@link StorageGateway}. SQLite is the default backend, any
 * other JDBC driver on the classpath works as long as it understands the
 * generated ANSI SQL.
 *
 * <p>
 * The schema is applied from {@code schema.sql} on every startup. Every DDL
 * statement uses {@code IF NOT EXISTS}, so re-running it is harmless.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed immediately
 * after. The worker is single-threaded and SQLite serializes writes at the
 * file level anyway. No transaction spans more than one statement.
 *
 * <h3>Value mapping</h3>
 * Instants are written as fixed-width ISO-8601 text on SQLite (lexicographic
 * order equals time order) and as {@code timestamptz} elsewhere. Lists and
 * maps are written as JSON text.
 */
public class SqlStorageGateway implements StorageGateway {

    private static final Logger LOG = LoggerFactory.getLogger(SqlStorageGateway.class);
    private static final String SQLITE_PREFIX = "jdbc:sqlite:";
    private static final String UNIQUE_VIOLATION_STATE = "23505";
    private static final int SQLITE_CONSTRAINT = 19;

    private final String dbUrl;
    private final String user;
    private final String password;
    private final int queryTimeoutSeconds;
    private final boolean sqlite;

    public SqlStorageGateway(String dbUrl, String user, String password, Duration queryTimeout) {
        this.dbUrl = dbUrl;
        this.user = user;
        this.password = password;
        this.queryTimeoutSeconds = (int) Math.max(1, queryTimeout.toSeconds());
        this.sqlite = dbUrl.startsWith(SQLITE_PREFIX);
        if (sqlite) {
            ensureParentDirectory();
        }
        initialize();
    }

    Connection getConnection() throws SQLException {
        if (user == null) {
            return DriverManager.getConnection(dbUrl);
        }
        return DriverManager.getConnection(dbUrl, user, password);
    }

    private void ensureParentDirectory() {
        String path = dbUrl.substring(SQLITE_PREFIX.length());
        int query = path.indexOf('?');
        if (query >= 0)
            path = path.substring(0, query);
        if (path.isEmpty() || path.startsWith(":memory:") || path.startsWith("file:"))
            return;

        Path parent = Paths.get(path).toAbsolutePath().getParent();
        try {
            if (parent != null && !Files.exists(parent))
                Files.createDirectories(parent);
        } catch (Exception e) {
            LOG.error("Failed to create database directory {}", parent, e);
        }
    }

    private void initialize() {
        LOG.info("Initializing database at {}", dbUrl);
        try (Connection conn = getConnection()) {
            applySchema(conn);
        } catch (SQLException e) {
            throw new StorageException("Database initialization failed", e);
        }
    }

    /**
     * Applies the full DDL from {@code schema.sql}, one statement at a time.
     * Statements the backend rejects are logged and skipped so a dialect
     * difference in one index does not prevent startup.
     */
    private void applySchema(Connection conn) throws SQLException {
        try (InputStream schemaStream = getClass().getClassLoader().getResourceAsStream("schema.sql");
                Statement stmt = conn.createStatement()) {

            if (schemaStream == null) {
                LOG.error("schema.sql not found in classpath!");
                return;
            }

            String schemaSql = new String(schemaStream.readAllBytes(), StandardCharsets.UTF_8);
            conn.setAutoCommit(false);
            for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                if (sql.trim().isEmpty())
                    continue;
                try {
                    stmt.execute(sql.trim());
                } catch (SQLException ex) {
                    if (!String.valueOf(ex.getMessage()).contains("exists")) {
                        LOG.warn("Schema execution warning: {}", ex.getMessage());
                    }
                }
            }
            conn.commit();
            LOG.info("Database schema applied.");
        } catch (Exception e) {
            conn.rollback();
            throw new SQLException("Schema application failed", e);
        }
    }

    // =====================================================================
    // StorageGateway
    // =====================================================================

    @Override
    public List<Map<String, Object>> select(String table, Query query) {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT * FROM " + Query.requireIdentifier(table)
                + whereClause(query.filters(), params)
                + orderClause(query)
                + (query.limit() != null ? " LIMIT " + query.limit() : "");

        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setQueryTimeout(queryTimeoutSeconds);
            bindAll(ps, params, 1);
            try (ResultSet rs = ps.executeQuery()) {
                return readRows(rs);
            }
        } catch (SQLException e) {
            throw new StorageException("Select from " + table + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public CallResult<Integer> insert(String table, Map<String, Object> row) {
        if (row.isEmpty()) {
            throw new IllegalArgumentException("Cannot insert an empty row into " + table);
        }
        StringJoiner columns = new StringJoiner(", ");
        StringJoiner placeholders = new StringJoiner(", ");
        for (String column : row.keySet()) {
            columns.add(Query.requireIdentifier(column));
            placeholders.add("?");
        }
        String sql = "INSERT INTO " + Query.requireIdentifier(table)
                + " (" + columns + ") VALUES (" + placeholders + ")";

        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setQueryTimeout(queryTimeoutSeconds);
            bindAll(ps, new ArrayList<>(row.values()), 1);
            return CallResult.ok(ps.executeUpdate());
        } catch (SQLException e) {
            if (isUniqueViolation(e)) {
                return CallResult.duplicate(e.getMessage());
            }
            return failure("Insert into " + table, e);
        }
    }

    @Override
    public CallResult<Integer> update(String table, Map<String, Object> patch, List<Query.Filter> filters) {
        if (patch.isEmpty()) {
            throw new IllegalArgumentException("Cannot apply an empty patch to " + table);
        }
        StringJoiner assignments = new StringJoiner(", ");
        for (String column : patch.keySet()) {
            assignments.add(Query.requireIdentifier(column) + " = ?");
        }
        List<Object> params = new ArrayList<>(patch.values());
        String sql = "UPDATE " + Query.requireIdentifier(table) + " SET " + assignments
                + whereClause(filters, params);

        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setQueryTimeout(queryTimeoutSeconds);
            bindAll(ps, params, 1);
            return CallResult.ok(ps.executeUpdate());
        } catch (SQLException e) {
            if (isUniqueViolation(e)) {
                return CallResult.duplicate(e.getMessage());
            }
            return failure("Update of " + table, e);
        }
    }

    @Override
    public String describe() {
        return "JDBC " + dbUrl;
    }

    // =====================================================================
    // SQL building
    // =====================================================================

    private static String whereClause(List<Query.Filter> filters, List<Object> params) {
        if (filters.isEmpty())
            return "";

        StringJoiner where = new StringJoiner(" AND ", " WHERE ", "");
        for (Query.Filter filter : filters) {
            String column = filter.column();
            switch (filter.operator()) {
                case EQ:
                    if (filter.value() == null) {
                        where.add(column + " IS NULL");
                    } else {
                        where.add(column + " = ?");
                        params.add(filter.value());
                    }
                    break;
                case IN:
                    Collection<?> values = (Collection<?>) filter.value();
                    if (values.isEmpty()) {
                        where.add("1 = 0");
                    } else {
                        StringJoiner in = new StringJoiner(", ", column + " IN (", ")");
                        for (Object value : values) {
                            in.add("?");
                            params.add(value);
                        }
                        where.add(in.toString());
                    }
                    break;
                case GT:
                    where.add(column + " > ?");
                    params.add(filter.value());
                    break;
                case GTE:
                    where.add(column + " >= ?");
                    params.add(filter.value());
                    break;
                case LT:
                    where.add(column + " < ?");
                    params.add(filter.value());
                    break;
                case LTE:
                    where.add(column + " <= ?");
                    params.add(filter.value());
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported operator " + filter.operator());
            }
        }
        return where.toString();
    }

    private static String orderClause(Query query) {
        Query.Order order = query.order();
        if (order == null)
            return "";
        return " ORDER BY " + order.column() + (order.ascending() ? " ASC" : " DESC");
    }

    private void bindAll(PreparedStatement ps, List<Object> values, int startIndex) throws SQLException {
        int index = startIndex;
        for (Object value : values) {
            bind(ps, index++, value);
        }
    }

    private void bind(PreparedStatement ps, int index, Object value) throws SQLException {
        if (value == null) {
            ps.setObject(index, null);
        } else if (value instanceof Boolean b) {
            ps.setBoolean(index, b);
        } else if (value instanceof Instant instant) {
            if (sqlite) {
                ps.setString(index, Timestamps.format(instant));
            } else {
                ps.setObject(index, OffsetDateTime.ofInstant(instant, ZoneOffset.UTC));
            }
        } else {
            ps.setObject(index, Rows.toStorable(value));
        }
    }

    private static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(meta.getColumnLabel(i), rs.getObject(i));
            }
            rows.add(row);
        }
        return rows;
    }

    // =====================================================================
    // Error classification
    // =====================================================================

    static boolean isUniqueViolation(SQLException e) {
        if (UNIQUE_VIOLATION_STATE.equals(e.getSQLState()))
            return true;
        String message = String.valueOf(e.getMessage());
        return e.getErrorCode() == SQLITE_CONSTRAINT
                && (message.contains("UNIQUE") || message.contains("PRIMARYKEY")
                        || message.contains("PRIMARY KEY"));
    }

    private static <T> CallResult<T> failure(String operation, SQLException e) {
        if (e instanceof SQLTimeoutException) {
            LOG.warn("{} timed out: {}", operation, e.getMessage());
            return CallResult.transientError(operation + " timed out");
        }
        LOG.warn("{} failed: {}", operation, e.getMessage());
        return CallResult.transientError(operation + " failed: " + e.getMessage());
    }
}
