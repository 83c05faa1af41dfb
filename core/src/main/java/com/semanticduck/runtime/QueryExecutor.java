package com.semanticduck.runtime;

import com.semanticduck.compiler.CompiledQuery;
import com.semanticduck.exception.QueryExecutionException;
import com.semanticduck.logging.QueryLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Executes compiled statements against DuckDB.
 *
 * <p>Each QueryExecutor is bound to one {@link DuckDBRuntime}. Results keep
 * at most {@code maxResults} rows, but every row is counted so the caller
 * can report the full size.
 *
 * <p>Example usage:
 * <pre>
 *   try (DuckDBRuntime runtime = DuckDBRuntime.create(config)) {
 *       QueryExecutor executor = new QueryExecutor(runtime, config.maxResults());
 *       QueryResult result = executor.execute(compiler.compileQuery(request, layer));
 *   }
 * </pre>
 *
 * @see DuckDBRuntime
 */
public class QueryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    private final DuckDBRuntime runtime;
    private final int maxResults;

    /**
     * Creates an executor keeping at most {@link ExecutionConfig#DEFAULT_MAX_RESULTS} rows.
     *
     * @param runtime the DuckDB runtime
     */
    public QueryExecutor(DuckDBRuntime runtime) {
        this(runtime, ExecutionConfig.DEFAULT_MAX_RESULTS);
    }

    /**
     * Creates an executor.
     *
     * @param runtime the DuckDB runtime
     * @param maxResults maximum number of rows kept per result
     */
    public QueryExecutor(DuckDBRuntime runtime, int maxResults) {
        this.runtime = Objects.requireNonNull(runtime, "runtime must not be null");
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be positive: " + maxResults);
        }
        this.maxResults = maxResults;
    }

    /**
     * Executes plain SQL with no bound parameters.
     *
     * @param sql the statement
     * @return the capped result
     * @throws QueryExecutionException if execution fails
     */
    public QueryResult execute(String sql) {
        return execute(CompiledQuery.of(Objects.requireNonNull(sql, "sql must not be null")));
    }

    /**
     * Executes a compiled statement, binding its parameters in order.
     *
     * @param query the compiled statement
     * @return the capped result
     * @throws QueryExecutionException if execution fails
     */
    public QueryResult execute(CompiledQuery query) {
        Objects.requireNonNull(query, "query must not be null");

        String queryId = "q_" + UUID.randomUUID().toString().substring(0, 8);
        QueryLogger.startQuery(queryId);
        long queryStartTime = System.nanoTime();

        try (PreparedStatement stmt = runtime.getConnection().prepareStatement(query.sql())) {
            QueryLogger.logSQLGeneration(query.sql(), 0);

            List<Object> parameters = query.parameters();
            for (int i = 0; i < parameters.size(); i++) {
                stmt.setObject(i + 1, parameters.get(i));
            }

            QueryResult result;
            try (ResultSet rs = stmt.executeQuery()) {
                result = collect(rs);
            }

            long execTimeMs = (System.nanoTime() - queryStartTime) / 1_000_000;
            QueryLogger.logExecution(execTimeMs, result.totalRows());
            if (result.isTruncated()) {
                logger.debug("Kept {} of {} rows", result.rows().size(), result.totalRows());
            }
            QueryLogger.completeQuery((System.nanoTime() - queryStartTime) / 1_000_000);
            return result;

        } catch (SQLException e) {
            QueryLogger.logError(e);
            throw new QueryExecutionException(
                "Failed to execute query: " + e.getMessage(), e, query.sql());
        } finally {
            QueryLogger.clearContext();
        }
    }

    private QueryResult collect(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();

        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(meta.getColumnLabel(i));
        }

        List<List<Object>> rows = new ArrayList<>();
        long totalRows = 0;
        while (rs.next()) {
            totalRows++;
            if (rows.size() < maxResults) {
                List<Object> row = new ArrayList<>(columnCount);
                for (int i = 1; i <= columnCount; i++) {
                    row.add(rs.getObject(i));
                }
                rows.add(row);
            }
        }
        return new QueryResult(columns, rows, totalRows);
    }

    public int maxResults() {
        return maxResults;
    }
}
