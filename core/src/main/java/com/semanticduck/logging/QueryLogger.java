package com.semanticduck.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Structured per-query logging.
 *
 * <p>Puts a {@code queryId} into the SLF4J {@link MDC} for the duration of a
 * query so every log line written while it runs can be correlated. Callers
 * must pair {@link #startQuery} with {@link #clearContext} in a
 * {@code finally} block.
 *
 * <pre>
 *   QueryLogger.startQuery("q_1a2b3c4d");
 *   try {
 *       ...
 *       QueryLogger.logExecution(execTimeMs, rowCount);
 *       QueryLogger.completeQuery(totalTimeMs);
 *   } finally {
 *       QueryLogger.clearContext();
 *   }
 * </pre>
 */
public final class QueryLogger {

    private static final Logger logger = LoggerFactory.getLogger(QueryLogger.class);

    /** MDC key holding the current query id. */
    public static final String QUERY_ID_KEY = "queryId";

    private static final int MAX_LOGGED_SQL_LENGTH = 2000;

    private QueryLogger() {}

    public static void startQuery(String queryId) {
        MDC.put(QUERY_ID_KEY, queryId);
        logger.info("Query started");
    }

    public static void logSQLGeneration(String sql, long generationTimeMs) {
        if (logger.isDebugEnabled()) {
            logger.debug("SQL generated in {} ms: {}", generationTimeMs, abbreviate(sql));
        }
    }

    public static void logExecution(long executionTimeMs, long rowCount) {
        logger.info("Query executed in {} ms, {} row(s)", executionTimeMs, rowCount);
    }

    public static void logError(Throwable error) {
        logger.error("Query failed: {}", error.getMessage(), error);
    }

    public static void completeQuery(long totalTimeMs) {
        logger.info("Query completed in {} ms", totalTimeMs);
    }

    /**
     * Returns the id of the query running on this thread.
     *
     * @return the query id, or null outside a query
     */
    public static String currentQueryId() {
        return MDC.get(QUERY_ID_KEY);
    }

    public static void clearContext() {
        MDC.remove(QUERY_ID_KEY);
    }

    private static String abbreviate(String sql) {
        if (sql == null || sql.length() <= MAX_LOGGED_SQL_LENGTH) {
            return sql;
        }
        return sql.substring(0, MAX_LOGGED_SQL_LENGTH) + "... (" + sql.length() + " chars)";
    }
}
