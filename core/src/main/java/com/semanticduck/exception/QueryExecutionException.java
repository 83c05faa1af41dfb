package com.semanticduck.exception;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Exception thrown when a compiled statement fails in the warehouse.
 *
 * <p>Wraps the driver's {@link java.sql.SQLException} together with the SQL
 * that was sent. The compiler never sees these failures; in particular a
 * filter on an unknown field, which the compiler routes to HAVING, surfaces
 * here as a binder error.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       QueryResult result = executor.execute(compiled);
 *   } catch (QueryExecutionException e) {
 *       System.err.println(e.getUserMessage());
 *       System.err.println("Failed SQL: " + e.getFailedSQL());
 *   }
 * </pre>
 *
 * @see com.semanticduck.runtime.QueryExecutor
 */
public class QueryExecutionException extends RuntimeException {

    private static final Pattern MISSING_COLUMN =
        Pattern.compile("[Cc]olumn (?:with name )?\"?([^\"\\s]+)\"? (?:does not exist|not found)");
    private static final Pattern MISSING_TABLE =
        Pattern.compile("Table with name ([^\\s!]+) does not exist");
    private static final Pattern SYNTAX_NEAR =
        Pattern.compile("syntax error at or near \"([^\"]+)\"");

    private final String failedSQL;

    /**
     * Creates a query execution exception.
     *
     * @param message the error message
     * @param sql the SQL that failed to execute
     */
    public QueryExecutionException(String message, String sql) {
        super(message);
        this.failedSQL = sql;
    }

    /**
     * Creates a query execution exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause (typically SQLException)
     * @param sql the SQL that failed to execute
     */
    public QueryExecutionException(String message, Throwable cause, String sql) {
        super(message, cause);
        this.failedSQL = sql;
    }

    /**
     * Returns the SQL statement that failed to execute.
     *
     * @return the failed SQL, or null if not available
     */
    public String getFailedSQL() {
        return failedSQL;
    }

    /**
     * Returns a user-friendly error message.
     *
     * <p>Recognizes the DuckDB error classes a generated statement typically
     * runs into: unknown columns (often a filter on a field that is neither a
     * dimension nor a metric), unknown tables, and syntax errors coming from
     * raw expressions in the semantic layer.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        String message = getMessage();
        if (message == null) {
            return "Query execution failed.";
        }

        if (message.contains("Binder Error")) {
            Matcher matcher = MISSING_COLUMN.matcher(message);
            if (matcher.find()) {
                return "Column or alias '" + matcher.group(1) + "' not found. " +
                       "Check metric and dimension names used in filters.";
            }
            return "Query references something the warehouse cannot resolve: " + message;
        }

        if (message.contains("Catalog Error")) {
            Matcher matcher = MISSING_TABLE.matcher(message);
            if (matcher.find()) {
                return "Table '" + matcher.group(1) + "' does not exist. " +
                       "Check table names in the semantic layer and the default schema.";
            }
            return "Catalog error: " + message;
        }

        if (message.contains("Parser Error") || message.contains("Syntax Error")) {
            Matcher matcher = SYNTAX_NEAR.matcher(message);
            if (matcher.find()) {
                return "SQL syntax error near '" + matcher.group(1) + "'. " +
                       "Check metric expressions and join conditions.";
            }
            return "SQL syntax error. Check metric expressions and join conditions.";
        }

        if (message.contains("Conversion Error")) {
            return "A filter value does not match the column type. " +
                   "Check numeric versus string filter values.";
        }

        return "Query execution failed: " + message;
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Query Execution Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedSQL != null) {
            sb.append("Failed SQL:\n").append(failedSQL).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getClass().getName()).append("\n");
            sb.append("Cause Message: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
