package com.semanticduck.exception;

/**
 * Thrown when the resolved metrics and dimensions reference no table.
 */
public class NoTablesResolvedException extends SemanticCompilationException {

    public NoTablesResolvedException() {
        super(ErrorKind.NO_TABLES_RESOLVED, "At least one table is required, but no tables were found");
    }

    @Override
    public String getUserMessage() {
        return "No source table could be determined for the query. " +
               "Check that every metric and dimension names a table.";
    }
}
