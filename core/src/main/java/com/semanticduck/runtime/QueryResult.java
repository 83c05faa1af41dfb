package com.semanticduck.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Rows returned by a query, capped at the configured row limit.
 *
 * <p>{@link #totalRows()} counts every row the query produced, so it can
 * exceed {@code rows().size()} when the result was truncated.
 */
public final class QueryResult {

    private final List<String> columns;
    private final List<List<Object>> rows;
    private final long totalRows;

    public QueryResult(List<String> columns, List<List<Object>> rows, long totalRows) {
        Objects.requireNonNull(columns, "columns must not be null");
        Objects.requireNonNull(rows, "rows must not be null");
        if (totalRows < rows.size()) {
            throw new IllegalArgumentException(
                "totalRows (%d) is less than the number of rows kept (%d)".formatted(totalRows, rows.size()));
        }
        this.columns = List.copyOf(columns);
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException(
                    "Row has %d values, expected %d".formatted(row.size(), columns.size()));
            }
            // List.copyOf rejects nulls
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
        this.totalRows = totalRows;
    }

    public List<String> columns() {
        return columns;
    }

    public List<List<Object>> rows() {
        return rows;
    }

    public long totalRows() {
        return totalRows;
    }

    public boolean isEmpty() {
        return totalRows == 0;
    }

    public boolean isTruncated() {
        return totalRows > rows.size();
    }

    @Override
    public String toString() {
        return "QueryResult(columns=" + columns + ", rows=" + rows.size() + ", totalRows=" + totalRows + ")";
    }
}
