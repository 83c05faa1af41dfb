package com.semanticduck.compiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A generated SQL statement and the values bound to its {@code ?} markers.
 *
 * <p>{@link #parameters()} is empty unless the statement was compiled with
 * {@link LiteralMode#PARAMETERIZED}; then it lists WHERE values followed by
 * HAVING values, matching the marker order in {@link #sql()}.
 */
public final class CompiledQuery {

    private final String sql;
    private final List<Object> parameters;

    public CompiledQuery(String sql, List<Object> parameters) {
        this.sql = Objects.requireNonNull(sql, "sql must not be null");
        this.parameters = parameters == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    /**
     * Wraps a plain SQL string with no bound parameters.
     *
     * @param sql the statement
     * @return the compiled query
     */
    public static CompiledQuery of(String sql) {
        return new CompiledQuery(sql, null);
    }

    public String sql() {
        return sql;
    }

    public List<Object> parameters() {
        return parameters;
    }

    public boolean isParameterized() {
        return !parameters.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompiledQuery)) return false;
        CompiledQuery that = (CompiledQuery) o;
        return sql.equals(that.sql) && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sql, parameters);
    }

    @Override
    public String toString() {
        return parameters.isEmpty() ? sql : sql + " " + parameters;
    }
}
