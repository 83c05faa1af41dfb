package com.semanticduck.model;

import java.util.Objects;

/**
 * A named raw column reference bound to a source table.
 *
 * <p>The name is the alias exposed to callers; the column is the physical
 * column. When both are equal no {@code AS} alias is emitted:
 * <pre>
 *   ("status", "status", "orders")         → orders.status
 *   ("ordered_date", "created_at", "orders") → orders.created_at AS ordered_date
 * </pre>
 */
public final class DimensionDefinition {

    private final String name;
    private final String column;
    private final String table;

    /**
     * Creates a dimension definition.
     *
     * @param name the dimension alias
     * @param column the raw column name
     * @param table the table that owns the column
     */
    public DimensionDefinition(String name, String column, String table) {
        this.name = ModelChecks.requireText(name, "name");
        this.column = ModelChecks.requireText(column, "column");
        this.table = ModelChecks.requireText(table, "table");
    }

    public String name() {
        return name;
    }

    public String column() {
        return column;
    }

    public String table() {
        return table;
    }

    /**
     * Returns the {@code table.column} form used in SELECT and GROUP BY.
     *
     * @return the qualified column
     */
    public String qualifiedColumn() {
        return table + "." + column;
    }

    /**
     * Returns true when the alias differs from the raw column name.
     *
     * @return whether an {@code AS} alias must be emitted
     */
    public boolean isAliased() {
        return !name.equals(column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DimensionDefinition)) return false;
        DimensionDefinition that = (DimensionDefinition) o;
        return name.equals(that.name) &&
               column.equals(that.column) &&
               table.equals(that.table);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, column, table);
    }

    @Override
    public String toString() {
        return String.format("Dimension(%s = %s)", name, qualifiedColumn());
    }
}
