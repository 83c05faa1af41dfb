package com.semanticduck.model;

import java.util.Objects;

/**
 * A named aggregate SQL expression bound to a source table.
 *
 * <p>Example:
 * <pre>
 *   new MetricDefinition("total_revenue", "SUM(sale_price)", "order_items")
 *   // SELECT SUM(sale_price) AS total_revenue FROM order_items
 * </pre>
 *
 * <p>Metrics never contribute grouping columns; their expression is emitted
 * verbatim in the SELECT list under the metric name.
 */
public final class MetricDefinition {

    private final String name;
    private final String expression;
    private final String table;

    /**
     * Creates a metric definition.
     *
     * @param name the metric name, used as the SELECT alias
     * @param expression the aggregate SQL expression, e.g. {@code SUM(col)}
     * @param table the table the expression reads from
     */
    public MetricDefinition(String name, String expression, String table) {
        this.name = ModelChecks.requireText(name, "name");
        this.expression = ModelChecks.requireText(expression, "expression");
        this.table = ModelChecks.requireText(table, "table");
    }

    public String name() {
        return name;
    }

    public String expression() {
        return expression;
    }

    public String table() {
        return table;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetricDefinition)) return false;
        MetricDefinition that = (MetricDefinition) o;
        return name.equals(that.name) &&
               expression.equals(that.expression) &&
               table.equals(that.table);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, expression, table);
    }

    @Override
    public String toString() {
        return String.format("Metric(%s = %s @ %s)", name, expression, table);
    }
}
