package com.semanticduck.model;

import java.util.Objects;

/**
 * A join between two tables, rendered as {@code parent JOIN child ON condition}.
 *
 * <p>Edges are kept in the order the caller supplies them; that order is the
 * order in which they are emitted in the FROM clause.
 */
public final class JoinEdge {

    private final String parentTable;
    private final String childTable;
    private final String condition;

    /**
     * Creates a join edge.
     *
     * @param parentTable the "one" side of the relationship
     * @param childTable the "many" side of the relationship
     * @param condition the raw boolean SQL join condition
     */
    public JoinEdge(String parentTable, String childTable, String condition) {
        this.parentTable = ModelChecks.requireText(parentTable, "parentTable");
        this.childTable = ModelChecks.requireText(childTable, "childTable");
        this.condition = ModelChecks.requireText(condition, "condition");
    }

    public String parentTable() {
        return parentTable;
    }

    public String childTable() {
        return childTable;
    }

    public String condition() {
        return condition;
    }

    /**
     * Returns the SQL fragment for this edge.
     *
     * @return {@code parent JOIN child ON condition}
     */
    public String toSQL() {
        return parentTable + " JOIN " + childTable + " ON " + condition;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JoinEdge)) return false;
        JoinEdge that = (JoinEdge) o;
        return parentTable.equals(that.parentTable) &&
               childTable.equals(that.childTable) &&
               condition.equals(that.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parentTable, childTable, condition);
    }

    @Override
    public String toString() {
        return String.format("Join(%s)", toSQL());
    }
}
