package com.semanticduck.compiler;

import com.semanticduck.model.DimensionDefinition;
import com.semanticduck.model.FilterPredicate;
import com.semanticduck.model.JoinEdge;
import com.semanticduck.model.MetricDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Renders the five clauses of a statement from a resolved context.
 *
 * <p>SELECT and FROM are always present. WHERE, GROUP BY and HAVING are
 * returned empty when there is nothing to put in them, and the caller omits
 * them from the statement entirely.
 *
 * <p>Example, for metric {@code total_revenue} and dimension {@code status}
 * on {@code order_items} with filter {@code status = 'Complete'}:
 * <pre>
 *   SELECT SUM(sale_price) AS total_revenue, order_items.status
 *   FROM order_items
 *   WHERE status = 'Complete'
 *   GROUP BY order_items.status
 * </pre>
 */
public final class ClauseEmitter {

    private final LiteralMode literalMode;

    public ClauseEmitter(LiteralMode literalMode) {
        this.literalMode = Objects.requireNonNull(literalMode, "literalMode must not be null");
    }

    /**
     * Renders metrics as {@code expression AS name}, then dimensions as
     * {@code table.column}, adding {@code AS alias} only for renamed columns.
     */
    public String select(CompilationContext context) {
        List<String> items = new ArrayList<>();
        for (MetricDefinition metric : context.metrics()) {
            items.add(metric.expression() + " AS " + metric.name());
        }
        for (DimensionDefinition dimension : context.dimensions()) {
            if (dimension.isAliased()) {
                items.add(dimension.qualifiedColumn() + " AS " + dimension.name());
            } else {
                items.add(dimension.qualifiedColumn());
            }
        }
        return "SELECT " + String.join(", ", items);
    }

    /**
     * Renders the single referenced table, or the join edges in the order
     * they were supplied, one per line.
     */
    public String from(CompilationContext context) {
        if (context.tables().size() == 1) {
            return "FROM " + context.tables().get(0);
        }
        List<String> joins = new ArrayList<>();
        for (JoinEdge join : context.joins()) {
            joins.add(join.toSQL());
        }
        return "FROM " + String.join("\n", joins);
    }

    public Optional<String> where(CompilationContext context, List<Object> parameters) {
        return predicates("WHERE ", context.preAggregationFilters(), parameters);
    }

    public Optional<String> groupBy(CompilationContext context) {
        if (context.groupingColumns().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of("GROUP BY " + String.join(", ", context.groupingColumns()));
    }

    /**
     * Renders post-aggregation filters using the raw filter field, which is
     * expected to be a metric alias from the SELECT list.
     */
    public Optional<String> having(CompilationContext context, List<Object> parameters) {
        return predicates("HAVING ", context.postAggregationFilters(), parameters);
    }

    private Optional<String> predicates(String keyword, List<FilterPredicate> filters, List<Object> parameters) {
        if (filters.isEmpty()) {
            return Optional.empty();
        }
        List<String> conditions = new ArrayList<>();
        for (FilterPredicate filter : filters) {
            conditions.add(filter.field() + " " + filter.operator().symbol() + " "
                + literalMode.render(filter.value(), parameters));
        }
        return Optional.of(keyword + String.join(" AND ", conditions));
    }
}
