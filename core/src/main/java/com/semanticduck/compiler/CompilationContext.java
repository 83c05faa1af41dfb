package com.semanticduck.compiler;

import com.semanticduck.model.DimensionDefinition;
import com.semanticduck.model.FilterPredicate;
import com.semanticduck.model.JoinEdge;
import com.semanticduck.model.MetricDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Working set of one compilation: the resolved definitions, the referenced
 * tables and grouping columns, and the filters split by aggregation phase.
 *
 * <p>Tables and columns are de-duplicated in first-seen order, so the same
 * inputs always produce the same clause text. Instances are created by
 * {@link ContextResolver} and are never shared between compilations.
 */
public final class CompilationContext {

    private final List<MetricDefinition> metrics;
    private final List<DimensionDefinition> dimensions;
    private final List<JoinEdge> joins;
    private final List<String> tables;
    private final List<String> groupingColumns;
    private final List<FilterPredicate> preAggregationFilters;
    private final List<FilterPredicate> postAggregationFilters;

    CompilationContext(List<MetricDefinition> metrics,
                       List<DimensionDefinition> dimensions,
                       List<JoinEdge> joins,
                       List<String> tables,
                       List<String> groupingColumns,
                       List<FilterPredicate> preAggregationFilters,
                       List<FilterPredicate> postAggregationFilters) {
        this.metrics = freeze(metrics);
        this.dimensions = freeze(dimensions);
        this.joins = freeze(joins);
        this.tables = freeze(tables);
        this.groupingColumns = freeze(groupingColumns);
        this.preAggregationFilters = freeze(preAggregationFilters);
        this.postAggregationFilters = freeze(postAggregationFilters);
    }

    public List<MetricDefinition> metrics() {
        return metrics;
    }

    public List<DimensionDefinition> dimensions() {
        return dimensions;
    }

    public List<JoinEdge> joins() {
        return joins;
    }

    /**
     * Returns the tables referenced by metrics and dimensions.
     *
     * @return distinct table names, first-seen order
     */
    public List<String> tables() {
        return tables;
    }

    /**
     * Returns the qualified {@code table.column} of every dimension.
     *
     * @return distinct qualified columns, first-seen order
     */
    public List<String> groupingColumns() {
        return groupingColumns;
    }

    /**
     * Returns the filters on dimension aliases (WHERE).
     *
     * @return filters in request order
     */
    public List<FilterPredicate> preAggregationFilters() {
        return preAggregationFilters;
    }

    /**
     * Returns the filters on anything else, assumed to be metrics (HAVING).
     *
     * @return filters in request order
     */
    public List<FilterPredicate> postAggregationFilters() {
        return postAggregationFilters;
    }

    private static <T> List<T> freeze(List<T> items) {
        return Collections.unmodifiableList(new ArrayList<>(items));
    }

    @Override
    public String toString() {
        return String.format("CompilationContext(tables=%s, groupBy=%s, where=%d, having=%d)",
            tables, groupingColumns, preAggregationFilters.size(), postAggregationFilters.size());
    }
}
