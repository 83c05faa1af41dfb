package com.semanticduck.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Resolved semantic layer for one compilation: the metric and dimension
 * definitions to project and the join edges that connect their tables.
 *
 * <p>Instances are immutable and may be shared between threads. Metric names
 * and dimension aliases must be unique within a layer, since dimension
 * aliases are the keys used to route filters to WHERE or HAVING.
 */
public final class SemanticLayer {

    private final List<MetricDefinition> metrics;
    private final List<DimensionDefinition> dimensions;
    private final List<JoinEdge> joins;

    /**
     * Creates a semantic layer.
     *
     * @param metrics the metric definitions, in projection order
     * @param dimensions the dimension definitions, in projection order (may be null)
     * @param joins the join edges, in emission order (may be null)
     * @throws IllegalArgumentException if a metric name or dimension alias repeats
     */
    public SemanticLayer(List<MetricDefinition> metrics,
                         List<DimensionDefinition> dimensions,
                         List<JoinEdge> joins) {
        this.metrics = copyOf(Objects.requireNonNull(metrics, "metrics must not be null"), "metrics");
        this.dimensions = dimensions == null ? Collections.emptyList() : copyOf(dimensions, "dimensions");
        this.joins = joins == null ? Collections.emptyList() : copyOf(joins, "joins");

        Set<String> metricNames = new HashSet<>();
        for (MetricDefinition metric : this.metrics) {
            if (!metricNames.add(metric.name())) {
                throw new IllegalArgumentException("Duplicate metric name: " + metric.name());
            }
        }
        Set<String> aliases = new HashSet<>();
        for (DimensionDefinition dimension : this.dimensions) {
            if (!aliases.add(dimension.name())) {
                throw new IllegalArgumentException("Duplicate dimension alias: " + dimension.name());
            }
        }
    }

    public static Builder builder() {
        return new Builder();
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
     * Returns the metric names in definition order.
     *
     * @return an unmodifiable ordered set of metric names
     */
    public Set<String> metricNames() {
        Set<String> names = new LinkedHashSet<>();
        for (MetricDefinition metric : metrics) {
            names.add(metric.name());
        }
        return Collections.unmodifiableSet(names);
    }

    /**
     * Returns the dimension aliases in definition order.
     *
     * @return an unmodifiable ordered set of dimension aliases
     */
    public Set<String> dimensionAliases() {
        Set<String> names = new LinkedHashSet<>();
        for (DimensionDefinition dimension : dimensions) {
            names.add(dimension.name());
        }
        return Collections.unmodifiableSet(names);
    }

    private static <T> List<T> copyOf(List<T> items, String what) {
        for (T item : items) {
            Objects.requireNonNull(item, what + " must not contain null");
        }
        return Collections.unmodifiableList(new ArrayList<>(items));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SemanticLayer)) return false;
        SemanticLayer that = (SemanticLayer) o;
        return metrics.equals(that.metrics) &&
               dimensions.equals(that.dimensions) &&
               joins.equals(that.joins);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metrics, dimensions, joins);
    }

    @Override
    public String toString() {
        return String.format("SemanticLayer(metrics=%s, dimensions=%s, joins=%s)",
            metrics, dimensions, joins);
    }

    /**
     * Incremental construction of a {@link SemanticLayer}.
     */
    public static final class Builder {
        private final List<MetricDefinition> metrics = new ArrayList<>();
        private final List<DimensionDefinition> dimensions = new ArrayList<>();
        private final List<JoinEdge> joins = new ArrayList<>();

        private Builder() {}

        public Builder metric(String name, String expression, String table) {
            return metric(new MetricDefinition(name, expression, table));
        }

        public Builder metric(MetricDefinition metric) {
            metrics.add(Objects.requireNonNull(metric, "metric must not be null"));
            return this;
        }

        public Builder dimension(String name, String column, String table) {
            return dimension(new DimensionDefinition(name, column, table));
        }

        public Builder dimension(DimensionDefinition dimension) {
            dimensions.add(Objects.requireNonNull(dimension, "dimension must not be null"));
            return this;
        }

        public Builder join(String parentTable, String childTable, String condition) {
            return join(new JoinEdge(parentTable, childTable, condition));
        }

        public Builder join(JoinEdge join) {
            joins.add(Objects.requireNonNull(join, "join must not be null"));
            return this;
        }

        public SemanticLayer build() {
            return new SemanticLayer(metrics, dimensions, joins);
        }
    }
}
