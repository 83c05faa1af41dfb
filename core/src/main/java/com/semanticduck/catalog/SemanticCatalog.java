package com.semanticduck.catalog;

import com.semanticduck.exception.CatalogException;
import com.semanticduck.model.DimensionDefinition;
import com.semanticduck.model.FilterPredicate;
import com.semanticduck.model.JoinEdge;
import com.semanticduck.model.MetricDefinition;
import com.semanticduck.model.QueryRequest;
import com.semanticduck.model.SemanticLayer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Name-keyed catalog of metric and dimension definitions plus join edges,
 * shared read-only across requests.
 *
 * <p>The compiler never looks names up itself. A catalog turns a
 * {@link QueryRequest} into the per-request {@link SemanticLayer} the compiler
 * consumes:
 * <ul>
 *   <li>metrics: the requested names, in request order</li>
 *   <li>dimensions: the requested names, then any catalog dimension a filter
 *       names, so that such a filter applies before aggregation</li>
 *   <li>joins: catalog edges, in catalog order, whose both tables are
 *       referenced by the resolved metrics and dimensions</li>
 * </ul>
 */
public final class SemanticCatalog {

    private final Map<String, MetricDefinition> metrics;
    private final Map<String, DimensionDefinition> dimensions;
    private final List<JoinEdge> joins;

    /**
     * Creates a catalog.
     *
     * @param metrics metric definitions; names must be unique
     * @param dimensions dimension definitions; aliases must be unique
     * @param joins join edges in preferred emission order
     * @throws IllegalArgumentException on a duplicate name
     */
    public SemanticCatalog(Collection<MetricDefinition> metrics,
                           Collection<DimensionDefinition> dimensions,
                           List<JoinEdge> joins) {
        Map<String, MetricDefinition> metricMap = new LinkedHashMap<>();
        for (MetricDefinition metric : Objects.requireNonNull(metrics, "metrics must not be null")) {
            if (metricMap.put(metric.name(), metric) != null) {
                throw new IllegalArgumentException("Duplicate metric name: " + metric.name());
            }
        }
        Map<String, DimensionDefinition> dimensionMap = new LinkedHashMap<>();
        for (DimensionDefinition dimension : Objects.requireNonNull(dimensions, "dimensions must not be null")) {
            if (dimensionMap.put(dimension.name(), dimension) != null) {
                throw new IllegalArgumentException("Duplicate dimension alias: " + dimension.name());
            }
        }
        this.metrics = Collections.unmodifiableMap(metricMap);
        this.dimensions = Collections.unmodifiableMap(dimensionMap);
        this.joins = joins == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(joins));
    }

    /**
     * Creates a catalog holding every definition of a semantic layer document.
     *
     * @param layer the semantic layer
     * @return the catalog
     */
    public static SemanticCatalog of(SemanticLayer layer) {
        Objects.requireNonNull(layer, "layer must not be null");
        return new SemanticCatalog(layer.metrics(), layer.dimensions(), layer.joins());
    }

    /**
     * Resolves a request's names against this catalog.
     *
     * @param request the query request
     * @return the semantic layer for the request
     * @throws CatalogException if a requested metric or dimension is not defined
     */
    public SemanticLayer resolve(QueryRequest request) {
        Objects.requireNonNull(request, "request must not be null");

        List<MetricDefinition> resolvedMetrics = new ArrayList<>();
        for (String name : request.metricNames()) {
            MetricDefinition metric = metrics.get(name);
            if (metric == null) {
                throw new CatalogException("Unknown metric: '" + name + "'. Available metrics: " + metrics.keySet());
            }
            resolvedMetrics.add(metric);
        }

        Map<String, DimensionDefinition> resolvedDimensions = new LinkedHashMap<>();
        for (String name : request.dimensionNames()) {
            DimensionDefinition dimension = dimensions.get(name);
            if (dimension == null) {
                throw new CatalogException(
                    "Unknown dimension: '" + name + "'. Available dimensions: " + dimensions.keySet());
            }
            resolvedDimensions.put(name, dimension);
        }
        for (FilterPredicate filter : request.filters()) {
            DimensionDefinition dimension = dimensions.get(filter.field());
            if (dimension != null) {
                resolvedDimensions.putIfAbsent(filter.field(), dimension);
            }
        }

        Set<String> tables = new LinkedHashSet<>();
        for (MetricDefinition metric : resolvedMetrics) {
            tables.add(metric.table());
        }
        for (DimensionDefinition dimension : resolvedDimensions.values()) {
            tables.add(dimension.table());
        }
        List<JoinEdge> resolvedJoins = new ArrayList<>();
        for (JoinEdge join : joins) {
            if (tables.contains(join.parentTable()) && tables.contains(join.childTable())) {
                resolvedJoins.add(join);
            }
        }

        return new SemanticLayer(resolvedMetrics, new ArrayList<>(resolvedDimensions.values()), resolvedJoins);
    }

    public Map<String, MetricDefinition> metrics() {
        return metrics;
    }

    public Map<String, DimensionDefinition> dimensions() {
        return dimensions;
    }

    public List<JoinEdge> joins() {
        return joins;
    }

    @Override
    public String toString() {
        return String.format("SemanticCatalog(metrics=%s, dimensions=%s, joins=%d)",
            metrics.keySet(), dimensions.keySet(), joins.size());
    }
}
