package com.semanticduck.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * The caller-facing analytical request: metric names, optional dimension
 * names and optional filters.
 *
 * <p>Names are references into a semantic layer, not definitions. Metric and
 * dimension names are de-duplicated keeping first-seen order; filters keep
 * the order they were given in.
 *
 * <p>Example:
 * <pre>
 *   QueryRequest request = QueryRequest.ofMetrics("total_revenue")
 *       .withDimensions("status")
 *       .withFilter(new FilterPredicate("status", "=", "Complete"));
 * </pre>
 */
public final class QueryRequest {

    private final List<String> metricNames;
    private final List<String> dimensionNames;
    private final List<FilterPredicate> filters;

    /**
     * Creates a query request.
     *
     * @param metricNames the requested metric names
     * @param dimensionNames the requested dimension names (may be null)
     * @param filters the filter predicates in caller order (may be null)
     */
    public QueryRequest(Collection<String> metricNames,
                        Collection<String> dimensionNames,
                        List<FilterPredicate> filters) {
        Objects.requireNonNull(metricNames, "metricNames must not be null");
        this.metricNames = distinct(metricNames, "metric name");
        this.dimensionNames = dimensionNames == null
            ? Collections.emptyList()
            : distinct(dimensionNames, "dimension name");
        if (filters == null) {
            this.filters = Collections.emptyList();
        } else {
            for (FilterPredicate filter : filters) {
                Objects.requireNonNull(filter, "filters must not contain null");
            }
            this.filters = Collections.unmodifiableList(new ArrayList<>(filters));
        }
    }

    /**
     * Creates a request for the given metrics with no dimensions or filters.
     *
     * @param metricNames the metric names
     * @return the request
     */
    public static QueryRequest ofMetrics(String... metricNames) {
        return new QueryRequest(Arrays.asList(metricNames), null, null);
    }

    /**
     * Returns a copy of this request with the given dimension names appended.
     *
     * @param names the dimension names
     * @return a new request
     */
    public QueryRequest withDimensions(String... names) {
        List<String> merged = new ArrayList<>(dimensionNames);
        merged.addAll(Arrays.asList(names));
        return new QueryRequest(metricNames, merged, filters);
    }

    /**
     * Returns a copy of this request with the given filter appended.
     *
     * @param filter the filter
     * @return a new request
     */
    public QueryRequest withFilter(FilterPredicate filter) {
        List<FilterPredicate> merged = new ArrayList<>(filters);
        merged.add(filter);
        return new QueryRequest(metricNames, dimensionNames, merged);
    }

    public List<String> metricNames() {
        return metricNames;
    }

    public List<String> dimensionNames() {
        return dimensionNames;
    }

    public List<FilterPredicate> filters() {
        return filters;
    }

    private static List<String> distinct(Collection<String> names, String what) {
        LinkedHashSet<String> seen = new LinkedHashSet<>();
        for (String name : names) {
            seen.add(ModelChecks.requireText(name, what));
        }
        return Collections.unmodifiableList(new ArrayList<>(seen));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueryRequest)) return false;
        QueryRequest that = (QueryRequest) o;
        return metricNames.equals(that.metricNames) &&
               dimensionNames.equals(that.dimensionNames) &&
               filters.equals(that.filters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricNames, dimensionNames, filters);
    }

    @Override
    public String toString() {
        return String.format("QueryRequest(metrics=%s, dimensions=%s, filters=%s)",
            metricNames, dimensionNames, filters);
    }
}
