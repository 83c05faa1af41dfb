package com.semanticduck.compiler;

import com.semanticduck.exception.EmptyMetricSetException;
import com.semanticduck.exception.MissingJoinPathException;
import com.semanticduck.exception.NoTablesResolvedException;
import com.semanticduck.model.DimensionDefinition;
import com.semanticduck.model.MetricDefinition;
import com.semanticduck.model.QueryRequest;
import com.semanticduck.model.SemanticLayer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Merges a request with its semantic layer into a {@link CompilationContext}.
 *
 * <p>The semantic layer handed to the compiler is already resolved for the
 * request: all of its metrics and dimensions are projected. Resolution here
 * derives the referenced tables and grouping columns, classifies the
 * request's filters and runs every check that can fail a compilation, so that
 * clause emission itself never fails.
 *
 * <p>Checks, in order:
 * <ol>
 *   <li>at least one metric ({@link EmptyMetricSetException})</li>
 *   <li>at least one table ({@link NoTablesResolvedException})</li>
 *   <li>joins present when more than one table is referenced
 *       ({@link MissingJoinPathException})</li>
 *   <li>filter fields known, strict mode only</li>
 * </ol>
 */
public final class ContextResolver {

    private final PredicateClassifier classifier;

    public ContextResolver(PredicateClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    /**
     * Resolves the working set for one compilation.
     *
     * @param request the query request
     * @param semanticLayer the resolved semantic layer
     * @return the compilation context
     */
    public CompilationContext resolve(QueryRequest request, SemanticLayer semanticLayer) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(semanticLayer, "semanticLayer must not be null");

        if (semanticLayer.metrics().isEmpty()) {
            throw new EmptyMetricSetException();
        }

        // Insertion order keeps the emitted FROM and GROUP BY stable across calls
        Set<String> tables = new LinkedHashSet<>();
        for (MetricDefinition metric : semanticLayer.metrics()) {
            tables.add(metric.table());
        }
        Set<String> columns = new LinkedHashSet<>();
        for (DimensionDefinition dimension : semanticLayer.dimensions()) {
            tables.add(dimension.table());
            columns.add(dimension.qualifiedColumn());
        }

        if (tables.isEmpty()) {
            throw new NoTablesResolvedException();
        }
        if (tables.size() > 1 && semanticLayer.joins().isEmpty()) {
            throw new MissingJoinPathException(new ArrayList<>(tables));
        }

        PredicateClassifier.Classification split = classifier.classify(
            request.filters(), semanticLayer.dimensionAliases(), semanticLayer.metricNames());

        return new CompilationContext(
            semanticLayer.metrics(),
            semanticLayer.dimensions(),
            semanticLayer.joins(),
            new ArrayList<>(tables),
            new ArrayList<>(columns),
            split.preAggregation(),
            split.postAggregation());
    }
}
