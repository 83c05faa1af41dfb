package com.semanticduck.exception;

/**
 * Thrown when a compilation resolves no metric at all.
 *
 * <p>A statement is always built around at least one aggregate, so there is
 * nothing meaningful to emit without one.
 */
public class EmptyMetricSetException extends SemanticCompilationException {

    public EmptyMetricSetException() {
        super(ErrorKind.EMPTY_METRIC_SET, "Semantic layer resolved no metrics");
    }

    @Override
    public String getUserMessage() {
        return "At least one metric is required to build a query. " +
               "Add a metric definition to the semantic layer.";
    }
}
