package com.semanticduck.model;

import java.util.Objects;

/**
 * A single {@code field operator value} filter from a query request.
 *
 * <p>The field is a caller-facing name: either a dimension alias (the filter
 * then applies before aggregation) or, by assumption, a metric name (the
 * filter applies after aggregation). Values are either numbers, emitted bare,
 * or strings, emitted as quoted literals.
 */
public final class FilterPredicate {

    private final String field;
    private final ComparisonOperator operator;
    private final Object value;

    /**
     * Creates a filter predicate.
     *
     * @param field the dimension alias or metric name being filtered
     * @param operator the comparison operator
     * @param value a {@link Number} or a {@link String}
     * @throws IllegalArgumentException if the value is neither a number nor a string,
     *         or is a NaN or infinite floating-point number
     */
    public FilterPredicate(String field, ComparisonOperator operator, Object value) {
        this.field = ModelChecks.requireText(field, "field");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(value, "value must not be null");
        if (!(value instanceof Number) && !(value instanceof String)) {
            throw new IllegalArgumentException(
                "Filter value must be a number or a string, got: " + value.getClass().getSimpleName());
        }
        if ((value instanceof Double && !Double.isFinite((Double) value))
                || (value instanceof Float && !Float.isFinite((Float) value))) {
            throw new IllegalArgumentException("Filter value must be a finite number, got: " + value);
        }
        this.value = value;
    }

    /**
     * Creates a filter predicate from an operator symbol.
     *
     * @param field the dimension alias or metric name being filtered
     * @param operator the operator symbol, e.g. {@code ">="}
     * @param value a {@link Number} or a {@link String}
     */
    public FilterPredicate(String field, String operator, Object value) {
        this(field, ComparisonOperator.fromSymbol(operator), value);
    }

    public String field() {
        return field;
    }

    public ComparisonOperator operator() {
        return operator;
    }

    public Object value() {
        return value;
    }

    public boolean isNumeric() {
        return value instanceof Number;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FilterPredicate)) return false;
        FilterPredicate that = (FilterPredicate) o;
        return field.equals(that.field) &&
               operator == that.operator &&
               value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operator, value);
    }

    @Override
    public String toString() {
        return String.format("Filter(%s %s %s)", field, operator.symbol(), value);
    }
}
