package com.semanticduck.model;

/**
 * Comparison operators accepted in filter predicates.
 */
public enum ComparisonOperator {
    EQUAL("="),
    GREATER_THAN(">"),
    LESS_THAN("<"),
    GREATER_THAN_OR_EQUAL(">="),
    LESS_THAN_OR_EQUAL("<="),
    NOT_EQUAL("!=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the SQL symbol for this operator.
     *
     * @return the symbol, e.g. {@code >=}
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Parses an operator symbol.
     *
     * @param symbol one of {@code = > < >= <= !=} (surrounding whitespace ignored)
     * @return the operator
     * @throws IllegalArgumentException if the symbol is not recognized
     */
    public static ComparisonOperator fromSymbol(String symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("Operator symbol cannot be null");
        }
        String trimmed = symbol.trim();
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(trimmed)) {
                return op;
            }
        }
        throw new IllegalArgumentException(
            "Unknown comparison operator: '%s'. Valid operators: =, >, <, >=, <=, !=".formatted(symbol));
    }

    @Override
    public String toString() {
        return symbol;
    }
}
