package com.semanticduck.exception;

import java.util.Collections;
import java.util.Set;

/**
 * Thrown in strict mode when a filter names neither a resolved dimension
 * alias nor a resolved metric.
 *
 * <p>Without strict mode such a filter is routed to HAVING and only fails
 * when the warehouse executes the statement.
 */
public class UnknownFilterFieldException extends SemanticCompilationException {

    private final String field;
    private final Set<String> knownFields;

    /**
     * Creates the exception.
     *
     * @param field the unknown filter field
     * @param knownFields the metric names and dimension aliases that were available
     */
    public UnknownFilterFieldException(String field, Set<String> knownFields) {
        super(ErrorKind.UNKNOWN_FILTER_FIELD, "Filter field '" + field + "' is not a known metric or dimension");
        this.field = field;
        this.knownFields = Collections.unmodifiableSet(knownFields);
    }

    public String field() {
        return field;
    }

    public Set<String> knownFields() {
        return knownFields;
    }

    @Override
    public String getUserMessage() {
        return "Cannot filter on '" + field + "'. Available fields: " + String.join(", ", knownFields);
    }
}
