package com.semanticduck.exception;

import java.util.Collections;
import java.util.List;

/**
 * Thrown when more than one table is referenced but no join edge is available
 * to connect them.
 */
public class MissingJoinPathException extends SemanticCompilationException {

    private final List<String> tables;

    /**
     * Creates the exception.
     *
     * @param tables the referenced tables, in first-seen order
     */
    public MissingJoinPathException(List<String> tables) {
        super(ErrorKind.MISSING_JOIN_PATH,
            "Query references " + tables.size() + " tables " + tables + " but no joins were supplied");
        this.tables = Collections.unmodifiableList(tables);
    }

    /**
     * Returns the tables that needed joining.
     *
     * @return the referenced tables
     */
    public List<String> tables() {
        return tables;
    }

    @Override
    public String getUserMessage() {
        return "The query spans tables " + String.join(", ", tables) + ". " +
               "Add join definitions to the semantic layer that connect them.";
    }

    @Override
    public String getTechnicalMessage() {
        return super.getTechnicalMessage() + "Tables: " + tables + "\n";
    }
}
