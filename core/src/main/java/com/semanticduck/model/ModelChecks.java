package com.semanticduck.model;

import java.util.Objects;

/**
 * Argument checks shared by the model constructors.
 */
final class ModelChecks {

    private ModelChecks() {}

    static String requireText(String value, String field) {
        Objects.requireNonNull(value, field + " must not be null");
        if (value.trim().isEmpty()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
