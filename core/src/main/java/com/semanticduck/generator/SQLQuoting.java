package com.semanticduck.generator;

/**
 * Utilities for quoting SQL literals and checking identifiers.
 *
 * <p>The compiler's default literal rendering inlines string values between
 * single quotes without escaping. These helpers back the hardened rendering
 * modes and the runtime's schema binding.
 *
 * <p>Example usage:
 * <pre>
 *   String userInput = SQLQuoting.quoteLiteral("O'Reilly");
 *   // Result: 'O''Reilly'
 *
 *   SQLQuoting.validateIdentifier("thelook_ecommerce");   // passes
 *   SQLQuoting.validateIdentifier("x; DROP TABLE y");     // throws
 *   SQLQuoting.validateQualifiedIdentifier("shop.main");  // passes
 * </pre>
 */
public final class SQLQuoting {

    private SQLQuoting() {}

    /**
     * Quotes a string literal value.
     *
     * <p>Uses single quotes and escapes internal quotes according to SQL standard.
     * Returns NULL (without quotes) if the value is null.
     *
     * @param value the string value to quote
     * @return quoted literal safe for SQL, or NULL if value is null
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            return "NULL";
        }
        return "'" + value.replace("'", "''") + "'";
    }

    /**
     * Validates that a string is safe to use as an unquoted identifier.
     *
     * <p>Only allows identifiers that start with a letter or underscore and
     * contain only letters, digits and underscores.
     *
     * @param identifier the identifier to validate
     * @throws IllegalArgumentException if identifier is null, empty, or
     *         contains invalid characters
     */
    public static void validateIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }

        if (!identifier.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
            throw new IllegalArgumentException(
                "Invalid identifier (must start with letter/underscore, " +
                "contain only alphanumeric/underscore): " + identifier);
        }
    }

    /**
     * Validates a plain identifier or a {@code catalog.schema} pair.
     *
     * <p>Each dot-separated part must pass {@link #validateIdentifier(String)}.
     *
     * @param name the name to validate
     * @throws IllegalArgumentException if the name has more than two parts or
     *         any part is not a plain identifier
     */
    public static void validateQualifiedIdentifier(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        String[] parts = name.split("\\.", -1);
        if (parts.length > 2) {
            throw new IllegalArgumentException(
                "Qualified identifier must be 'name' or 'catalog.name': " + name);
        }
        for (String part : parts) {
            validateIdentifier(part);
        }
    }
}
