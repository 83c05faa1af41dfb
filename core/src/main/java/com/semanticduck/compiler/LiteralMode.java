package com.semanticduck.compiler;

import com.semanticduck.generator.SQLQuoting;

import java.math.BigDecimal;
import java.util.List;

/**
 * How filter values are written into WHERE and HAVING.
 *
 * <ul>
 *   <li>{@code INLINE} (default): numbers bare, strings wrapped in single
 *       quotes with no escaping. A value containing {@code '} produces broken
 *       SQL; kept for output compatibility.</li>
 *   <li>{@code ESCAPED}: as INLINE, but internal quotes are doubled.</li>
 *   <li>{@code PARAMETERIZED}: every value becomes {@code ?} and is appended
 *       to the bind list in emission order.</li>
 * </ul>
 */
public enum LiteralMode {

    INLINE {
        @Override
        String render(Object value, List<Object> parameters) {
            if (value instanceof Number) {
                return numberToSQL((Number) value);
            }
            return "'" + value + "'";
        }
    },

    ESCAPED {
        @Override
        String render(Object value, List<Object> parameters) {
            if (value instanceof Number) {
                return numberToSQL((Number) value);
            }
            return SQLQuoting.quoteLiteral(value.toString());
        }
    },

    PARAMETERIZED {
        @Override
        String render(Object value, List<Object> parameters) {
            parameters.add(value);
            return "?";
        }
    };

    /**
     * Renders a filter value.
     *
     * @param value a Number or a String
     * @param parameters the bind list of the current compilation
     * @return the SQL text standing for the value
     */
    abstract String render(Object value, List<Object> parameters);

    /**
     * Parses a mode name (case-insensitive).
     *
     * @param value "inline", "escaped" or "parameterized"
     * @return the parsed mode
     * @throws IllegalArgumentException if value is not recognized
     */
    public static LiteralMode parse(String value) {
        if (value == null) {
            return INLINE;
        }
        return switch (value.trim().toLowerCase()) {
            case "inline" -> INLINE;
            case "escaped" -> ESCAPED;
            case "parameterized" -> PARAMETERIZED;
            default -> throw new IllegalArgumentException(
                "Unknown literal mode: '%s'. Valid values: inline, escaped, parameterized".formatted(value));
        };
    }

    private static String numberToSQL(Number number) {
        if (number instanceof BigDecimal) {
            return ((BigDecimal) number).toPlainString();
        }
        return number.toString();
    }
}
