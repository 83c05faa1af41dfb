package com.semanticduck.runtime;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders a {@link QueryResult} as a plain-text grid.
 *
 * <pre>
 * +----------+---------------+
 * | status   | total_revenue |
 * +==========+===============+
 * | Complete |         150.5 |
 * +----------+---------------+
 * </pre>
 *
 * <p>Numbers are right-aligned and everything else left-aligned. NULL
 * renders as an empty cell.
 */
public final class ResultTableRenderer {

    static final String NO_RESULTS = "Query returned no results.";

    private ResultTableRenderer() {}

    public static String render(QueryResult result) {
        Objects.requireNonNull(result, "result must not be null");
        if (result.rows().isEmpty()) {
            return NO_RESULTS;
        }

        List<String> columns = result.columns();
        int[] widths = new int[columns.size()];
        boolean[] numeric = new boolean[columns.size()];
        for (int c = 0; c < columns.size(); c++) {
            widths[c] = columns.get(c).length();
            numeric[c] = true;
        }

        List<List<String>> cells = new ArrayList<>(result.rows().size());
        for (List<Object> row : result.rows()) {
            List<String> rendered = new ArrayList<>(row.size());
            for (int c = 0; c < row.size(); c++) {
                Object value = row.get(c);
                String text = format(value);
                if (value != null && !(value instanceof Number)) {
                    numeric[c] = false;
                }
                widths[c] = Math.max(widths[c], text.length());
                rendered.add(text);
            }
            cells.add(rendered);
        }

        String border = border(widths, '-');
        StringBuilder sb = new StringBuilder();
        sb.append(border).append('\n');
        sb.append(line(columns, widths, new boolean[columns.size()])).append('\n');
        sb.append(border(widths, '=')).append('\n');
        for (List<String> row : cells) {
            sb.append(line(row, widths, numeric)).append('\n');
            sb.append(border).append('\n');
        }
        sb.setLength(sb.length() - 1);
        return sb.toString();
    }

    private static String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        return value.toString();
    }

    private static String border(int[] widths, char fill) {
        StringBuilder sb = new StringBuilder("+");
        for (int width : widths) {
            sb.append(String.valueOf(fill).repeat(width + 2)).append('+');
        }
        return sb.toString();
    }

    private static String line(List<String> values, int[] widths, boolean[] rightAlign) {
        StringBuilder sb = new StringBuilder("|");
        for (int c = 0; c < values.size(); c++) {
            String value = values.get(c);
            String padding = " ".repeat(widths[c] - value.length());
            sb.append(' ');
            if (rightAlign[c]) {
                sb.append(padding).append(value);
            } else {
                sb.append(value).append(padding);
            }
            sb.append(" |");
        }
        return sb.toString();
    }
}
