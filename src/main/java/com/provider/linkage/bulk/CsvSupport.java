package com.provider.linkage.bulk;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Minimal CSV parsing and rendering: comma separated, double-quoted fields with doubled quotes
 * as escapes, one record per line.
 */
public final class CsvSupport {

    private CsvSupport() {
    }

    /**
     * Splits one line into fields.
     *
     * @throws IllegalArgumentException on an unterminated quoted field
     */
    public static List<String> parseLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (quoted) {
            throw new IllegalArgumentException("Unterminated quoted field");
        }
        fields.add(current.toString());
        return fields;
    }

    /**
     * Quotes a value when it contains a comma, quote or line break. {@code null} renders empty.
     */
    public static String escape(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    /**
     * Renders a number without exponent or trailing zeros. {@code null} renders empty.
     */
    public static String number(Double value) {
        if (value == null) {
            return "";
        }
        BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
        if (decimal.scale() < 0) {
            decimal = decimal.setScale(0);
        }
        return decimal.toPlainString();
    }

    public static String join(List<String> fields) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(escape(fields.get(i)));
        }
        return sb.toString();
    }

    /**
     * Column positions of a header row. Column names are matched case-insensitively.
     */
    public static final class Header {
        private final Map<String, Integer> positions = new HashMap<>();

        public Header(List<String> columns) {
            for (int i = 0; i < columns.size(); i++) {
                positions.putIfAbsent(columns.get(i).trim().toLowerCase(Locale.ROOT), i);
            }
        }

        public boolean has(String column) {
            return positions.containsKey(column);
        }

        /**
         * Trimmed value of {@code column}, or {@code null} when the column is absent or the
         * field is blank.
         */
        public String get(List<String> row, String column) {
            Integer index = positions.get(column);
            if (index == null || index >= row.size()) {
                return null;
            }
            String value = row.get(index).trim();
            return value.isEmpty() ? null : value;
        }

        public void require(String... columns) {
            for (String column : columns) {
                if (!has(column)) {
                    throw new IllegalArgumentException("Missing required column: " + column);
                }
            }
        }
    }
}
