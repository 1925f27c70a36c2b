package com.example.docextract.infrastructure.storage;

import java.util.List;

/**
 * Minimal RFC 4180 style CSV rendering for link lists and tables.
 */
final class CsvFormatter {

    private CsvFormatter() {
    }

	/**
	 * Renders rows as CSV, one line per row, terminated by {@code \n}.
	 *
	 * @param rows rows of raw values
	 * @return CSV document as a string
	 */
    static String format(List<List<String>> rows) {
        StringBuilder builder = new StringBuilder();
        for (List<String> row : rows) {
            for (int i = 0; i < row.size(); i++) {
                if (i > 0) {
                    builder.append(',');
                }
                builder.append(escape(row.get(i)));
            }
            builder.append('\n');
        }
        return builder.toString();
    }

	/**
	 * Escapes CSV values by quoting entries containing commas, quotes, or line breaks.
	 *
	 * @param value raw column value
	 * @return CSV-safe token
	 */
    static String escape(String value) {
        if (value == null) {
            return "";
        }
        String sanitized = value.replace("\"", "\"\"");
        if (sanitized.contains(",") || sanitized.contains("\"") || sanitized.contains("\n") || sanitized.contains("\r")) {
            return "\"" + sanitized + "\"";
        }
        return sanitized;
    }
}
