package com.example.docextract.domain.model;

import java.util.List;

/**
 * Tabular content flattened to ordered rows of ordered cell strings.
 * Nested tables are not represented; their text ends up in the enclosing cell.
 *
 * @param sequence 1-based position of the table in the document
 * @param location 1-based page or slide number
 * @param rows     cell values, row by row
 */
public record ExtractedTable(
        int sequence,
        int location,
        List<List<String>> rows
) {

    public ExtractedTable {
        rows = rows == null
                ? List.of()
                : rows.stream().map(row -> row == null ? List.<String>of() : List.copyOf(row)).toList();
    }

    public int rowCount() {
        return rows.size();
    }

    /**
     * @return width of the widest row
     */
    public int columnCount() {
        return rows.stream().mapToInt(List::size).max().orElse(0);
    }
}
