package com.example.docextract.application.service;

import com.example.docextract.domain.model.DocumentMetadata;
import com.example.docextract.domain.model.ExtractedImage;
import com.example.docextract.domain.model.ExtractedTable;
import com.example.docextract.domain.model.ExtractionResult;
import com.example.docextract.domain.model.Hyperlink;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders a human-readable summary of an extraction result for console output.
 * Tables are drawn as text grids with the first row as header.
 */
@Component
public class ExtractionReportFormatter {

    static final int TEXT_PREVIEW_LENGTH = 500;

    public String format(ExtractionResult result) {
        DocumentMetadata metadata = result.metadata();
        String format = metadata.format().name();
        String location = capitalize(metadata.format().locationLabel());
        StringBuilder out = new StringBuilder();

        out.append("\n========== Extracted Data from ").append(format).append(" ==========\n\n");

        out.append("----- Extracted Text -----\n\n");
        String text = result.fullText();
        out.append(text.length() > TEXT_PREVIEW_LENGTH ? text.substring(0, TEXT_PREVIEW_LENGTH) + "..." : text).append('\n');

        appendIfPresent(out, "Title", metadata.title());
        appendIfPresent(out, "Author", metadata.author());
        appendIfPresent(out, "Last modified by", metadata.lastModifiedBy());
        appendIfPresent(out, "Created", metadata.createdAt());
        appendIfPresent(out, "Modified", metadata.modifiedAt());
        out.append(location).append(" count: ").append(metadata.pageCount()).append('\n');

        if (!result.images().isEmpty()) {
            out.append("----- Extracted Images (").append(format).append(") -----\n\n");
            for (ExtractedImage image : result.images()) {
                out.append("Image ").append(image.sequence())
                        .append(": Format: ").append(image.format())
                        .append(", Resolution: ").append(image.resolution())
                        .append(", ").append(location).append(": ").append(image.location())
                        .append('\n');
            }
            out.append('\n');
        }

        if (!result.links().isEmpty()) {
            out.append("----- Extracted Links -----\n\n");
            for (Hyperlink link : result.links()) {
                out.append("URL: ").append(link.url())
                        .append(" (").append(location).append(' ').append(link.location()).append(")\n");
            }
            out.append('\n');
        }

        if (!result.tables().isEmpty()) {
            out.append("----- Extracted Tables (").append(format).append(") -----\n\n");
            for (ExtractedTable table : result.tables()) {
                out.append("Table ").append(table.sequence()).append(":\n\n");
                out.append(grid(table));
                out.append("\n-----------------------------\n\n");
            }
        }

        out.append("========== End of Extraction for ").append(format).append(" ==========\n");
        return out.toString();
    }

	/**
	 * Draws a table as an ASCII grid. Short rows are padded with empty cells and the header row is
	 * separated with {@code =}.
	 *
	 * @param table table to render
	 * @return grid with a trailing newline
	 */
    String grid(ExtractedTable table) {
        int columns = table.columnCount();
        int[] widths = new int[columns];
        List<List<String>> rows = new ArrayList<>();
        for (List<String> row : table.rows()) {
            List<String> padded = new ArrayList<>(columns);
            for (int c = 0; c < columns; c++) {
                String cell = c < row.size() && row.get(c) != null ? row.get(c).replace('\n', ' ') : "";
                padded.add(cell);
                widths[c] = Math.max(widths[c], cell.length());
            }
            rows.add(padded);
        }

        StringBuilder out = new StringBuilder();
        out.append(border(widths, '-'));
        for (int r = 0; r < rows.size(); r++) {
            out.append('|');
            for (int c = 0; c < columns; c++) {
                String cell = rows.get(r).get(c);
                out.append(' ').append(cell).append(" ".repeat(widths[c] - cell.length())).append(" |");
            }
            out.append('\n');
            out.append(border(widths, r == 0 && rows.size() > 1 ? '=' : '-'));
        }
        return out.toString();
    }

    private static String border(int[] widths, char fill) {
        StringBuilder line = new StringBuilder("+");
        for (int width : widths) {
            line.append(String.valueOf(fill).repeat(width + 2)).append('+');
        }
        return line.append('\n').toString();
    }

    private static void appendIfPresent(StringBuilder out, String label, Object value) {
        if (value != null) {
            out.append(label).append(": ").append(value).append('\n');
        }
    }

    private static String capitalize(String value) {
        return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1);
    }
}
