package com.example.docextract.infrastructure.pdf;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds tables on a page by column alignment. PDF has no table structure, so a table is two or
 * more consecutive lines that split into the same number (at least two) of cells whose left edges,
 * right edges or centres line up.
 */
final class PdfTableDetector {
    private static final float MIN_CELL_GAP = 6f;
    private static final float ALIGN_TOLERANCE = 6f;
    private static final int MIN_COLUMNS = 2;
    private static final int MIN_ROWS = 2;

    private PdfTableDetector() {
    }

    /**
     * Detects the tables among the lines of one page.
     *
     * @param lines page lines, top to bottom
     * @return tables top to bottom, each as rows of cell strings
     */
    static List<List<List<String>>> detect(List<TextLine> lines) {
        List<List<List<String>>> tables = new ArrayList<>();
        List<List<PositionedToken>> run = new ArrayList<>();
        for (TextLine line : lines) {
            List<PositionedToken> cells = line.cells(cellGap(line));
            boolean candidate = cells.size() >= MIN_COLUMNS;
            if (candidate && (run.isEmpty() || aligned(run.get(0), cells))) {
                run.add(cells);
                continue;
            }
            flush(run, tables);
            run = new ArrayList<>();
            if (candidate) {
                run.add(cells);
            }
        }
        flush(run, tables);
        return tables;
    }

    private static float cellGap(TextLine line) {
        return Math.max(MIN_CELL_GAP, line.averageFontSize());
    }

    private static boolean aligned(List<PositionedToken> reference, List<PositionedToken> cells) {
        if (reference.size() != cells.size()) {
            return false;
        }
        for (int i = 0; i < cells.size(); i++) {
            PositionedToken expected = reference.get(i);
            PositionedToken actual = cells.get(i);
            boolean matches = Math.abs(expected.x() - actual.x()) <= ALIGN_TOLERANCE
                    || Math.abs(expected.endX() - actual.endX()) <= ALIGN_TOLERANCE
                    || Math.abs(expected.center() - actual.center()) <= ALIGN_TOLERANCE;
            if (!matches) {
                return false;
            }
        }
        return true;
    }

    private static void flush(List<List<PositionedToken>> run, List<List<List<String>>> tables) {
        if (run.size() < MIN_ROWS) {
            return;
        }
        List<List<String>> rows = new ArrayList<>(run.size());
        for (List<PositionedToken> cells : run) {
            rows.add(cells.stream().map(PositionedToken::text).toList());
        }
        tables.add(rows);
    }
}
