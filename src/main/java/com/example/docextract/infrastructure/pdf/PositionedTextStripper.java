package com.example.docextract.infrastructure.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Strips one page while keeping token positions and fonts, grouped into lines by Y coordinate.
 */
final class PositionedTextStripper extends PDFTextStripper {
    private static final float Y_TOLERANCE = 1.5f;
    private final List<TextLine> lines = new ArrayList<>();

    private PositionedTextStripper() throws IOException {
        setSortByPosition(true);
        setShouldSeparateByBeads(true);
        setSuppressDuplicateOverlappingText(false);
        setLineSeparator("\n");
        setWordSeparator(" ");
    }

    /**
     * Collects the lines of a single page, top to bottom.
     *
     * @param document   loaded PDF document
     * @param pageNumber 1-based page number
     * @return lines of the page
     * @throws IOException when PDFBox cannot read the page content
     */
    static List<TextLine> linesOf(PDDocument document, int pageNumber) throws IOException {
        PositionedTextStripper stripper = new PositionedTextStripper();
        stripper.setStartPage(pageNumber);
        stripper.setEndPage(pageNumber);
        stripper.writeText(document, new StringWriter());
        return stripper.getLines();
    }

    private List<TextLine> getLines() {
        lines.sort(Comparator.comparing(TextLine::y));
        return new ArrayList<>(lines);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        if (!textPositions.isEmpty()) {
            StringBuilder builder = new StringBuilder();
            for (TextPosition position : textPositions) {
                builder.append(position.getUnicode());
            }
            String tokenText = builder.toString();
            if (!tokenText.isBlank()) {
                float tokenX = textPositions.stream()
                        .map(TextPosition::getXDirAdj)
                        .min(Float::compareTo)
                        .orElse(0f);
                float tokenEnd = textPositions.stream()
                        .map(position -> position.getXDirAdj() + position.getWidthDirAdj())
                        .max(Float::compareTo)
                        .orElse(tokenX);
                float tokenY = textPositions.stream()
                        .map(TextPosition::getYDirAdj)
                        .min(Float::compareTo)
                        .orElse(0f);
                TextPosition first = textPositions.get(0);
                String fontName = first.getFont() != null ? first.getFont().getName() : null;
                resolveLine(tokenY).addToken(new PositionedToken(
                        tokenX, Math.max(tokenEnd, tokenX + 0.5f), tokenText, fontName, first.getFontSizeInPt()));
            }
        }
        super.writeString(text, textPositions);
    }

    private TextLine resolveLine(float y) {
        for (TextLine line : lines) {
            if (Math.abs(line.y() - y) < Y_TOLERANCE) {
                return line;
            }
        }
        TextLine line = new TextLine(y);
        lines.add(line);
        return line;
    }
}
