package com.example.docextract.infrastructure.pdf;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Single line of page text with ordered positioned tokens.
 */
final class TextLine {
    private final float y;
    private final List<PositionedToken> tokens = new ArrayList<>();
    private boolean sorted = false;

    TextLine(float y) {
        this.y = y;
    }

    void addToken(PositionedToken token) {
        if (token == null) {
            return;
        }
        tokens.add(token);
        sorted = false;
    }

    List<PositionedToken> tokens() {
        if (!sorted) {
            tokens.sort(Comparator.comparing(PositionedToken::x));
            sorted = true;
        }
        return tokens;
    }

    float y() {
        return y;
    }

    String text() {
        String joined = tokens().stream()
                .map(PositionedToken::text)
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .collect(Collectors.joining(" "));
        return joined.trim();
    }

    float averageFontSize() {
        return (float) tokens().stream()
                .mapToDouble(PositionedToken::fontSize)
                .filter(size -> size > 0)
                .average()
                .orElse(0d);
    }

    /**
     * @return font covering the most characters on the line, or {@code null}
     */
    String dominantFont() {
        Map<String, Integer> weights = new HashMap<>();
        for (PositionedToken token : tokens()) {
            if (token.fontName() != null && !token.fontName().isBlank()) {
                weights.merge(token.fontName(), token.text().length(), Integer::sum);
            }
        }
        return weights.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse(null);
    }

    /**
     * Groups tokens into cells: neighbours closer than {@code minGap} belong to the same cell.
     *
     * @param minGap horizontal distance that separates two cells
     * @return cells from left to right
     */
    List<PositionedToken> cells(float minGap) {
        List<PositionedToken> cells = new ArrayList<>();
        PositionedToken current = null;
        for (PositionedToken token : tokens()) {
            String value = token.text().strip();
            if (value.isEmpty()) {
                continue;
            }
            if (current != null && token.x() - current.endX() < minGap) {
                current = new PositionedToken(current.x(), Math.max(current.endX(), token.endX()),
                        current.text() + " " + value, current.fontName(), current.fontSize());
            } else {
                if (current != null) {
                    cells.add(current);
                }
                current = new PositionedToken(token.x(), token.endX(), value, token.fontName(), token.fontSize());
            }
        }
        if (current != null) {
            cells.add(current);
        }
        return cells;
    }
}
