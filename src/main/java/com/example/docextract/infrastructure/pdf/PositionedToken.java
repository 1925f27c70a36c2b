package com.example.docextract.infrastructure.pdf;

/**
 * Run of glyphs on one line with its horizontal extent and font.
 * PDFBox reports one token per word group it separates by spacing.
 */
final class PositionedToken {
    private final float x;
    private final float endX;
    private final String text;
    private final String fontName;
    private final float fontSize;

    PositionedToken(float x, float endX, String text, String fontName, float fontSize) {
        this.x = x;
        this.endX = Math.max(endX, x);
        this.text = text == null ? "" : text;
        this.fontName = fontName;
        this.fontSize = fontSize;
    }

    float x() {
        return x;
    }

    float endX() {
        return endX;
    }

    float center() {
        return x + ((endX - x) / 2f);
    }

    String text() {
        return text;
    }

    String fontName() {
        return fontName;
    }

    float fontSize() {
        return fontSize;
    }
}
