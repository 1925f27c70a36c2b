package com.example.docextract.domain.model;

/**
 * A run of extracted text located on one page or slide.
 *
 * @param location 1-based page or slide number
 * @param content  text of the block, never {@code null}
 * @param style    font name (PDF), paragraph style (DOCX) or shape kind (PPTX), may be {@code null}
 * @param heading  whether the block looks like a heading or title
 * @param fontSize font size in points when known
 */
public record TextBlock(
        int location,
        String content,
        String style,
        boolean heading,
        Float fontSize
) {

    public TextBlock {
        content = content == null ? "" : content;
    }
}
