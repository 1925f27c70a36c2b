package com.example.docextract.domain.model;

/**
 * Hyperlink found in a document.
 *
 * @param location 1-based page or slide number
 * @param text     anchor text, empty when the link has no visible text
 * @param url      link target
 */
public record Hyperlink(
        int location,
        String text,
        String url
) {

    public Hyperlink {
        text = text == null ? "" : text;
        url = url == null ? "" : url;
    }
}
