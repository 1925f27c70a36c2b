package com.example.docextract.domain.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentFormatTest {

    @Test
    void fromFileNameIgnoresCase() {
        assertThat(DocumentFormat.fromFileName("Report.PDF")).contains(DocumentFormat.PDF);
        assertThat(DocumentFormat.fromFileName("notes.v2.docx")).contains(DocumentFormat.DOCX);
        assertThat(DocumentFormat.fromFileName("deck.Pptx")).contains(DocumentFormat.PPTX);
    }

    @Test
    void fromFileNameRejectsUnknownOrMissingExtensions() {
        assertThat(DocumentFormat.fromFileName("notes.txt")).isEmpty();
        assertThat(DocumentFormat.fromFileName("README")).isEmpty();
        assertThat(DocumentFormat.fromFileName("trailing.")).isEmpty();
        assertThat(DocumentFormat.fromFileName(null)).isEmpty();
    }

    @Test
    void fromPathUsesTheFileNameOnly() {
        assertThat(DocumentFormat.fromPath(Path.of("archive.pdf", "slides.pptx"))).contains(DocumentFormat.PPTX);
        assertThat(DocumentFormat.fromPath(Path.of("/"))).isEmpty();
    }

    @Test
    void presentationsCountSlides() {
        assertThat(DocumentFormat.PPTX.locationLabel()).isEqualTo("slide");
        assertThat(DocumentFormat.DOCX.locationLabel()).isEqualTo("page");
    }
}
