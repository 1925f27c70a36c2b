package com.example.docextract.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ExtractionResultTest {

    private static DocumentMetadata metadata(int pageCount) {
        return new DocumentMetadata(DocumentFormat.PDF, "/in/report.pdf", "report.pdf", 10L,
                null, null, null, Instant.EPOCH, null, pageCount);
    }

    @Test
    void collectionsDefaultToEmptyAndAreImmutable() {
        List<TextBlock> blocks = new ArrayList<>(List.of(new TextBlock(1, "Intro", null, false, null)));
        ExtractionResult result = new ExtractionResult(metadata(1), blocks, null, null, null, null);
        blocks.clear();

        assertThat(result.textBlocks()).hasSize(1);
        assertThat(result.links()).isEmpty();
        assertThat(result.images()).isEmpty();
        assertThat(result.tables()).isEmpty();
        assertThat(result.warnings()).isEmpty();
        assertThrows(UnsupportedOperationException.class, () -> result.textBlocks().add(new TextBlock(1, "x", null, false, null)));
    }

    @Test
    void fullTextJoinsBlocksInOrder() {
        ExtractionResult result = new ExtractionResult(metadata(2), List.of(
                new TextBlock(1, "First", null, true, 18f),
                new TextBlock(2, "Second", null, false, 11f)), null, null, null, null);

        assertThat(result.fullText()).isEqualTo("First\nSecond");
    }

    @Test
    void locationsMustFallInsideTheDocument() {
        assertThrows(IllegalArgumentException.class, () -> new ExtractionResult(metadata(2),
                null, List.of(new Hyperlink(3, "Out", "https://example.com")), null, null, null));
        assertThrows(IllegalArgumentException.class, () -> new ExtractionResult(metadata(2),
                null, null, null, List.of(new ExtractedTable(1, 0, List.of(List.of("a")))), null));
    }

    @Test
    void documentNameDropsTheExtension() {
        assertThat(metadata(1).documentName()).isEqualTo("report");
    }

    @Test
    void negativePageCountIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> metadata(-1));
    }
}
