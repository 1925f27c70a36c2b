package com.example.docextract.application.service;

import com.example.docextract.domain.model.DocumentFormat;
import com.example.docextract.domain.model.ExtractedTable;
import com.example.docextract.domain.model.ExtractionResult;
import com.example.docextract.domain.model.TextBlock;
import com.example.docextract.support.TestResults;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractionReportFormatterTest {

    private final ExtractionReportFormatter formatter = new ExtractionReportFormatter();

    @Test
    void reportListsEverySection() throws Exception {
        String report = formatter.format(TestResults.sample(DocumentFormat.PPTX, "deck.pptx"));

        assertThat(report).contains("========== Extracted Data from PPTX ==========");
        assertThat(report).contains("Annual Report\nSales rose, costs fell.\nOutlook");
        assertThat(report).contains("Author: Jane Roe");
        assertThat(report).contains("Slide count: 2");
        assertThat(report).contains("Image 1: Format: png, Resolution: 4x3, Slide: 2");
        assertThat(report).contains("URL: https://example.com/ir (Slide 2)");
        assertThat(report).contains("Table 1:");
        assertThat(report).contains("========== End of Extraction for PPTX ==========");
    }

    @Test
    void longTextIsTruncated() {
        String longText = "x".repeat(ExtractionReportFormatter.TEXT_PREVIEW_LENGTH + 20);
        ExtractionResult result = new ExtractionResult(TestResults.metadata(DocumentFormat.PDF, "long.pdf", 1),
                List.of(new TextBlock(1, longText, null, false, null)),
                List.of(), List.of(), List.of(), List.of());

        String report = formatter.format(result);

        assertThat(report).contains("x".repeat(ExtractionReportFormatter.TEXT_PREVIEW_LENGTH) + "...");
        assertThat(report).doesNotContain("x".repeat(ExtractionReportFormatter.TEXT_PREVIEW_LENGTH + 1));
    }

    @Test
    void gridPadsShortRowsAndSeparatesTheHeader() {
        ExtractedTable table = new ExtractedTable(1, 1, List.of(List.of("Name", "Qty"), List.of("Pen")));

        assertThat(formatter.grid(table)).isEqualTo(
                "+------+-----+\n"
                        + "| Name | Qty |\n"
                        + "+======+=====+\n"
                        + "| Pen  |     |\n"
                        + "+------+-----+\n");
    }
}
