package com.example.docextract.infrastructure.pdf;

import com.example.docextract.domain.model.DocumentFormat;
import com.example.docextract.domain.model.ExtractedImage;
import com.example.docextract.domain.model.ExtractedTable;
import com.example.docextract.domain.model.Hyperlink;
import com.example.docextract.domain.model.TextBlock;
import com.example.docextract.infrastructure.document.ExtractionWarnings;
import com.example.docextract.infrastructure.document.LoadedDocument;
import com.example.docextract.infrastructure.exception.CorruptDocumentException;
import com.example.docextract.support.TestDocuments;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Exercises the PDFBox loader and extractor against generated PDFs.
 */
class PdfBoxContentExtractorTest {

    private final PdfBoxDocumentLoader loader = new PdfBoxDocumentLoader(new PdfBoxMetadataReader());
    private final PdfBoxContentExtractor extractor = new PdfBoxContentExtractor();

    @TempDir
    Path tempDir;

    @Test
    void loadReadsPageCountAndSize() throws Exception {
        Path pdf = TestDocuments.reportPdf(tempDir, "report.pdf");

        try (LoadedDocument document = loader.load(pdf)) {
            assertThat(document.format()).isEqualTo(DocumentFormat.PDF);
            assertThat(document.metadata().pageCount()).isEqualTo(3);
            assertThat(document.metadata().fileSizeBytes()).isEqualTo(Files.size(pdf));
            assertThat(document.metadata().fileName()).isEqualTo("report.pdf");
            assertThat(document.unwrap(PDDocument.class).getNumberOfPages()).isEqualTo(3);
        }
    }

    @Test
    void closeReleasesTheHandle() throws Exception {
        LoadedDocument document = loader.load(TestDocuments.plainPdf(tempDir, "plain.pdf", "Hello"));

        document.close();

        assertThat(document.isClosed()).isTrue();
        assertThrows(IllegalStateException.class, () -> document.unwrap(PDDocument.class));
    }

    /**
     * Headings are lines set noticeably larger than the body text.
     */
    @Test
    void extractTextFlagsLargeLinesAsHeadings() throws Exception {
        try (LoadedDocument document = loader.load(TestDocuments.reportPdf(tempDir, "report.pdf"))) {
            List<TextBlock> blocks = extractor.extractText(document, new ExtractionWarnings("report.pdf"));

            assertThat(blocks).extracting(TextBlock::content)
                    .contains("Quarterly Report", "Revenue grew in every region.", "Closing remarks");
            assertThat(blocks).filteredOn(block -> block.content().equals("Quarterly Report"))
                    .singleElement()
                    .satisfies(block -> {
                        assertThat(block.heading()).isTrue();
                        assertThat(block.location()).isEqualTo(1);
                        assertThat(block.style()).contains("Helvetica");
                    });
            assertThat(blocks).filteredOn(block -> block.content().startsWith("Revenue"))
                    .singleElement()
                    .satisfies(block -> assertThat(block.heading()).isFalse());
            assertThat(blocks).extracting(TextBlock::location).isSorted();
        }
    }

    @Test
    void extractTablesFindsTheTableOnPageTwo() throws Exception {
        try (LoadedDocument document = loader.load(TestDocuments.reportPdf(tempDir, "report.pdf"))) {
            List<ExtractedTable> tables = extractor.extractTables(document, new ExtractionWarnings("report.pdf"));

            assertThat(tables).hasSize(1);
            ExtractedTable table = tables.get(0);
            assertThat(table.location()).isEqualTo(2);
            assertThat(table.sequence()).isEqualTo(1);
            assertThat(table.rowCount()).isEqualTo(3);
            assertThat(table.columnCount()).isEqualTo(3);
            assertThat(table.rows()).isEqualTo(TestDocuments.PDF_TABLE);
        }
    }

    @Test
    void extractLinksReadsUriAnnotations() throws Exception {
        try (LoadedDocument document = loader.load(TestDocuments.reportPdf(tempDir, "report.pdf"))) {
            List<Hyperlink> links = extractor.extractLinks(document, new ExtractionWarnings("report.pdf"));

            assertThat(links).singleElement().satisfies(link -> {
                assertThat(link.url()).isEqualTo(TestDocuments.PDF_LINK);
                assertThat(link.location()).isEqualTo(1);
                assertThat(link.text()).contains("Visit");
            });
        }
    }

    @Test
    void documentWithoutLinksYieldsNoLinks() throws Exception {
        try (LoadedDocument document = loader.load(TestDocuments.plainPdf(tempDir, "plain.pdf", "No links here"))) {
            assertThat(extractor.extractLinks(document, new ExtractionWarnings("plain.pdf"))).isEmpty();
        }
    }

    @Test
    void extractImagesReencodesLosslessImagesAsPng() throws Exception {
        try (LoadedDocument document = loader.load(TestDocuments.reportPdf(tempDir, "report.pdf"))) {
            List<ExtractedImage> images = extractor.extractImages(document, new ExtractionWarnings("report.pdf"));

            assertThat(images).singleElement().satisfies(image -> {
                assertThat(image.location()).isEqualTo(3);
                assertThat(image.format()).isEqualTo("png");
                assertThat(image.width()).isEqualTo(20);
                assertThat(image.height()).isEqualTo(10);
                assertThat(image.data()).isNotEmpty();
            });
        }
    }

    @Test
    void loadRejectsGarbage() throws Exception {
        Path garbage = Files.writeString(tempDir.resolve("garbage.pdf"), "this is not a PDF at all");

        assertThrows(CorruptDocumentException.class, () -> loader.load(garbage));
    }

    /**
     * Cutting a multi-page file in half removes the cross-reference table, so PDFBox falls back to
     * scanning for objects. The file is then either rejected as corrupt or opened with whatever
     * could be recovered; extraction must not fail and must stay within the recovered page range.
     */
    @Test
    void truncatedPdfIsRecoveredOrRejectedAsCorrupt() throws Exception {
        byte[] complete = Files.readAllBytes(TestDocuments.reportPdf(tempDir, "complete.pdf"));
        Path truncated = Files.write(tempDir.resolve("truncated.pdf"), Arrays.copyOf(complete, complete.length / 2));

        LoadedDocument document;
        try {
            document = loader.load(truncated);
        } catch (CorruptDocumentException ex) {
            assertThat(ex).hasMessageContaining("truncated.pdf");
            return;
        }
        try (document) {
            int pageCount = document.metadata().pageCount();
            ExtractionWarnings warnings = new ExtractionWarnings("truncated.pdf");

            assertThat(extractor.extractText(document, warnings))
                    .allSatisfy(block -> assertThat(block.location()).isBetween(1, pageCount));
            assertThat(extractor.extractLinks(document, warnings))
                    .allSatisfy(link -> assertThat(link.location()).isBetween(1, pageCount));
            assertThat(extractor.extractImages(document, warnings))
                    .allSatisfy(image -> assertThat(image.location()).isBetween(1, pageCount));
            assertThat(extractor.extractTables(document, warnings))
                    .allSatisfy(table -> assertThat(table.location()).isBetween(1, pageCount));
        }
    }

    @Test
    void loadRejectsEmptyFile() throws Exception {
        Path empty = Files.createFile(tempDir.resolve("empty.pdf"));

        assertThrows(CorruptDocumentException.class, () -> loader.load(empty));
    }
}
