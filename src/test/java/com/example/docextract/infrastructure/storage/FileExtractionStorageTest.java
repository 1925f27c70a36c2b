package com.example.docextract.infrastructure.storage;

import com.example.docextract.config.ExtractorProperties;
import com.example.docextract.domain.model.DocumentFormat;
import com.example.docextract.domain.model.ExtractionResult;
import com.example.docextract.domain.model.StorageBackend;
import com.example.docextract.domain.model.StorageReceipt;
import com.example.docextract.domain.model.TextBlock;
import com.example.docextract.infrastructure.document.LoadedDocument;
import com.example.docextract.infrastructure.exception.StorageWriteException;
import com.example.docextract.support.TestDocuments;
import com.example.docextract.support.TestResults;
import com.example.docextract.support.TestServices;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FileExtractionStorageTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path outputRoot;

    @TempDir
    Path inputDir;

    private FileExtractionStorage storage;

    @BeforeEach
    void setUp() {
        ExtractorProperties.Storage settings = new ExtractorProperties.Storage();
        settings.setOutputRoot(outputRoot.toString());
        storage = new FileExtractionStorage(settings, objectMapper);
    }

    @Test
    void documentTextEqualsBlocksJoinedByNewline() throws Exception {
        ExtractionResult result = TestResults.sample(DocumentFormat.DOCX, "annual.docx");

        StorageReceipt receipt = storage.save(result);

        Path textDir = outputRoot.resolve("DOCX/text/annual");
        String expected = result.textBlocks().stream().map(TextBlock::content).collect(Collectors.joining("\n"));
        assertThat(Files.readString(textDir.resolve("document.txt"))).isEqualTo(expected);
        assertThat(Files.readString(textDir.resolve("page-001.txt"))).isEqualTo("Annual Report\nSales rose, costs fell.");
        assertThat(Files.readString(textDir.resolve("page-002.txt"))).isEqualTo("Outlook");
        assertThat(receipt.backend()).isEqualTo(StorageBackend.FILE);
        assertThat(receipt.location()).endsWith("DOCX");
    }

    @Test
    void linksAndTablesAreWrittenAsCsv() throws Exception {
        storage.save(TestResults.sample(DocumentFormat.PDF, "annual.pdf"));

        assertThat(Files.readAllLines(outputRoot.resolve("PDF/links/annual/links.csv")))
                .containsExactly("text,url,page", "Investor site,https://example.com/ir,2");
        assertThat(Files.readAllLines(outputRoot.resolve("PDF/tables/annual/table-001-page-001.csv")))
                .containsExactly("Year,Revenue", "2024,\"1,200\"");
    }

    @Test
    void imagesKeepTheirBytesAndExtension() throws Exception {
        ExtractionResult result = TestResults.sample(DocumentFormat.PPTX, "deck.pptx");

        storage.save(result);

        Path image = outputRoot.resolve("PPTX/images/deck/image-001-page-002.png");
        assertThat(image).exists();
        assertThat(Files.readAllBytes(image)).isEqualTo(result.images().get(0).data());
    }

    @Test
    void extractedDocxPictureBecomesOneImageFile() throws Exception {
        Path docx = TestDocuments.reportDocx(inputDir, "overview.docx");
        ExtractionResult result;
        try (LoadedDocument document = TestServices.loaderService().load(docx)) {
            result = TestServices.extractionService().extractAll(document);
        }

        storage.save(result);

        try (Stream<Path> files = Files.list(outputRoot.resolve("DOCX/images/overview"))) {
            assertThat(files.map(path -> path.getFileName().toString()))
                    .containsExactly("image-001-page-002.png");
        }
    }

    @Test
    void metadataIsWrittenAsJson() throws Exception {
        storage.save(TestResults.sample(DocumentFormat.PDF, "annual.pdf"));

        JsonNode json = objectMapper.readTree(outputRoot.resolve("PDF/metadata/annual/metadata.json").toFile());
        assertThat(json.get("format").asText()).isEqualTo("PDF");
        assertThat(json.get("title").asText()).isEqualTo("Annual Report");
        assertThat(json.get("createdAt").asText()).isEqualTo("2024-01-02T03:04:05Z");
        assertThat(json.get("modifiedAt").isNull()).isTrue();
        assertThat(json.get("pageCount").asInt()).isEqualTo(2);
    }

    @Test
    void emptyCollectionsProduceNoFiles() throws Exception {
        ExtractionResult empty = new ExtractionResult(
                TestResults.metadata(DocumentFormat.PDF, "blank.pdf", 1), List.of(), List.of(), List.of(), List.of(), List.of());

        storage.save(empty);

        try (Stream<Path> files = Files.walk(outputRoot)) {
            assertThat(files.filter(Files::isRegularFile).map(path -> path.getFileName().toString()))
                    .containsExactly("metadata.json");
        }
    }

    @Test
    void savingTwiceOverwritesArtifacts() throws Exception {
        ExtractionResult result = TestResults.sample(DocumentFormat.DOCX, "annual.docx");

        storage.save(result);
        storage.save(result);

        assertThat(Files.readString(outputRoot.resolve("DOCX/text/annual/document.txt"))).isEqualTo(result.fullText());
    }

    @Test
    void unwritableRootFailsWithStorageWriteException() throws Exception {
        Path blocker = Files.writeString(outputRoot.resolve("not-a-directory"), "x");
        ExtractorProperties.Storage settings = new ExtractorProperties.Storage();
        settings.setOutputRoot(blocker.toString());
        FileExtractionStorage blocked = new FileExtractionStorage(settings, objectMapper);

        assertThrows(StorageWriteException.class,
                () -> blocked.save(TestResults.sample(DocumentFormat.PDF, "annual.pdf")));
    }
}
