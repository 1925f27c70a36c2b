package com.example.docextract.application.service;

import com.example.docextract.application.exception.UseCaseValidationException;
import com.example.docextract.config.ExtractorProperties;
import com.example.docextract.domain.model.BatchReport;
import com.example.docextract.domain.model.PipelineOutcome;
import com.example.docextract.domain.model.PipelineStatus;
import com.example.docextract.infrastructure.storage.FileExtractionStorage;
import com.example.docextract.support.TestDocuments;
import com.example.docextract.support.TestServices;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BatchExtractionServiceTest {

    @TempDir
    Path tempDir;

    private Path inputDir;
    private Path outputDir;
    private BatchExtractionService batchService;

    @BeforeEach
    void setUp() throws Exception {
        inputDir = Files.createDirectory(tempDir.resolve("in"));
        outputDir = tempDir.resolve("out");
        ExtractorProperties.Storage settings = new ExtractorProperties.Storage();
        settings.setOutputRoot(outputDir.toString());
        DocumentLoaderService loaderService = TestServices.loaderService();
        DocumentPipelineService pipeline = new DocumentPipelineService(loaderService,
                TestServices.extractionService(), new FileExtractionStorage(settings, new ObjectMapper()));
        batchService = new BatchExtractionService(pipeline, loaderService);
    }

    @Test
    void badFileDoesNotStopTheOthers() throws Exception {
        TestDocuments.reportDocx(inputDir, "b-report.docx");
        Files.writeString(inputDir.resolve("a-broken.pdf"), "not a pdf");
        TestDocuments.roadmapPptx(inputDir, "c-roadmap.pptx");
        Files.writeString(inputDir.resolve("notes.txt"), "ignored");

        List<PipelineOutcome> seen = new ArrayList<>();
        BatchReport report = batchService.run(List.of(inputDir), seen::add);

        assertThat(report.outcomes()).extracting(outcome -> Path.of(outcome.source()).getFileName().toString())
                .containsExactly("a-broken.pdf", "b-report.docx", "c-roadmap.pptx");
        assertThat(report.outcomes()).extracting(PipelineOutcome::status)
                .containsExactly(PipelineStatus.FAILED, PipelineStatus.SUCCEEDED, PipelineStatus.SUCCEEDED);
        assertThat(report.failed()).isEqualTo(1);
        assertThat(report.succeeded()).isEqualTo(2);
        assertThat(report.hasFailures()).isTrue();
        assertThat(seen).hasSize(3);
        assertThat(outputDir.resolve("DOCX/text/b-report/document.txt")).exists();
        assertThat(outputDir.resolve("PPTX/tables/c-roadmap/table-001-page-002.csv")).exists();
    }

    @Test
    void explicitFilesAreReportedEvenWhenMissing() throws Exception {
        Path pdf = TestDocuments.plainPdf(inputDir, "ok.pdf", "Fine");

        BatchReport report = batchService.run(List.of(pdf, inputDir.resolve("missing.pdf")));

        assertThat(report.outcomes()).extracting(PipelineOutcome::status)
                .containsExactly(PipelineStatus.SUCCEEDED, PipelineStatus.FAILED);
    }

    @Test
    void allSuccessfulRunHasNoFailures() throws Exception {
        TestDocuments.reportPdf(inputDir, "report.pdf");

        BatchReport report = batchService.run(List.of(inputDir));

        assertThat(report.hasFailures()).isFalse();
        assertThat(outputDir.resolve("PDF/images/report/image-001-page-003.png")).exists();
    }

    @Test
    void emptyInputIsRejected() {
        assertThrows(UseCaseValidationException.class, () -> batchService.run(List.of()));
    }
}
