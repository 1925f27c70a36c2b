package com.example.docextract.application.service;

import com.example.docextract.domain.model.DocumentFormat;
import com.example.docextract.domain.model.ExtractionResult;
import com.example.docextract.domain.model.PipelineOutcome;
import com.example.docextract.domain.model.PipelineStatus;
import com.example.docextract.domain.model.StorageBackend;
import com.example.docextract.domain.model.StorageReceipt;
import com.example.docextract.infrastructure.exception.StorageConnectionException;
import com.example.docextract.infrastructure.storage.ExtractionStorage;
import com.example.docextract.support.TestDocuments;
import com.example.docextract.support.TestServices;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class DocumentPipelineServiceTest {

    @TempDir
    Path tempDir;

    private ExtractionStorage storage;
    private DocumentPipelineService pipeline;

    @BeforeEach
    void setUp() {
        storage = mock(ExtractionStorage.class);
        pipeline = new DocumentPipelineService(TestServices.loaderService(), TestServices.extractionService(), storage);
    }

    @Test
    void storedDocumentSucceeds() throws Exception {
        StorageReceipt receipt = new StorageReceipt(StorageBackend.FILE, "/out/PDF");
        given(storage.save(any())).willReturn(receipt);

        PipelineOutcome outcome = pipeline.process(TestDocuments.reportPdf(tempDir, "report.pdf"));

        assertThat(outcome.status()).isEqualTo(PipelineStatus.SUCCEEDED);
        assertThat(outcome.receipt()).isEqualTo(receipt);
        ArgumentCaptor<ExtractionResult> stored = ArgumentCaptor.forClass(ExtractionResult.class);
        verify(storage).save(stored.capture());
        assertThat(stored.getValue().format()).isEqualTo(DocumentFormat.PDF);
        assertThat(stored.getValue().tables()).hasSize(1);
    }

    @Test
    void storageFailureIsPartialFailure() throws Exception {
        given(storage.save(any())).willThrow(new StorageConnectionException("Database is unreachable", null));

        PipelineOutcome outcome = pipeline.process(TestDocuments.reportDocx(tempDir, "report.docx"));

        assertThat(outcome.status()).isEqualTo(PipelineStatus.PARTIALLY_FAILED);
        assertThat(outcome.result()).isNotNull();
        assertThat(outcome.message()).contains("unreachable");
    }

    @Test
    void missingFileFails() {
        PipelineOutcome outcome = pipeline.process(tempDir.resolve("missing.pptx"));

        assertThat(outcome.status()).isEqualTo(PipelineStatus.FAILED);
        assertThat(outcome.result()).isNull();
        verify(storage, never()).save(any());
    }

    @Test
    void corruptFileFails() throws Exception {
        Path corrupt = Files.writeString(tempDir.resolve("corrupt.pdf"), "garbage");

        PipelineOutcome outcome = pipeline.process(corrupt);

        assertThat(outcome.status()).isEqualTo(PipelineStatus.FAILED);
        assertThat(outcome.message()).contains("corrupt.pdf");
        verify(storage, never()).save(any());
    }
}
