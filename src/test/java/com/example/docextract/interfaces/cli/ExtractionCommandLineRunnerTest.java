package com.example.docextract.interfaces.cli;

import com.example.docextract.application.exception.UseCaseValidationException;
import com.example.docextract.application.service.BatchExtractionService;
import com.example.docextract.application.service.ExtractionReportFormatter;
import com.example.docextract.config.ExtractorProperties;
import com.example.docextract.domain.model.BatchReport;
import com.example.docextract.domain.model.PipelineOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class ExtractionCommandLineRunnerTest {

    private BatchExtractionService batchService;
    private ExtractorProperties properties;
    private ExtractionCommandLineRunner runner;

    @BeforeEach
    void setUp() {
        batchService = mock(BatchExtractionService.class);
        properties = new ExtractorProperties();
        runner = new ExtractionCommandLineRunner(batchService, new ExtractionReportFormatter(), properties);
    }

    @Test
    void configuredInputsComeBeforeArguments() {
        properties.getBatch().setInputs(List.of("docs"));
        given(batchService.run(anyList(), any())).willReturn(new BatchReport(List.of(
                PipelineOutcome.succeeded("docs/a.pdf", null, null))));

        runner.run(new DefaultApplicationArguments("--spring.profiles.active=batch", "extra/b.docx"));

        verify(batchService).run(eq(List.of(Path.of("docs"), Path.of("extra/b.docx"))), any());
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    void anyFailureGivesExitCodeOne() {
        given(batchService.run(anyList(), any())).willReturn(new BatchReport(List.of(
                PipelineOutcome.succeeded("a.pdf", null, null),
                PipelineOutcome.failed("b.pdf", "Unable to parse the PDF"))));

        runner.run(new DefaultApplicationArguments("a.pdf", "b.pdf"));

        assertThat(runner.getExitCode()).isEqualTo(1);
    }

    @Test
    void noInputsGivesExitCodeOne() {
        given(batchService.run(anyList(), any()))
                .willThrow(new UseCaseValidationException("At least one input file or directory is required."));

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(1);
    }
}
