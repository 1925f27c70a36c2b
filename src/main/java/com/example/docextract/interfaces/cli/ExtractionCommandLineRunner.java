package com.example.docextract.interfaces.cli;

import com.example.docextract.application.exception.UseCaseValidationException;
import com.example.docextract.application.service.BatchExtractionService;
import com.example.docextract.application.service.ExtractionReportFormatter;
import com.example.docextract.config.ExtractorProperties;
import com.example.docextract.domain.model.BatchReport;
import com.example.docextract.domain.model.PipelineOutcome;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Batch entry point: processes {@code extractor.batch.inputs} plus every non-option argument at
 * startup. The exit code is {@code 0} when every document succeeded and {@code 1} otherwise.
 */
@Component
@ConditionalOnProperty(prefix = "extractor.batch", name = "enabled", havingValue = "true")
public class ExtractionCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ExtractionCommandLineRunner.class);

    private final BatchExtractionService batchService;
    private final ExtractionReportFormatter reportFormatter;
    private final ExtractorProperties.Batch settings;
    private int exitCode;

    public ExtractionCommandLineRunner(BatchExtractionService batchService,
                                       ExtractionReportFormatter reportFormatter,
                                       ExtractorProperties properties) {
        this.batchService = batchService;
        this.reportFormatter = reportFormatter;
        this.settings = properties.getBatch();
    }

    @Override
    public void run(ApplicationArguments args) {
        List<Path> inputs = new ArrayList<>();
        settings.getInputs().forEach(input -> inputs.add(Path.of(input)));
        args.getNonOptionArgs().forEach(input -> inputs.add(Path.of(input)));

        BatchReport report;
        try {
            report = batchService.run(inputs, this::showData);
        } catch (UseCaseValidationException ex) {
            log.error("Nothing to extract: {}", ex.getMessage());
            exitCode = 1;
            return;
        }
        exitCode = report.hasFailures() ? 1 : 0;
    }

    private void showData(PipelineOutcome outcome) {
        if (settings.isShowData() && outcome.result() != null) {
            log.info(reportFormatter.format(outcome.result()));
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
