package com.example.docextract.application.service;

import com.example.docextract.application.exception.UseCaseValidationException;
import com.example.docextract.domain.model.BatchReport;
import com.example.docextract.domain.model.PipelineOutcome;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Processes a list of files and directories one document at a time.
 * A failing document is recorded in the report and the run carries on with the next one.
 */
@Service
public class BatchExtractionService {

    private static final Logger log = LoggerFactory.getLogger(BatchExtractionService.class);

    private final DocumentPipelineService pipelineService;
    private final DocumentLoaderService loaderService;

    public BatchExtractionService(DocumentPipelineService pipelineService, DocumentLoaderService loaderService) {
        this.pipelineService = pipelineService;
        this.loaderService = loaderService;
    }

    public BatchReport run(List<Path> inputs) {
        return run(inputs, outcome -> { });
    }

    /**
     * @param inputs   files or directories; directories contribute their supported files, sorted by name
     * @param listener called after each document, e.g. to print its report
     * @return one outcome per processed file, in processing order
     * @throws UseCaseValidationException when {@code inputs} is empty
     */
    public BatchReport run(List<Path> inputs, Consumer<PipelineOutcome> listener) {
        if (inputs == null || inputs.isEmpty()) {
            throw new UseCaseValidationException("At least one input file or directory is required.");
        }
        List<PipelineOutcome> outcomes = new ArrayList<>();
        for (Path input : inputs) {
            List<Path> files;
            try {
                files = expand(input);
            } catch (IOException ex) {
                log.error("Unable to list directory {}", input, ex);
                outcomes.add(report(PipelineOutcome.failed(String.valueOf(input), "Unable to list directory: " + ex.getMessage()), listener));
                continue;
            }
            for (Path file : files) {
                outcomes.add(report(processSafely(file), listener));
            }
        }
        BatchReport report = new BatchReport(outcomes);
        log.info("Batch finished: {} succeeded, {} partially failed, {} failed",
                report.succeeded(), report.partiallyFailed(), report.failed());
        return report;
    }

    /**
     * Directories are scanned one level deep; an explicit file input is passed through as given so
     * that a missing or unsupported file shows up in the report.
     */
    List<Path> expand(Path input) throws IOException {
        if (!Files.isDirectory(input)) {
            return List.of(input);
        }
        try (Stream<Path> children = Files.list(input)) {
            return children.filter(Files::isRegularFile)
                    .filter(loaderService::supports)
                    .sorted(Comparator.comparing(child -> child.getFileName().toString()))
                    .toList();
        }
    }

    private PipelineOutcome report(PipelineOutcome outcome, Consumer<PipelineOutcome> listener) {
        log.info("[{}] {}{}", outcome.status(), outcome.source(),
                outcome.message() != null ? " - " + outcome.message() : "");
        listener.accept(outcome);
        return outcome;
    }

    private PipelineOutcome processSafely(Path file) {
        try {
            return pipelineService.process(file);
        } catch (RuntimeException ex) {
            log.error("Unexpected failure while processing {}", file, ex);
            return PipelineOutcome.failed(String.valueOf(file), ex.getClass().getSimpleName() + ": " + ex.getMessage());
        }
    }
}
