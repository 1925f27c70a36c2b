package com.example.docextract.domain.model;

import java.util.List;

/**
 * Report line for one processed document.
 *
 * @param source   path of the input document
 * @param status   final pipeline status
 * @param result   extraction result, {@code null} when loading or extraction failed
 * @param receipt  storage receipt, {@code null} unless storage succeeded
 * @param message  failure cause for non-successful runs
 */
public record PipelineOutcome(
        String source,
        PipelineStatus status,
        ExtractionResult result,
        StorageReceipt receipt,
        String message
) {

    public static PipelineOutcome succeeded(String source, ExtractionResult result, StorageReceipt receipt) {
        return new PipelineOutcome(source, PipelineStatus.SUCCEEDED, result, receipt, null);
    }

    public static PipelineOutcome partiallyFailed(String source, ExtractionResult result, String message) {
        return new PipelineOutcome(source, PipelineStatus.PARTIALLY_FAILED, result, null, message);
    }

    public static PipelineOutcome failed(String source, String message) {
        return new PipelineOutcome(source, PipelineStatus.FAILED, null, null, message);
    }

    public List<ElementExtractionWarning> warnings() {
        return result != null ? result.warnings() : List.of();
    }

    public boolean isSuccess() {
        return status == PipelineStatus.SUCCEEDED;
    }
}
