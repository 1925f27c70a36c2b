package com.example.docextract.domain.model;

import java.util.List;

/**
 * Aggregated outcome of a batch run, in processing order.
 */
public record BatchReport(List<PipelineOutcome> outcomes) {

    public BatchReport {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public long count(PipelineStatus status) {
        return outcomes.stream().filter(outcome -> outcome.status() == status).count();
    }

    public long succeeded() {
        return count(PipelineStatus.SUCCEEDED);
    }

    public long partiallyFailed() {
        return count(PipelineStatus.PARTIALLY_FAILED);
    }

    public long failed() {
        return count(PipelineStatus.FAILED);
    }

    public boolean hasFailures() {
        return succeeded() < outcomes.size();
    }
}
