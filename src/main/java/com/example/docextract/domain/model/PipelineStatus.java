package com.example.docextract.domain.model;

/**
 * Final state of one document's pipeline run.
 */
public enum PipelineStatus {
    SUCCEEDED,
    /** Extraction finished but the storage step failed. */
    PARTIALLY_FAILED,
    FAILED
}
