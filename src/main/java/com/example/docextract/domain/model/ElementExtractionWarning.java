package com.example.docextract.domain.model;

/**
 * Recoverable problem with a single element; the element was skipped and extraction continued.
 *
 * @param location 1-based page or slide number, {@code 0} when the location is unknown
 * @param feature  kind of element that failed
 * @param message  description of the failure
 */
public record ElementExtractionWarning(
        int location,
        ExtractionFeature feature,
        String message
) {
}
