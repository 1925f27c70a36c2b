package com.example.docextract.domain.model;

import java.time.Instant;

/**
 * Document-level metadata captured by the loaders when a file is opened.
 * Optional attributes are {@code null} when the source document does not declare them.
 */
public record DocumentMetadata(
        DocumentFormat format,
        String sourcePath,
        String fileName,
        long fileSizeBytes,
        String title,
        String author,
        String lastModifiedBy,
        Instant createdAt,
        Instant modifiedAt,
        int pageCount
) {

    public DocumentMetadata {
        if (format == null) {
            throw new IllegalArgumentException("format is required");
        }
        if (pageCount < 0) {
            throw new IllegalArgumentException("pageCount must not be negative: " + pageCount);
        }
    }

    /**
     * Document name without its extension, used to name output folders.
     *
     * @return base name of the source file
     */
    public String documentName() {
        String name = fileName != null ? fileName : "document";
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public boolean containsLocation(int location) {
        return location >= 1 && location <= pageCount;
    }
}
