package com.example.docextract.domain.model;

/**
 * How the database backend keeps image payloads.
 */
public enum ImageStorageMode {
    /** Bytes go into the {@code images.data} column. */
    BLOB,
    /** Bytes are written below the output root and the row keeps the file path. */
    PATH
}
