package com.example.docextract.domain.model;

/**
 * Where extraction results are persisted.
 */
public enum StorageBackend {
    FILE,
    DATABASE
}
