package com.example.docextract.infrastructure.storage;

import com.example.docextract.domain.model.ExtractionResult;
import com.example.docextract.domain.model.StorageReceipt;

/**
 * Persists extraction results. Implementations get their destination from configuration at
 * construction time. Saving the same document twice stores it twice; no upsert is attempted.
 */
public interface ExtractionStorage {

    /**
     * @param result extraction result to persist
     * @return where the result went
     * @throws com.example.docextract.infrastructure.exception.StorageException when persisting fails
     */
    StorageReceipt save(ExtractionResult result);
}
