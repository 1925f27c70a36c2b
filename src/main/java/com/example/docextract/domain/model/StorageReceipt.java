package com.example.docextract.domain.model;

/**
 * Where a storage backend put an extraction result.
 *
 * @param backend  backend that handled the result
 * @param location output directory (file backend) or generated document id (database backend)
 */
public record StorageReceipt(
        StorageBackend backend,
        String location
) {
}
