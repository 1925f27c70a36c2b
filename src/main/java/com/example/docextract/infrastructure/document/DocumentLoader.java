package com.example.docextract.infrastructure.document;

import com.example.docextract.domain.model.DocumentFormat;

import java.nio.file.Path;

/**
 * Opens documents of a single format.
 * The caller has already checked that the path exists; implementations only deal with parsing.
 */
public interface DocumentLoader {

    DocumentFormat format();

    /**
     * Opens the document and reads its metadata.
     *
     * @param path existing regular file
     * @return opened document; the caller must close it
     * @throws com.example.docextract.infrastructure.exception.CorruptDocumentException when the
     *         parsing library rejects the file
     */
    LoadedDocument load(Path path);
}
