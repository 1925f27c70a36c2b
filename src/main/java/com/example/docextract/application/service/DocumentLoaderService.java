package com.example.docextract.application.service;

import com.example.docextract.domain.exception.DocumentNotFoundException;
import com.example.docextract.domain.exception.DocumentPathRequiredException;
import com.example.docextract.domain.exception.UnsupportedDocumentFormatException;
import com.example.docextract.domain.model.DocumentFormat;
import com.example.docextract.infrastructure.document.DocumentLoader;
import com.example.docextract.infrastructure.document.LoadedDocument;

import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Application-layer entry point for opening documents.
 * It validates the path, resolves the format and delegates parsing to the matching infrastructure loader.
 */
@Service
public class DocumentLoaderService {

    private final Map<DocumentFormat, DocumentLoader> loaders = new EnumMap<>(DocumentFormat.class);

    /**
     * @param loaders one loader per supported format, discovered by Spring
     */
    public DocumentLoaderService(List<DocumentLoader> loaders) {
        for (DocumentLoader loader : loaders) {
            this.loaders.put(loader.format(), loader);
        }
    }

    /**
     * Opens a document whose format is inferred from its extension.
     *
     * @param path file on disk
     * @return open document; the caller closes it
     * @throws DocumentPathRequiredException       when {@code path} is null
     * @throws DocumentNotFoundException           when the path is missing or not a regular file
     * @throws UnsupportedDocumentFormatException  when the extension is not pdf, docx or pptx
     * @throws com.example.docextract.infrastructure.exception.CorruptDocumentException when the file cannot be parsed
     */
    public LoadedDocument load(Path path) {
        requireReadableFile(path);
        DocumentFormat format = DocumentFormat.fromPath(path)
                .orElseThrow(() -> new UnsupportedDocumentFormatException(String.valueOf(path.getFileName())));
        return open(path, format);
    }

    /**
     * Opens a document with an explicit format, ignoring its extension.
     *
     * @param path   file on disk
     * @param format format to parse the file as
     * @return open document; the caller closes it
     */
    public LoadedDocument load(Path path, DocumentFormat format) {
        requireReadableFile(path);
        if (format == null) {
            return load(path);
        }
        return open(path, format);
    }

    public boolean supports(Path path) {
        return DocumentFormat.fromPath(path).filter(loaders::containsKey).isPresent();
    }

    private LoadedDocument open(Path path, DocumentFormat format) {
        DocumentLoader loader = loaders.get(format);
        if (loader == null) {
            throw new UnsupportedDocumentFormatException(String.valueOf(path.getFileName()));
        }
        return loader.load(path);
    }

    private void requireReadableFile(Path path) {
        if (path == null) {
            throw new DocumentPathRequiredException();
        }
        if (!Files.isRegularFile(path)) {
            throw new DocumentNotFoundException(path.toAbsolutePath().toString());
        }
    }
}
