package com.example.docextract.application.service;

import com.example.docextract.domain.exception.DocumentFileRequiredException;
import com.example.docextract.domain.exception.UnsupportedDocumentFormatException;
import com.example.docextract.domain.model.DocumentFormat;
import com.example.docextract.domain.model.ExtractionFeature;
import com.example.docextract.domain.model.ExtractionResult;
import com.example.docextract.domain.model.StorageReceipt;
import com.example.docextract.infrastructure.document.LoadedDocument;
import com.example.docextract.infrastructure.exception.DocumentStagingException;
import com.example.docextract.infrastructure.storage.ExtractionStorage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Set;

/**
 * Handles documents that arrive over HTTP: stages the upload in a temporary directory under its
 * original file name, extracts it and optionally stores the result.
 */
@Service
public class UploadedDocumentService {

    private static final Logger log = LoggerFactory.getLogger(UploadedDocumentService.class);

    private final DocumentLoaderService loaderService;
    private final DocumentExtractionService extractionService;
    private final ExtractionStorage storage;

    public UploadedDocumentService(DocumentLoaderService loaderService,
                                   DocumentExtractionService extractionService,
                                   ExtractionStorage storage) {
        this.loaderService = loaderService;
        this.extractionService = extractionService;
        this.storage = storage;
    }

    /**
     * Extracts the requested features from an uploaded file.
     *
     * @param file     uploaded document
     * @param features subset of {@link ExtractionFeature} to compute
     * @param store    whether to hand the result to the configured storage
     * @return extraction result and, when stored, the storage receipt
     * @throws DocumentFileRequiredException       when the file is null or empty
     * @throws UnsupportedDocumentFormatException  when the name does not end in pdf, docx or pptx
     */
    public Extraction extract(MultipartFile file, Set<ExtractionFeature> features, boolean store) {
        if (file == null || file.isEmpty()) {
            throw new DocumentFileRequiredException();
        }
        String fileName = resolveFileName(file);
        if (DocumentFormat.fromFileName(fileName).isEmpty()) {
            throw new UnsupportedDocumentFormatException(fileName);
        }

        Path directory = createStagingDirectory();
        Path staged = directory.resolve(fileName);
        try {
            try (InputStream input = file.getInputStream()) {
                Files.copy(input, staged, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException ex) {
                throw new DocumentStagingException("Unable to read the uploaded file " + fileName, ex);
            }

            ExtractionResult result;
            try (LoadedDocument document = loaderService.load(staged)) {
                result = extractionService.extractAll(document, features);
            }
            StorageReceipt receipt = store ? storage.save(result) : null;
            return new Extraction(result, receipt);
        } finally {
            deleteQuietly(staged);
            deleteQuietly(directory);
        }
    }

    private Path createStagingDirectory() {
        try {
            return Files.createTempDirectory("docextract-");
        } catch (IOException ex) {
            throw new DocumentStagingException("Unable to create a temporary directory for the upload", ex);
        }
    }

    /**
     * Keeps only the last path segment of the client-supplied name.
     */
    private String resolveFileName(MultipartFile file) {
        String original = file.getOriginalFilename();
        if (original == null || original.isBlank()) {
            return "upload";
        }
        String name = original.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        return name.isBlank() || name.equals("..") ? "upload" : name;
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            log.warn("Unable to delete temporary upload {}", path, ex);
        }
    }

    /**
     * @param result  what was extracted
     * @param receipt where it was stored, {@code null} when storing was not requested
     */
    public record Extraction(ExtractionResult result, StorageReceipt receipt) {
    }
}
