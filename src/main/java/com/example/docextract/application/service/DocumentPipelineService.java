package com.example.docextract.application.service;

import com.example.docextract.domain.exception.DomainException;
import com.example.docextract.domain.model.ExtractionResult;
import com.example.docextract.domain.model.PipelineOutcome;
import com.example.docextract.domain.model.StorageReceipt;
import com.example.docextract.infrastructure.document.LoadedDocument;
import com.example.docextract.infrastructure.exception.CorruptDocumentException;
import com.example.docextract.infrastructure.exception.StorageException;
import com.example.docextract.infrastructure.storage.ExtractionStorage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Load, extract and store one document, turning expected failures into a {@link PipelineOutcome}.
 * Unexpected runtime exceptions still propagate.
 */
@Service
public class DocumentPipelineService {

    private static final Logger log = LoggerFactory.getLogger(DocumentPipelineService.class);

    private final DocumentLoaderService loaderService;
    private final DocumentExtractionService extractionService;
    private final ExtractionStorage storage;

    public DocumentPipelineService(DocumentLoaderService loaderService,
                                   DocumentExtractionService extractionService,
                                   ExtractionStorage storage) {
        this.loaderService = loaderService;
        this.extractionService = extractionService;
        this.storage = storage;
    }

    /**
     * @param path document to process
     * @return {@code SUCCEEDED} when stored, {@code PARTIALLY_FAILED} when extraction worked but
     *         storage did not, {@code FAILED} when the document could not be loaded
     */
    public PipelineOutcome process(Path path) {
        String source = String.valueOf(path);
        ExtractionResult result;
        try (LoadedDocument document = loaderService.load(path)) {
            result = extractionService.extractAll(document);
        } catch (DomainException | CorruptDocumentException ex) {
            log.error("Extraction failed for {}", source, ex);
            return PipelineOutcome.failed(source, ex.getMessage());
        }

        try {
            StorageReceipt receipt = storage.save(result);
            log.info("Processed {}: {} text blocks, {} links, {} images, {} tables, {} warnings -> {}",
                    source, result.textBlocks().size(), result.links().size(), result.images().size(),
                    result.tables().size(), result.warnings().size(), receipt.location());
            return PipelineOutcome.succeeded(source, result, receipt);
        } catch (StorageException ex) {
            log.error("Extraction of {} succeeded but storing it failed", source, ex);
            return PipelineOutcome.partiallyFailed(source, result, ex.getMessage());
        }
    }
}
