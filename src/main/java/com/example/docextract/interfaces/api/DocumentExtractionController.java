package com.example.docextract.interfaces.api;

import com.example.docextract.application.service.UploadedDocumentService;
import com.example.docextract.domain.model.ExtractionFeature;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.EnumSet;
import java.util.List;

/**
 * Interfaces-layer REST controller that extracts uploaded PDF, DOCX and PPTX documents.
 */
@RestController
public class DocumentExtractionController {

    private final UploadedDocumentService uploadedDocumentService;

    public DocumentExtractionController(UploadedDocumentService uploadedDocumentService) {
        this.uploadedDocumentService = uploadedDocumentService;
    }

    /**
     * Extracts the requested features and optionally stores the result with the configured backend.
     *
     * @param file          uploaded document
     * @param featureParams requested feature list (optional, defaults to all)
     * @param store         whether to persist the result
     * @return JSON response containing the extraction result
     */
    @PostMapping(value = "/api/extract", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ExtractionResponse> extract(@RequestParam("file") MultipartFile file,
                                                      @RequestParam(value = "features", required = false) List<String> featureParams,
                                                      @RequestParam(value = "store", defaultValue = "false") boolean store) {
        EnumSet<ExtractionFeature> features = ExtractionFeature.fromStrings(featureParams);
        UploadedDocumentService.Extraction extraction = uploadedDocumentService.extract(file, features, store);
        return ResponseEntity.ok(ExtractionResponse.from(extraction.result(), extraction.receipt()));
    }
}
