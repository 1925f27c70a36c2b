package com.example.docextract.support;

import com.example.docextract.application.service.DocumentExtractionService;
import com.example.docextract.application.service.DocumentLoaderService;
import com.example.docextract.infrastructure.docx.XwpfContentExtractor;
import com.example.docextract.infrastructure.docx.XwpfDocumentLoader;
import com.example.docextract.infrastructure.pdf.PdfBoxContentExtractor;
import com.example.docextract.infrastructure.pdf.PdfBoxDocumentLoader;
import com.example.docextract.infrastructure.pdf.PdfBoxMetadataReader;
import com.example.docextract.infrastructure.pptx.XslfContentExtractor;
import com.example.docextract.infrastructure.pptx.XslfDocumentLoader;

import java.util.List;

/**
 * Wires the real loaders and extractors without a Spring context.
 */
public final class TestServices {

    private TestServices() {
    }

    public static DocumentLoaderService loaderService() {
        return new DocumentLoaderService(List.of(
                new PdfBoxDocumentLoader(new PdfBoxMetadataReader()),
                new XwpfDocumentLoader(),
                new XslfDocumentLoader()));
    }

    public static DocumentExtractionService extractionService() {
        return new DocumentExtractionService(List.of(
                new PdfBoxContentExtractor(),
                new XwpfContentExtractor(),
                new XslfContentExtractor()));
    }
}
