package com.example.docextract.application.service;

import com.example.docextract.domain.exception.UnsupportedDocumentFormatException;
import com.example.docextract.domain.model.DocumentFormat;
import com.example.docextract.domain.model.ExtractedImage;
import com.example.docextract.domain.model.ExtractedTable;
import com.example.docextract.domain.model.ExtractionFeature;
import com.example.docextract.domain.model.ExtractionResult;
import com.example.docextract.domain.model.Hyperlink;
import com.example.docextract.domain.model.TextBlock;
import com.example.docextract.infrastructure.document.ContentExtractor;
import com.example.docextract.infrastructure.document.ExtractionWarnings;
import com.example.docextract.infrastructure.document.LoadedDocument;

import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs the format-specific extractor over an open document.
 * Individual unreadable elements end up as warnings on the result; they never fail the call.
 */
@Service
public class DocumentExtractionService {

    private final Map<DocumentFormat, ContentExtractor> extractors = new EnumMap<>(DocumentFormat.class);

    public DocumentExtractionService(List<ContentExtractor> extractors) {
        for (ContentExtractor extractor : extractors) {
            this.extractors.put(extractor.format(), extractor);
        }
    }

    public List<TextBlock> extractText(LoadedDocument document) {
        return extractorFor(document).extractText(document, warningsFor(document));
    }

    public List<Hyperlink> extractLinks(LoadedDocument document) {
        return extractorFor(document).extractLinks(document, warningsFor(document));
    }

    public List<ExtractedImage> extractImages(LoadedDocument document) {
        return extractorFor(document).extractImages(document, warningsFor(document));
    }

    public List<ExtractedTable> extractTables(LoadedDocument document) {
        return extractorFor(document).extractTables(document, warningsFor(document));
    }

    /**
     * Extracts every feature from the document.
     *
     * @param document open document
     * @return result with all four collections populated
     */
    public ExtractionResult extractAll(LoadedDocument document) {
        return extractAll(document, ExtractionFeature.allFeatures());
    }

    /**
     * Extracts only the requested features. Collections for unselected features stay empty.
     *
     * @param document open document
     * @param features subset of {@link ExtractionFeature}; null or empty selects all
     * @return extraction result carrying the metadata and the warnings collected on the way
     */
    public ExtractionResult extractAll(LoadedDocument document, Set<ExtractionFeature> features) {
        EnumSet<ExtractionFeature> selected = normalizeFeatures(features);
        ContentExtractor extractor = extractorFor(document);
        ExtractionWarnings warnings = warningsFor(document);

        List<TextBlock> text = selected.contains(ExtractionFeature.TEXT)
                ? extractor.extractText(document, warnings) : List.of();
        List<Hyperlink> links = selected.contains(ExtractionFeature.LINKS)
                ? extractor.extractLinks(document, warnings) : List.of();
        List<ExtractedImage> images = selected.contains(ExtractionFeature.IMAGES)
                ? extractor.extractImages(document, warnings) : List.of();
        List<ExtractedTable> tables = selected.contains(ExtractionFeature.TABLES)
                ? extractor.extractTables(document, warnings) : List.of();

        return new ExtractionResult(document.metadata(), text, links, images, tables, warnings.asList());
    }

    private EnumSet<ExtractionFeature> normalizeFeatures(Set<ExtractionFeature> features) {
        if (features == null || features.isEmpty()) {
            return ExtractionFeature.allFeatures();
        }
        return features instanceof EnumSet<ExtractionFeature> enumSet
                ? enumSet.clone()
                : EnumSet.copyOf(features);
    }

    private ContentExtractor extractorFor(LoadedDocument document) {
        ContentExtractor extractor = extractors.get(document.format());
        if (extractor == null) {
            throw new UnsupportedDocumentFormatException(document.metadata().fileName());
        }
        return extractor;
    }

    private static ExtractionWarnings warningsFor(LoadedDocument document) {
        return new ExtractionWarnings(document.metadata().fileName());
    }
}
