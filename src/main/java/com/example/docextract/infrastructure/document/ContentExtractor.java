package com.example.docextract.infrastructure.document;

import com.example.docextract.domain.model.DocumentFormat;
import com.example.docextract.domain.model.ExtractedImage;
import com.example.docextract.domain.model.ExtractedTable;
import com.example.docextract.domain.model.Hyperlink;
import com.example.docextract.domain.model.TextBlock;

import java.util.List;

/**
 * Format-specific extraction of the four content collections.
 * Results are returned in document order: page or slide ascending, then reading order.
 * Elements that cannot be read are reported to {@code warnings} and skipped.
 */
public interface ContentExtractor {

    DocumentFormat format();

    List<TextBlock> extractText(LoadedDocument document, ExtractionWarnings warnings);

    List<Hyperlink> extractLinks(LoadedDocument document, ExtractionWarnings warnings);

    List<ExtractedImage> extractImages(LoadedDocument document, ExtractionWarnings warnings);

    List<ExtractedTable> extractTables(LoadedDocument document, ExtractionWarnings warnings);
}
