package com.example.docextract.domain.model;

import java.util.List;

/**
 * Everything extracted from one document: metadata plus the four content collections.
 * Collections are never {@code null}; absent content is an empty list.
 * Every located item must sit inside {@code [1, metadata.pageCount()]}.
 */
public record ExtractionResult(
        DocumentMetadata metadata,
        List<TextBlock> textBlocks,
        List<Hyperlink> links,
        List<ExtractedImage> images,
        List<ExtractedTable> tables,
        List<ElementExtractionWarning> warnings
) {

    public ExtractionResult {
        if (metadata == null) {
            throw new IllegalArgumentException("metadata is required");
        }
        textBlocks = textBlocks == null ? List.of() : List.copyOf(textBlocks);
        links = links == null ? List.of() : List.copyOf(links);
        images = images == null ? List.of() : List.copyOf(images);
        tables = tables == null ? List.of() : List.copyOf(tables);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);

        textBlocks.forEach(block -> requireLocation(metadata, block.location(), "text block"));
        links.forEach(link -> requireLocation(metadata, link.location(), "link"));
        images.forEach(image -> requireLocation(metadata, image.location(), "image"));
        tables.forEach(table -> requireLocation(metadata, table.location(), "table"));
    }

    public DocumentFormat format() {
        return metadata.format();
    }

    /**
     * Full text of the document in reading order, one block per line.
     *
     * @return text block contents joined with {@code \n}
     */
    public String fullText() {
        return String.join("\n", textBlocks.stream().map(TextBlock::content).toList());
    }

    private static void requireLocation(DocumentMetadata metadata, int location, String kind) {
        if (!metadata.containsLocation(location)) {
            throw new IllegalArgumentException(kind + " location " + location
                    + " outside [1, " + metadata.pageCount() + "] for " + metadata.fileName());
        }
    }
}
