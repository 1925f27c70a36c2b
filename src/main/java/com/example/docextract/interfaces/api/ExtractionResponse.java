package com.example.docextract.interfaces.api;

import com.example.docextract.domain.model.DocumentMetadata;
import com.example.docextract.domain.model.ElementExtractionWarning;
import com.example.docextract.domain.model.ExtractedImage;
import com.example.docextract.domain.model.ExtractedTable;
import com.example.docextract.domain.model.ExtractionResult;
import com.example.docextract.domain.model.Hyperlink;
import com.example.docextract.domain.model.StorageReceipt;
import com.example.docextract.domain.model.TextBlock;

import java.util.List;

/**
 * JSON body of {@code POST /api/extract}. Images are described but their bytes are left out.
 */
public record ExtractionResponse(
        DocumentMetadata metadata,
        List<TextBlock> textBlocks,
        List<Hyperlink> links,
        List<ImageDescriptor> images,
        List<ExtractedTable> tables,
        List<ElementExtractionWarning> warnings,
        StorageReceipt storage
) {

    public static ExtractionResponse from(ExtractionResult result, StorageReceipt receipt) {
        return new ExtractionResponse(
                result.metadata(),
                result.textBlocks(),
                result.links(),
                result.images().stream().map(ImageDescriptor::from).toList(),
                result.tables(),
                result.warnings(),
                receipt
        );
    }

    public record ImageDescriptor(
            int sequence,
            int location,
            String format,
            int width,
            int height,
            int sizeBytes
    ) {

        static ImageDescriptor from(ExtractedImage image) {
            return new ImageDescriptor(image.sequence(), image.location(), image.format(),
                    image.width(), image.height(), image.data().length);
        }
    }
}
