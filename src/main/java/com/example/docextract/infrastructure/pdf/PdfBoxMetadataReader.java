package com.example.docextract.infrastructure.pdf;

import com.example.docextract.domain.model.DocumentFormat;
import com.example.docextract.domain.model.DocumentMetadata;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentCatalog;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.DublinCoreSchema;
import org.apache.xmpbox.schema.XMPBasicSchema;
import org.apache.xmpbox.type.BadFieldValueException;
import org.apache.xmpbox.xml.DomXmpParser;
import org.apache.xmpbox.xml.XmpParsingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Calendar;
import java.util.List;
import java.util.Objects;

/**
 * Infrastructure helper that turns PDFBox metadata into {@link DocumentMetadata}.
 * The info dictionary wins; XMP Dublin Core and XMP Basic values fill the gaps it leaves.
 */
@Component
public class PdfBoxMetadataReader {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxMetadataReader.class);

    /**
     * Reads the metadata from an opened {@link PDDocument}.
     *
     * @param document      already opened PDF document
     * @param path          source file
     * @param fileSizeBytes file size reported by the filesystem
     * @return populated metadata
     */
    public DocumentMetadata readMetadata(PDDocument document, Path path, long fileSizeBytes) {
        InfoValues info = extractInfo(document.getDocumentInformation());
        InfoValues xmp = extractXmp(document.getDocumentCatalog());

        return new DocumentMetadata(
                DocumentFormat.PDF,
                path.toAbsolutePath().toString(),
                path.getFileName().toString(),
                fileSizeBytes,
                firstNonBlank(info.title(), xmp.title()),
                firstNonBlank(info.author(), xmp.author()),
                null,
                info.createdAt() != null ? info.createdAt() : xmp.createdAt(),
                info.modifiedAt() != null ? info.modifiedAt() : xmp.modifiedAt(),
                document.getNumberOfPages()
        );
    }

    /**
     * Extracts the legacy info dictionary fields from the PDF document.
     *
     * @param info info dictionary from PDFBox
     * @return extracted values, all {@code null} when the dictionary is missing
     */
    private InfoValues extractInfo(PDDocumentInformation info) {
        if (info == null) {
            return InfoValues.EMPTY;
        }
        return new InfoValues(
                info.getTitle(),
                info.getAuthor(),
                toInstant(info.getCreationDate()),
                toInstant(info.getModificationDate())
        );
    }

    /**
     * Extracts the XMP metadata payload.
     *
     * @param catalog document catalog pointer supplied by PDFBox
     * @return parsed values, empty if missing or invalid
     */
    private InfoValues extractXmp(PDDocumentCatalog catalog) {
        if (catalog == null) {
            return InfoValues.EMPTY;
        }
        PDMetadata pdMetadata = catalog.getMetadata();
        if (pdMetadata == null) {
            return InfoValues.EMPTY;
        }
        try (InputStream metadataStream = pdMetadata.exportXMPMetadata()) {
            if (metadataStream == null) {
                return InfoValues.EMPTY;
            }
            DomXmpParser parser = new DomXmpParser();
            parser.setStrictParsing(false);
            XMPMetadata xmp = parser.parse(metadataStream);
            DublinCoreSchema dc = xmp.getDublinCoreSchema();
            XMPBasicSchema basic = xmp.getXMPBasicSchema();

            List<String> creators = dc != null && dc.getCreators() != null
                    ? dc.getCreators().stream().filter(Objects::nonNull).toList()
                    : List.of();
            String dcTitle = dc != null && dc.getTitle() != null ? dc.getTitle() : null;

            return new InfoValues(
                    dcTitle,
                    creators.isEmpty() ? null : String.join(", ", creators),
                    basic != null ? toInstant(basic.getCreateDate()) : null,
                    basic != null ? toInstant(basic.getModifyDate()) : null
            );
        } catch (IOException | XmpParsingException | BadFieldValueException ex) {
            log.warn("Failed to parse XMP metadata", ex);
            return InfoValues.EMPTY;
        }
    }

    private Instant toInstant(Calendar calendar) {
        return calendar != null ? calendar.toInstant() : null;
    }

    private static String firstNonBlank(String preferred, String fallback) {
        if (preferred != null && !preferred.isBlank()) {
            return preferred;
        }
        return fallback != null && !fallback.isBlank() ? fallback : null;
    }

    private record InfoValues(String title, String author, Instant createdAt, Instant modifiedAt) {
        static final InfoValues EMPTY = new InfoValues(null, null, null, null);
    }
}
