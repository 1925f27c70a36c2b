package com.example.docextract.infrastructure.document;

import com.example.docextract.domain.model.DocumentFormat;
import com.example.docextract.domain.model.DocumentMetadata;

import org.apache.poi.ooxml.POIXMLProperties;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Date;

/**
 * Maps the OOXML core properties shared by DOCX and PPTX onto {@link DocumentMetadata}.
 */
public final class OoxmlMetadata {

    private OoxmlMetadata() {
    }

    /**
     * @param format    DOCX or PPTX
     * @param path      source file
     * @param core      core properties part of the package
     * @param pageCount page or slide count computed by the loader
     * @return populated metadata
     * @throws IOException when the file size cannot be read
     */
    public static DocumentMetadata from(DocumentFormat format,
                                        Path path,
                                        POIXMLProperties.CoreProperties core,
                                        int pageCount) throws IOException {
        return new DocumentMetadata(
                format,
                path.toAbsolutePath().toString(),
                path.getFileName().toString(),
                Files.size(path),
                blankToNull(core.getTitle()),
                blankToNull(core.getCreator()),
                blankToNull(core.getLastModifiedByUser()),
                toInstant(core.getCreated()),
                toInstant(core.getModified()),
                pageCount
        );
    }

    private static Instant toInstant(Date date) {
        return date != null ? date.toInstant() : null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
