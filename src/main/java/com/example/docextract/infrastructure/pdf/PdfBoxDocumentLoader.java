package com.example.docextract.infrastructure.pdf;

import com.example.docextract.domain.model.DocumentFormat;
import com.example.docextract.infrastructure.document.DocumentLoader;
import com.example.docextract.infrastructure.document.LoadedDocument;
import com.example.docextract.infrastructure.exception.CorruptDocumentException;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens PDF files with PDFBox.
 */
@Component
public class PdfBoxDocumentLoader implements DocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxDocumentLoader.class);

    private final PdfBoxMetadataReader metadataReader;

    public PdfBoxDocumentLoader(PdfBoxMetadataReader metadataReader) {
        this.metadataReader = metadataReader;
    }

    @Override
    public DocumentFormat format() {
        return DocumentFormat.PDF;
    }

    @Override
    public LoadedDocument load(Path path) {
        PDDocument document;
        try {
            document = Loader.loadPDF(path.toFile());
        } catch (IOException | RuntimeException ex) {
            throw new CorruptDocumentException("Unable to parse the PDF at " + path, ex);
        }
        try {
            LoadedDocument loaded = new LoadedDocument(
                    metadataReader.readMetadata(document, path, Files.size(path)), document);
            log.debug("Opened {} ({} pages)", path, document.getNumberOfPages());
            return loaded;
        } catch (IOException | RuntimeException ex) {
            // a recovered file can still have a broken page tree
            LoadedDocument.releaseAfterFailure(document, ex);
            throw new CorruptDocumentException("Unable to read the PDF at " + path, ex);
        }
    }
}
