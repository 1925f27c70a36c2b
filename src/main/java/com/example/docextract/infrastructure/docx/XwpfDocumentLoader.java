package com.example.docextract.infrastructure.docx;

import com.example.docextract.domain.model.DocumentFormat;
import com.example.docextract.domain.model.DocumentMetadata;
import com.example.docextract.infrastructure.document.DocumentLoader;
import com.example.docextract.infrastructure.document.LoadedDocument;
import com.example.docextract.infrastructure.document.OoxmlMetadata;
import com.example.docextract.infrastructure.exception.CorruptDocumentException;

import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.ooxml.POIXMLProperties;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens DOCX files with POI XWPF.
 */
@Component
public class XwpfDocumentLoader implements DocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(XwpfDocumentLoader.class);

    @Override
    public DocumentFormat format() {
        return DocumentFormat.DOCX;
    }

    @Override
    public LoadedDocument load(Path path) {
        XWPFDocument document;
        try (InputStream input = Files.newInputStream(path)) {
            document = new XWPFDocument(input);
        } catch (IOException | POIXMLException | IllegalArgumentException ex) {
            throw new CorruptDocumentException("Unable to parse the DOCX at " + path, ex);
        }
        try {
            LoadedDocument loaded = new LoadedDocument(readMetadata(document, path), document);
            log.debug("Opened {} ({} estimated pages)", path, loaded.metadata().pageCount());
            return loaded;
        } catch (IOException ex) {
            LoadedDocument.releaseAfterFailure(document, ex);
            throw new CorruptDocumentException("Unable to read the DOCX at " + path, ex);
        } catch (RuntimeException ex) {
            LoadedDocument.releaseAfterFailure(document, ex);
            throw ex;
        }
    }

    private DocumentMetadata readMetadata(XWPFDocument document, Path path) throws IOException {
        POIXMLProperties properties = document.getProperties();
        int declaredPages = properties.getExtendedProperties().getUnderlyingProperties().getPages();
        int walkedPages = new DocxPageWalker(document).pageCount();
        return OoxmlMetadata.from(DocumentFormat.DOCX, path, properties.getCoreProperties(),
                Math.max(declaredPages, walkedPages));
    }
}
