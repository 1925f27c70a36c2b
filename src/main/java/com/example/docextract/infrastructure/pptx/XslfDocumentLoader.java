package com.example.docextract.infrastructure.pptx;

import com.example.docextract.domain.model.DocumentFormat;
import com.example.docextract.infrastructure.document.DocumentLoader;
import com.example.docextract.infrastructure.document.LoadedDocument;
import com.example.docextract.infrastructure.document.OoxmlMetadata;
import com.example.docextract.infrastructure.exception.CorruptDocumentException;

import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens PPTX files with POI XSLF. The slide count is the document's location count.
 */
@Component
public class XslfDocumentLoader implements DocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(XslfDocumentLoader.class);

    @Override
    public DocumentFormat format() {
        return DocumentFormat.PPTX;
    }

    @Override
    public LoadedDocument load(Path path) {
        XMLSlideShow slideShow;
        try (InputStream input = Files.newInputStream(path)) {
            slideShow = new XMLSlideShow(input);
        } catch (IOException | POIXMLException | IllegalArgumentException ex) {
            throw new CorruptDocumentException("Unable to parse the PPTX at " + path, ex);
        }
        try {
            LoadedDocument loaded = new LoadedDocument(
                    OoxmlMetadata.from(DocumentFormat.PPTX, path,
                            slideShow.getProperties().getCoreProperties(), slideShow.getSlides().size()),
                    slideShow);
            log.debug("Opened {} ({} slides)", path, slideShow.getSlides().size());
            return loaded;
        } catch (IOException ex) {
            LoadedDocument.releaseAfterFailure(slideShow, ex);
            throw new CorruptDocumentException("Unable to read the PPTX at " + path, ex);
        } catch (RuntimeException ex) {
            LoadedDocument.releaseAfterFailure(slideShow, ex);
            throw ex;
        }
    }
}
