package com.example.docextract.infrastructure.pdf;

import com.example.docextract.domain.model.DocumentFormat;
import com.example.docextract.domain.model.ExtractedImage;
import com.example.docextract.domain.model.ExtractedTable;
import com.example.docextract.domain.model.ExtractionFeature;
import com.example.docextract.domain.model.Hyperlink;
import com.example.docextract.domain.model.TextBlock;
import com.example.docextract.infrastructure.document.ContentExtractor;
import com.example.docextract.infrastructure.document.ExtractionWarnings;
import com.example.docextract.infrastructure.document.LoadedDocument;

import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.pdmodel.interactive.action.PDAction;
import org.apache.pdfbox.pdmodel.interactive.action.PDActionURI;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotation;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationLink;
import org.apache.pdfbox.text.PDFTextStripperByArea;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts text, links, images and tables from PDF documents with PDFBox, page by page.
 * A page that cannot be read is reported as a warning and the remaining pages are still processed.
 */
@Component
public class PdfBoxContentExtractor implements ContentExtractor {

    private static final float HEADING_MULTIPLIER = 1.15f;
    private static final int MIN_HEADING_LENGTH = 2;
    private static final int MAX_HEADING_LENGTH = 200;

    @Override
    public DocumentFormat format() {
        return DocumentFormat.PDF;
    }

    /**
     * Emits one {@link TextBlock} per non-blank line. Lines whose average font size exceeds the
     * document median by {@value #HEADING_MULTIPLIER} are flagged as headings.
     */
    @Override
    public List<TextBlock> extractText(LoadedDocument document, ExtractionWarnings warnings) {
        PDDocument pdf = document.unwrap(PDDocument.class);
        Map<Integer, List<TextLine>> linesByPage = readLines(pdf, ExtractionFeature.TEXT, warnings);
        double median = medianFontSize(linesByPage);

        List<TextBlock> blocks = new ArrayList<>();
        linesByPage.forEach((pageNumber, lines) -> {
            for (TextLine line : lines) {
                String content = line.text();
                if (content.isEmpty()) {
                    continue;
                }
                float fontSize = line.averageFontSize();
                blocks.add(new TextBlock(
                        pageNumber,
                        content,
                        line.dominantFont(),
                        isHeading(content, fontSize, median),
                        fontSize > 0 ? fontSize : null
                ));
            }
        });
        return blocks;
    }

    /**
     * Reads URI link annotations. The anchor text is whatever page text sits under the annotation rectangle.
     */
    @Override
    public List<Hyperlink> extractLinks(LoadedDocument document, ExtractionWarnings warnings) {
        PDDocument pdf = document.unwrap(PDDocument.class);
        List<Hyperlink> links = new ArrayList<>();
        for (int pageNumber = 1; pageNumber <= pdf.getNumberOfPages(); pageNumber++) {
            try {
                links.addAll(linksOn(pdf.getPage(pageNumber - 1), pageNumber));
            } catch (IOException | RuntimeException ex) {
                warnings.add(pageNumber, ExtractionFeature.LINKS, "Unreadable link annotations", ex);
            }
        }
        return links;
    }

    @Override
    public List<ExtractedImage> extractImages(LoadedDocument document, ExtractionWarnings warnings) {
        PDDocument pdf = document.unwrap(PDDocument.class);
        List<ExtractedImage> images = new ArrayList<>();
        for (int pageNumber = 1; pageNumber <= pdf.getNumberOfPages(); pageNumber++) {
            List<PDImageXObject> drawn;
            try {
                drawn = PdfImageCollector.imagesOn(pdf.getPage(pageNumber - 1));
            } catch (IOException | RuntimeException ex) {
                warnings.add(pageNumber, ExtractionFeature.IMAGES, "Unreadable page content", ex);
                continue;
            }
            for (PDImageXObject image : drawn) {
                try {
                    images.add(toImage(image, images.size() + 1, pageNumber));
                } catch (IOException | RuntimeException ex) {
                    warnings.add(pageNumber, ExtractionFeature.IMAGES, "Unreadable image bytes", ex);
                }
            }
        }
        return images;
    }

    @Override
    public List<ExtractedTable> extractTables(LoadedDocument document, ExtractionWarnings warnings) {
        PDDocument pdf = document.unwrap(PDDocument.class);
        Map<Integer, List<TextLine>> linesByPage = readLines(pdf, ExtractionFeature.TABLES, warnings);
        List<ExtractedTable> tables = new ArrayList<>();
        linesByPage.forEach((pageNumber, lines) -> {
            for (List<List<String>> rows : PdfTableDetector.detect(lines)) {
                tables.add(new ExtractedTable(tables.size() + 1, pageNumber, rows));
            }
        });
        return tables;
    }

    private Map<Integer, List<TextLine>> readLines(PDDocument pdf, ExtractionFeature feature, ExtractionWarnings warnings) {
        Map<Integer, List<TextLine>> linesByPage = new LinkedHashMap<>();
        for (int pageNumber = 1; pageNumber <= pdf.getNumberOfPages(); pageNumber++) {
            try {
                linesByPage.put(pageNumber, PositionedTextStripper.linesOf(pdf, pageNumber));
            } catch (IOException | RuntimeException ex) {
                warnings.add(pageNumber, feature, "Unreadable page text", ex);
            }
        }
        return linesByPage;
    }

    private double medianFontSize(Map<Integer, List<TextLine>> linesByPage) {
        List<Float> sizes = linesByPage.values().stream()
                .flatMap(List::stream)
                .filter(line -> !line.text().isEmpty())
                .map(TextLine::averageFontSize)
                .filter(size -> size > 0)
                .sorted()
                .toList();
        if (sizes.isEmpty()) {
            return 0d;
        }
        int mid = sizes.size() / 2;
        return sizes.size() % 2 == 0 ? (sizes.get(mid - 1) + sizes.get(mid)) / 2.0 : sizes.get(mid);
    }

    private boolean isHeading(String content, float fontSize, double median) {
        if (median <= 0 || content.length() < MIN_HEADING_LENGTH || content.length() > MAX_HEADING_LENGTH) {
            return false;
        }
        return fontSize > median * HEADING_MULTIPLIER;
    }

    private List<Hyperlink> linksOn(PDPage page, int pageNumber) throws IOException {
        List<PDAnnotationLink> annotations = new ArrayList<>();
        List<String> urls = new ArrayList<>();
        for (PDAnnotation annotation : page.getAnnotations()) {
            if (!(annotation instanceof PDAnnotationLink link)) {
                continue;
            }
            PDAction action = link.getAction();
            if (action instanceof PDActionURI uri && uri.getURI() != null) {
                annotations.add(link);
                urls.add(uri.getURI());
            }
        }
        if (annotations.isEmpty()) {
            return List.of();
        }

        PDFTextStripperByArea stripper = new PDFTextStripperByArea();
        stripper.setSortByPosition(true);
        float pageHeight = page.getMediaBox().getHeight();
        for (int i = 0; i < annotations.size(); i++) {
            PDRectangle rect = annotations.get(i).getRectangle();
            if (rect != null) {
                stripper.addRegion(regionName(i), new Rectangle2D.Float(
                        rect.getLowerLeftX(), pageHeight - rect.getUpperRightY(), rect.getWidth(), rect.getHeight()));
            }
        }
        stripper.extractRegions(page);

        List<Hyperlink> links = new ArrayList<>(annotations.size());
        for (int i = 0; i < annotations.size(); i++) {
            String text = stripper.getRegions().contains(regionName(i)) ? stripper.getTextForRegion(regionName(i)) : "";
            links.add(new Hyperlink(pageNumber, text == null ? "" : text.strip(), urls.get(i)));
        }
        return links;
    }

    private static String regionName(int index) {
        return "link-" + index;
    }

    /**
     * JPEG streams are copied as they are; every other image is decoded and re-encoded as PNG.
     */
    private ExtractedImage toImage(PDImageXObject image, int sequence, int pageNumber) throws IOException {
        if ("jpg".equals(image.getSuffix())) {
            try (InputStream input = image.getStream().createInputStream(List.of(COSName.DCT_DECODE.getName()))) {
                return new ExtractedImage(sequence, pageNumber, input.readAllBytes(),
                        image.getWidth(), image.getHeight(), "jpeg");
            }
        }
        BufferedImage buffered = image.getImage();
        if (buffered == null) {
            throw new IOException("PDFBox returned no raster for image " + sequence);
        }
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        if (!ImageIO.write(buffered, "png", output)) {
            throw new IOException("No PNG writer available");
        }
        return new ExtractedImage(sequence, pageNumber, output.toByteArray(),
                buffered.getWidth(), buffered.getHeight(), "png");
    }
}
