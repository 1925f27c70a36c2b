package com.example.docextract.infrastructure.pptx;

import com.example.docextract.domain.model.DocumentFormat;
import com.example.docextract.domain.model.ExtractedImage;
import com.example.docextract.domain.model.ExtractedTable;
import com.example.docextract.domain.model.ExtractionFeature;
import com.example.docextract.domain.model.Hyperlink;
import com.example.docextract.domain.model.TextBlock;
import com.example.docextract.infrastructure.document.ContentExtractor;
import com.example.docextract.infrastructure.document.ExtractionWarnings;
import com.example.docextract.infrastructure.document.ImageProbe;
import com.example.docextract.infrastructure.document.LoadedDocument;

import org.apache.poi.sl.usermodel.Placeholder;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFGroupShape;
import org.apache.poi.xslf.usermodel.XSLFHyperlink;
import org.apache.poi.xslf.usermodel.XSLFPictureData;
import org.apache.poi.xslf.usermodel.XSLFPictureShape;
import org.apache.poi.xslf.usermodel.XSLFShape;
import org.apache.poi.xslf.usermodel.XSLFSimpleShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTable;
import org.apache.poi.xslf.usermodel.XSLFTableCell;
import org.apache.poi.xslf.usermodel.XSLFTableRow;
import org.apache.poi.xslf.usermodel.XSLFTextParagraph;
import org.apache.poi.xslf.usermodel.XSLFTextRun;
import org.apache.poi.xslf.usermodel.XSLFTextShape;
import org.springframework.stereotype.Component;

import java.awt.Dimension;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Extracts PPTX content with POI XSLF, slide by slide, in shape-tree order with groups flattened.
 */
@Component
public class XslfContentExtractor implements ContentExtractor {

    private static final String TEXT_STYLE = "TEXT";

    @Override
    public DocumentFormat format() {
        return DocumentFormat.PPTX;
    }

    /**
     * One block per non-blank paragraph of every text shape; title placeholders are headings.
     * The style is the placeholder type, or {@code TEXT} for free text boxes.
     */
    @Override
    public List<TextBlock> extractText(LoadedDocument document, ExtractionWarnings warnings) {
        List<TextBlock> blocks = new ArrayList<>();
        forEachShape(document, (slideNumber, shape) -> {
            if (!(shape instanceof XSLFTextShape textShape)) {
                return;
            }
            Placeholder placeholder = textShape.getPlaceholder();
            String style = placeholder != null ? placeholder.name() : TEXT_STYLE;
            boolean heading = placeholder == Placeholder.TITLE || placeholder == Placeholder.CENTERED_TITLE;
            for (XSLFTextParagraph paragraph : textShape.getTextParagraphs()) {
                String content = paragraph.getText();
                if (content == null || content.isBlank()) {
                    continue;
                }
                blocks.add(new TextBlock(slideNumber, content.strip(), style, heading, fontSize(paragraph)));
            }
        });
        return blocks;
    }

    /**
     * Shape-level links first, then run-level links of the shape's text.
     */
    @Override
    public List<Hyperlink> extractLinks(LoadedDocument document, ExtractionWarnings warnings) {
        List<Hyperlink> links = new ArrayList<>();
        forEachShape(document, (slideNumber, shape) -> {
            if (shape instanceof XSLFSimpleShape simpleShape) {
                XSLFHyperlink shapeLink = simpleShape.getHyperlink();
                if (shapeLink != null && shapeLink.getAddress() != null) {
                    String text = shape instanceof XSLFTextShape textShape ? textShape.getText() : shape.getShapeName();
                    links.add(new Hyperlink(slideNumber, text == null ? "" : text.strip(), shapeLink.getAddress()));
                }
            }
            if (shape instanceof XSLFTextShape textShape) {
                for (XSLFTextParagraph paragraph : textShape.getTextParagraphs()) {
                    for (XSLFTextRun run : paragraph.getTextRuns()) {
                        XSLFHyperlink link = run.getHyperlink();
                        if (link != null && link.getAddress() != null) {
                            String text = run.getRawText();
                            links.add(new Hyperlink(slideNumber, text == null ? "" : text.strip(), link.getAddress()));
                        }
                    }
                }
            }
        });
        return links;
    }

    @Override
    public List<ExtractedImage> extractImages(LoadedDocument document, ExtractionWarnings warnings) {
        List<ExtractedImage> images = new ArrayList<>();
        forEachShape(document, (slideNumber, shape) -> {
            if (!(shape instanceof XSLFPictureShape picture)) {
                return;
            }
            try {
                images.add(toImage(picture, images.size() + 1, slideNumber));
            } catch (IOException | RuntimeException ex) {
                warnings.add(slideNumber, ExtractionFeature.IMAGES, "Unreadable picture " + picture.getShapeName(), ex);
            }
        });
        return images;
    }

    /**
     * Table cells are read as plain text; merged cells keep their empty placeholders.
     */
    @Override
    public List<ExtractedTable> extractTables(LoadedDocument document, ExtractionWarnings warnings) {
        List<ExtractedTable> tables = new ArrayList<>();
        forEachShape(document, (slideNumber, shape) -> {
            if (!(shape instanceof XSLFTable table)) {
                return;
            }
            List<List<String>> rows = new ArrayList<>();
            for (XSLFTableRow row : table.getRows()) {
                List<String> cells = new ArrayList<>();
                for (XSLFTableCell cell : row.getCells()) {
                    String text = cell.getText();
                    cells.add(text == null ? "" : text.strip());
                }
                rows.add(cells);
            }
            if (rows.isEmpty()) {
                warnings.add(slideNumber, ExtractionFeature.TABLES, "Table without rows", null);
                return;
            }
            tables.add(new ExtractedTable(tables.size() + 1, slideNumber, rows));
        });
        return tables;
    }

    private void forEachShape(LoadedDocument document, SlideShapeVisitor visitor) {
        XMLSlideShow slideShow = document.unwrap(XMLSlideShow.class);
        int slideNumber = 0;
        for (XSLFSlide slide : slideShow.getSlides()) {
            slideNumber++;
            int current = slideNumber;
            for (XSLFShape shape : slide.getShapes()) {
                flatten(shape, flat -> visitor.visit(current, flat));
            }
        }
    }

    private void flatten(XSLFShape shape, Consumer<XSLFShape> consumer) {
        if (shape instanceof XSLFGroupShape group) {
            for (XSLFShape child : group.getShapes()) {
                flatten(child, consumer);
            }
            return;
        }
        consumer.accept(shape);
    }

    private ExtractedImage toImage(XSLFPictureShape picture, int sequence, int slideNumber) throws IOException {
        XSLFPictureData data = picture.getPictureData();
        if (data == null) {
            throw new IOException("Picture references no embedded data");
        }
        byte[] bytes = data.getData();
        ImageProbe.ImageInfo info = ImageProbe.probe(bytes, data.suggestFileExtension());
        int width = info.width();
        int height = info.height();
        if (width == 0 || height == 0) {
            Dimension pixels = data.getImageDimensionInPixels();
            if (pixels != null) {
                width = pixels.width;
                height = pixels.height;
            }
        }
        return new ExtractedImage(sequence, slideNumber, bytes, width, height, info.format());
    }

    private Float fontSize(XSLFTextParagraph paragraph) {
        for (XSLFTextRun run : paragraph.getTextRuns()) {
            Double size = run.getFontSize();
            if (size != null && size > 0) {
                return size.floatValue();
            }
        }
        return null;
    }

    @FunctionalInterface
    private interface SlideShapeVisitor {
        void visit(int slideNumber, XSLFShape shape);
    }
}
