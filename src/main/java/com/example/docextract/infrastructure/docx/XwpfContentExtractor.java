package com.example.docextract.infrastructure.docx;

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

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFHyperlink;
import org.apache.poi.xwpf.usermodel.XWPFHyperlinkRun;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFPicture;
import org.apache.poi.xwpf.usermodel.XWPFPictureData;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.BiConsumer;

/**
 * Extracts DOCX content with POI XWPF by walking body paragraphs and tables in order.
 * Links and images inside table cells are attributed to the page the table starts on.
 */
@Component
public class XwpfContentExtractor implements ContentExtractor {

    @Override
    public DocumentFormat format() {
        return DocumentFormat.DOCX;
    }

    /**
     * One block per non-blank body paragraph. Table text is reported through {@link #extractTables}.
     */
    @Override
    public List<TextBlock> extractText(LoadedDocument document, ExtractionWarnings warnings) {
        XWPFDocument docx = document.unwrap(XWPFDocument.class);
        List<TextBlock> blocks = new ArrayList<>();
        new DocxPageWalker(docx).walk(new DocxPageWalker.Visitor() {
            @Override
            public void paragraph(XWPFParagraph paragraph, int page) {
                String content = paragraph.getText();
                if (content == null || content.isBlank()) {
                    return;
                }
                String style = styleName(docx, paragraph);
                blocks.add(new TextBlock(page, content.strip(), style, isHeading(style), fontSize(paragraph)));
            }
        });
        return blocks;
    }

    @Override
    public List<Hyperlink> extractLinks(LoadedDocument document, ExtractionWarnings warnings) {
        XWPFDocument docx = document.unwrap(XWPFDocument.class);
        List<Hyperlink> links = new ArrayList<>();
        forEachParagraph(docx, (paragraph, page) -> links.addAll(linksIn(docx, paragraph, page)));
        return links;
    }

    @Override
    public List<ExtractedImage> extractImages(LoadedDocument document, ExtractionWarnings warnings) {
        XWPFDocument docx = document.unwrap(XWPFDocument.class);
        List<ExtractedImage> images = new ArrayList<>();
        forEachParagraph(docx, (paragraph, page) -> {
            for (XWPFRun run : paragraph.getRuns()) {
                for (XWPFPicture picture : run.getEmbeddedPictures()) {
                    try {
                        images.add(toImage(picture, images.size() + 1, page));
                    } catch (IOException | RuntimeException ex) {
                        warnings.add(page, ExtractionFeature.IMAGES, "Unreadable picture", ex);
                    }
                }
            }
        });
        return images;
    }

    /**
     * Body tables in order. Nested tables are not reported separately: their text is folded into
     * the enclosing cell.
     */
    @Override
    public List<ExtractedTable> extractTables(LoadedDocument document, ExtractionWarnings warnings) {
        XWPFDocument docx = document.unwrap(XWPFDocument.class);
        List<ExtractedTable> tables = new ArrayList<>();
        new DocxPageWalker(docx).walk(new DocxPageWalker.Visitor() {
            @Override
            public void table(XWPFTable table, int page) {
                List<List<String>> rows = new ArrayList<>();
                for (XWPFTableRow row : table.getRows()) {
                    List<String> cells = new ArrayList<>();
                    for (XWPFTableCell cell : row.getTableCells()) {
                        cells.add(cell.getTextRecursively().strip());
                    }
                    rows.add(cells);
                }
                if (rows.isEmpty()) {
                    warnings.add(page, ExtractionFeature.TABLES, "Table without rows", null);
                    return;
                }
                tables.add(new ExtractedTable(tables.size() + 1, page, rows));
            }
        });
        return tables;
    }

    /**
     * Visits body paragraphs and the paragraphs of body tables (nested tables included) in order.
     */
    private void forEachParagraph(XWPFDocument docx, BiConsumer<XWPFParagraph, Integer> consumer) {
        new DocxPageWalker(docx).walk(new DocxPageWalker.Visitor() {
            @Override
            public void paragraph(XWPFParagraph paragraph, int page) {
                consumer.accept(paragraph, page);
            }

            @Override
            public void table(XWPFTable table, int page) {
                visitTable(table, page, consumer);
            }
        });
    }

    private void visitTable(XWPFTable table, int page, BiConsumer<XWPFParagraph, Integer> consumer) {
        for (XWPFTableRow row : table.getRows()) {
            for (XWPFTableCell cell : row.getTableCells()) {
                for (XWPFParagraph paragraph : cell.getParagraphs()) {
                    consumer.accept(paragraph, page);
                }
                for (XWPFTable nested : cell.getTables()) {
                    visitTable(nested, page, consumer);
                }
            }
        }
    }

    /**
     * Consecutive runs of the same {@code w:hyperlink} element form one link.
     */
    private List<Hyperlink> linksIn(XWPFDocument docx, XWPFParagraph paragraph, int page) {
        List<Hyperlink> links = new ArrayList<>();
        Object currentElement = null;
        StringBuilder text = new StringBuilder();
        String url = null;
        for (XWPFRun run : paragraph.getRuns()) {
            if (!(run instanceof XWPFHyperlinkRun hyperlinkRun)) {
                continue;
            }
            Object element = hyperlinkRun.getCTHyperlink();
            if (element != currentElement) {
                if (url != null) {
                    links.add(new Hyperlink(page, text.toString().strip(), url));
                }
                currentElement = element;
                text.setLength(0);
                url = resolveTarget(docx, hyperlinkRun);
            }
            text.append(hyperlinkRun.text());
        }
        if (url != null) {
            links.add(new Hyperlink(page, text.toString().strip(), url));
        }
        return links;
    }

    private String resolveTarget(XWPFDocument docx, XWPFHyperlinkRun run) {
        XWPFHyperlink hyperlink = run.getHyperlink(docx);
        if (hyperlink != null && hyperlink.getURL() != null) {
            return hyperlink.getURL();
        }
        String anchor = run.getAnchor();
        return anchor != null && !anchor.isBlank() ? "#" + anchor : null;
    }

    private ExtractedImage toImage(XWPFPicture picture, int sequence, int page) throws IOException {
        XWPFPictureData data = picture.getPictureData();
        if (data == null) {
            throw new IOException("Picture references no embedded data (linked image?)");
        }
        byte[] bytes = data.getData();
        ImageProbe.ImageInfo info = ImageProbe.probe(bytes, data.suggestFileExtension());
        return new ExtractedImage(sequence, page, bytes, info.width(), info.height(), info.format());
    }

    private String styleName(XWPFDocument docx, XWPFParagraph paragraph) {
        String styleId = paragraph.getStyleID();
        if (styleId == null) {
            return null;
        }
        XWPFStyles styles = docx.getStyles();
        XWPFStyle style = styles != null ? styles.getStyle(styleId) : null;
        return style != null && style.getName() != null ? style.getName() : styleId;
    }

    private boolean isHeading(String style) {
        if (style == null) {
            return false;
        }
        String normalized = style.toLowerCase(Locale.ROOT).replace(" ", "");
        return normalized.startsWith("heading") || normalized.equals("title");
    }

    private Float fontSize(XWPFParagraph paragraph) {
        for (XWPFRun run : paragraph.getRuns()) {
            Double size = run.getFontSizeAsDouble();
            if (size != null && size > 0) {
                return size.floatValue();
            }
        }
        return null;
    }
}
