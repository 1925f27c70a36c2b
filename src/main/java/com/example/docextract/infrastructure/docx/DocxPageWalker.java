package com.example.docextract.infrastructure.docx;

import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTBr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTR;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STBrType;

/**
 * Walks the body of a DOCX document in order and assigns a page number to each paragraph and table.
 *
 * <p>DOCX files carry no layout, so pages are estimated from break markers. When Word left
 * {@code w:lastRenderedPageBreak} markers they describe the last rendering and are used alone;
 * otherwise explicit page breaks ({@code w:br w:type="page"} and {@code pageBreakBefore}) count.
 */
final class DocxPageWalker {

    /**
     * Receives body elements with the page they start on.
     */
    interface Visitor {
        default void paragraph(XWPFParagraph paragraph, int page) {
        }

        default void table(XWPFTable table, int page) {
        }
    }

    private final XWPFDocument document;
    private final boolean renderedBreaks;

    DocxPageWalker(XWPFDocument document) {
        this.document = document;
        this.renderedBreaks = hasRenderedBreaks(document);
    }

    /**
     * Visits every paragraph and table of the body.
     *
     * @param visitor callback
     * @return number of pages seen, at least 1
     */
    int walk(Visitor visitor) {
        int page = 1;
        for (IBodyElement element : document.getBodyElements()) {
            if (element instanceof XWPFParagraph paragraph) {
                if (!renderedBreaks && paragraph.isPageBreak()) {
                    page++;
                }
                int pending = 0;
                boolean seenText = false;
                for (XWPFRun run : paragraph.getRuns()) {
                    int breaks = countBreaks(run.getCTR());
                    if (seenText) {
                        pending += breaks;
                    } else {
                        page += breaks;
                    }
                    String text = run.text();
                    if (text != null && !text.isBlank()) {
                        seenText = true;
                    }
                }
                visitor.paragraph(paragraph, page);
                page += pending;
            } else if (element instanceof XWPFTable table) {
                visitor.table(table, page);
            }
        }
        return page;
    }

    int pageCount() {
        return walk(new Visitor() {
        });
    }

    private int countBreaks(CTR run) {
        if (renderedBreaks) {
            return run.getLastRenderedPageBreakList().size();
        }
        int breaks = 0;
        for (CTBr br : run.getBrList()) {
            if (br.getType() == STBrType.PAGE) {
                breaks++;
            }
        }
        return breaks;
    }

    private static boolean hasRenderedBreaks(XWPFDocument document) {
        for (XWPFParagraph paragraph : document.getParagraphs()) {
            for (XWPFRun run : paragraph.getRuns()) {
                if (!run.getCTR().getLastRenderedPageBreakList().isEmpty()) {
                    return true;
                }
            }
        }
        return false;
    }
}
