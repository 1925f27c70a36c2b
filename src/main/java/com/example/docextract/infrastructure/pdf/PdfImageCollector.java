package com.example.docextract.infrastructure.pdf;

import org.apache.pdfbox.contentstream.PDFStreamEngine;
import org.apache.pdfbox.contentstream.operator.MissingOperandException;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.contentstream.operator.OperatorName;
import org.apache.pdfbox.contentstream.operator.OperatorProcessor;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.graphics.PDXObject;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

import java.io.IOException;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.Collections;

/**
 * Walks a page's content stream and records the image XObjects it draws, in drawing order.
 * Form XObjects are followed so images nested in forms are found too.
 * An image drawn several times on the same page is reported once.
 */
final class PdfImageCollector extends PDFStreamEngine {

    private final List<PDImageXObject> images = new ArrayList<>();
    private final Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<>());

    private PdfImageCollector() {
        addOperator(new DrawObject(this));
    }

    /**
     * @param page page to scan
     * @return images drawn on the page
     * @throws IOException when the content stream cannot be parsed
     */
    static List<PDImageXObject> imagesOn(PDPage page) throws IOException {
        PdfImageCollector collector = new PdfImageCollector();
        collector.processPage(page);
        return collector.images;
    }

    private void record(PDImageXObject image) {
        if (seen.add(image.getCOSObject())) {
            images.add(image);
        }
    }

    /**
     * Handles the "Do" operator: images are recorded, forms are descended into.
     */
    private static final class DrawObject extends OperatorProcessor {
        private final PdfImageCollector collector;

        DrawObject(PdfImageCollector collector) {
            super(collector);
            this.collector = collector;
        }

        @Override
        public void process(Operator operator, List<COSBase> operands) throws IOException {
            if (operands.isEmpty()) {
                throw new MissingOperandException(operator, operands);
            }
            if (!(operands.get(0) instanceof COSName objectName)) {
                return;
            }
            PDResources resources = collector.getResources();
            if (resources == null) {
                return;
            }
            PDXObject xObject = resources.getXObject(objectName);
            if (xObject instanceof PDImageXObject image) {
                collector.record(image);
            } else if (xObject instanceof PDFormXObject form) {
                collector.showForm(form);
            }
        }

        @Override
        public String getName() {
            return OperatorName.DRAW_OBJECT;
        }
    }
}
