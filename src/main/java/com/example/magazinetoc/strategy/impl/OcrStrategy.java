package com.example.magazinetoc.strategy.impl;

import com.example.magazinetoc.model.ExtractionMode;
import com.example.magazinetoc.model.SourceDocument;
import com.example.magazinetoc.ocr.OcrEngine;
import com.example.magazinetoc.strategy.TextExtractionStrategy;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Rasterizes pages with PDFBox and recognises them with an {@link OcrEngine}.
 * A page that fails to OCR comes back as an empty string.
 */
@Component("ocrStrategy")
public class OcrStrategy implements TextExtractionStrategy {

    private static final Logger logger = LoggerFactory.getLogger(OcrStrategy.class);

    private final OcrEngine ocrEngine;
    private final float dpi;

    public OcrStrategy(OcrEngine ocrEngine, @Value("${magtoc.ocr.dpi:300}") float dpi) {
        this.ocrEngine = ocrEngine;
        this.dpi = dpi;
    }

    @Override
    public ExtractionMode getMode() {
        return ExtractionMode.OCR;
    }

    @Override
    public List<String> extractPages(SourceDocument document, int firstPage, int lastPage) throws IOException {
        List<String> pages = new ArrayList<>();
        try (PDDocument doc = PDDocument.load(document.getPath().toFile())) {
            PDFRenderer renderer = new PDFRenderer(doc);
            int last = Math.min(lastPage, doc.getNumberOfPages());
            for (int i = Math.max(1, firstPage); i <= last; i++) {
                // PDFBox page index starts at 0
                BufferedImage image = renderer.renderImageWithDPI(i - 1, dpi, ImageType.GRAY);
                pages.add(recognise(image, i, document));
            }
        } catch (LinkageError e) {
            logger.error("Tesseract native library not found, OCR skipped for {}: {}", document.getFileName(), e.getMessage());
            return new ArrayList<>();
        }
        return pages;
    }

    private String recognise(BufferedImage image, int page, SourceDocument document) {
        try {
            String text = ocrEngine.doOCR(image);
            logger.debug("OCR page {} of {} ({}): {} chars", page, document.getFileName(), ocrEngine.getName(),
                    text == null ? 0 : text.length());
            return text == null ? "" : text;
        } catch (Exception e) {
            logger.warn("OCR error on page {} of {}: {}", page, document.getFileName(), e.getMessage());
            return "";
        }
    }
}
