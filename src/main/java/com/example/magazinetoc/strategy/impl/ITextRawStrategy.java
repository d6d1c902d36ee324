package com.example.magazinetoc.strategy.impl;

import com.example.magazinetoc.model.ExtractionMode;
import com.example.magazinetoc.model.SourceDocument;
import com.example.magazinetoc.strategy.TextExtractionStrategy;
import com.example.magazinetoc.util.RawTextCollector;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.canvas.parser.PdfCanvasProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

@Component("rawStrategy")
public class ITextRawStrategy implements TextExtractionStrategy {

    private static final Logger logger = LoggerFactory.getLogger(ITextRawStrategy.class);

    @Override
    public ExtractionMode getMode() {
        return ExtractionMode.RAW;
    }

    @Override
    public List<String> extractPages(SourceDocument document, int firstPage, int lastPage) throws IOException {
        List<String> pages = new ArrayList<>();
        try (PdfDocument pdf = new PdfDocument(new PdfReader(document.getPath().toString()))) {
            int last = Math.min(lastPage, pdf.getNumberOfPages());
            for (int i = Math.max(1, firstPage); i <= last; i++) {
                RawTextCollector collector = new RawTextCollector();
                try {
                    new PdfCanvasProcessor(collector).processPageContent(pdf.getPage(i));
                } catch (RuntimeException e) {
                    // iText font parsing can fail on a single page; keep what was collected so far
                    logger.warn("Raw extraction failed on page {} of {}: {}", i, document.getFileName(), e.getMessage());
                }
                collector.finish();
                pages.add(collector.getText());
            }
        }
        return pages;
    }
}
