package com.example.magazinetoc.strategy.impl;

import com.example.magazinetoc.model.ExtractionMode;
import com.example.magazinetoc.model.SourceDocument;
import com.example.magazinetoc.strategy.TextExtractionStrategy;
import com.example.magazinetoc.util.LayoutTextStripper;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

@Component("layoutStrategy")
public class PdfBoxLayoutStrategy implements TextExtractionStrategy {

    @Override
    public ExtractionMode getMode() {
        return ExtractionMode.LAYOUT;
    }

    @Override
    public List<String> extractPages(SourceDocument document, int firstPage, int lastPage) throws IOException {
        List<String> pages = new ArrayList<>();
        try (PDDocument doc = PDDocument.load(document.getPath().toFile())) {
            LayoutTextStripper stripper = new LayoutTextStripper();
            int last = Math.min(lastPage, doc.getNumberOfPages());
            for (int i = Math.max(1, firstPage); i <= last; i++) {
                stripper.setStartPage(i);
                stripper.setEndPage(i);
                pages.add(stripper.getText(doc));
            }
        }
        return pages;
    }
}
