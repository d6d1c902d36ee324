package com.example.magazinetoc.strategy;

import com.example.magazinetoc.model.ExtractionMode;
import com.example.magazinetoc.model.SourceDocument;

import java.io.IOException;
import java.util.List;

/**
 * One way of turning PDF pages into text.
 *
 * The provider layers several of these: layout text first, raw text if layout
 * gives nothing, OCR for sparse leading pages.
 */
public interface TextExtractionStrategy {

    ExtractionMode getMode();

    /**
     * Extracts pages {@code firstPage..lastPage} (1-based, inclusive). The range is
     * clamped to the document's page count, so the returned list may be shorter
     * than requested; element {@code i} is page {@code firstPage + i}.
     *
     * @throws IOException when the PDF cannot be read
     */
    List<String> extractPages(SourceDocument document, int firstPage, int lastPage) throws IOException;
}
