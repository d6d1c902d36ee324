package com.example.magazinetoc.service;

import com.example.magazinetoc.exception.ExtractionFailureException;
import com.example.magazinetoc.model.ExtractionMode;
import com.example.magazinetoc.model.PageRecord;
import com.example.magazinetoc.model.PageText;
import com.example.magazinetoc.model.SourceDocument;
import com.example.magazinetoc.strategy.TextExtractionStrategy;
import com.example.magazinetoc.util.TocTextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Obtains the text of a document's leading pages.
 *
 * <ol>
 *   <li>layout text for pages 1..maxPages (raw text is collected alongside as the alternate);</li>
 *   <li>raw text becomes primary if layout yields nothing at all;</li>
 *   <li>if pages 1..ocrFirstPages are sparse, exactly those pages are OCR'd and replaced
 *       wherever OCR produced text.</li>
 * </ol>
 */
@Service
public class PageTextProvider {

    private static final Logger logger = LoggerFactory.getLogger(PageTextProvider.class);

    private final TextExtractionStrategy layoutStrategy;
    private final TextExtractionStrategy rawStrategy;
    private final TextExtractionStrategy ocrStrategy;
    private final int sparseThreshold;

    public PageTextProvider(@Qualifier("layoutStrategy") TextExtractionStrategy layoutStrategy,
                            @Qualifier("rawStrategy") TextExtractionStrategy rawStrategy,
                            @Qualifier("ocrStrategy") TextExtractionStrategy ocrStrategy,
                            @Value("${magtoc.ocr.sparse-threshold:300}") int sparseThreshold) {
        this.layoutStrategy = layoutStrategy;
        this.rawStrategy = rawStrategy;
        this.ocrStrategy = ocrStrategy;
        this.sparseThreshold = sparseThreshold;
    }

    public PageText getText(SourceDocument document) {
        List<Exception> failures = new ArrayList<>();
        int maxPages = document.getMaxPages();

        List<String> layout = tryExtract(layoutStrategy, document, 1, maxPages, failures);
        List<String> raw = tryExtract(rawStrategy, document, 1, maxPages, failures);
        boolean layoutEmpty = allBlank(layout);
        if (layoutEmpty) {
            logger.info("Layout extraction yielded no text for {}, using raw extraction", document.getFileName());
        }

        List<PageRecord> records = new ArrayList<>();
        int pageCount = Math.max(layout.size(), raw.size());
        for (int i = 0; i < pageCount; i++) {
            String layoutText = i < layout.size() ? layout.get(i) : "";
            String rawText = i < raw.size() ? raw.get(i) : null;
            if (layoutEmpty) {
                records.add(new PageRecord(i + 1, rawText == null ? "" : rawText, ExtractionMode.RAW));
            } else {
                records.add(new PageRecord(i + 1, layoutText, ExtractionMode.LAYOUT, rawText));
            }
        }

        int ocrPages = Math.min(document.getOcrFirstPages(), maxPages);
        if (ocrPages > 0) {
            String leading = records.stream()
                    .filter(r -> r.getPageNumber() <= ocrPages)
                    .map(PageRecord::getText)
                    .collect(Collectors.joining("\n"));
            int significant = TocTextUtils.countSignificantChars(leading);
            if (significant < sparseThreshold) {
                logger.info("Sparse text in first {} page(s) of {} ({} < {} chars), running OCR",
                        ocrPages, document.getFileName(), significant, sparseThreshold);
                List<String> ocr = tryExtract(ocrStrategy, document, 1, ocrPages, failures);
                applyOcr(records, ocr);
            }
        }

        PageText pageText = new PageText(records);
        if (pageText.size() == 0 || pageText.isBlank()) {
            String message = "No text could be extracted from " + document.getPath()
                    + " (layout, raw and OCR all empty)";
            Exception cause = failures.isEmpty() ? null : failures.get(failures.size() - 1);
            throw cause == null
                    ? new ExtractionFailureException(document.getPath(), message)
                    : new ExtractionFailureException(document.getPath(), message, cause);
        }

        pageText.getPages().forEach(p -> logger.debug("{} page {}: mode={}, {} chars",
                document.getFileName(), p.getPageNumber(), p.getMode().getCode(), p.getText().length()));
        return pageText;
    }

    private void applyOcr(List<PageRecord> records, List<String> ocr) {
        for (int i = 0; i < ocr.size(); i++) {
            String text = ocr.get(i);
            if (text == null || text.isBlank()) continue;
            PageRecord replacement = new PageRecord(i + 1, text, ExtractionMode.OCR);
            if (i < records.size()) {
                records.set(i, replacement);
            } else {
                records.add(replacement);
            }
        }
    }

    private List<String> tryExtract(TextExtractionStrategy strategy, SourceDocument document,
                                    int firstPage, int lastPage, List<Exception> failures) {
        try {
            List<String> pages = strategy.extractPages(document, firstPage, lastPage);
            return pages == null ? Collections.emptyList() : pages;
        } catch (IOException | RuntimeException e) {
            logger.warn("{} extraction failed for {}: {}", strategy.getMode().getCode(), document.getFileName(), e.getMessage());
            failures.add(e);
            return Collections.emptyList();
        }
    }

    private static boolean allBlank(List<String> pages) {
        return pages.stream().allMatch(p -> p == null || p.isBlank());
    }
}
