package com.example.magazinetoc.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ordered page records for the leading pages of one document.
 */
public class PageText {
    private final List<PageRecord> pages;

    public PageText(List<PageRecord> pages) {
        List<PageRecord> sorted = new ArrayList<>(pages);
        sorted.sort((a, b) -> Integer.compare(a.getPageNumber(), b.getPageNumber()));
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).getPageNumber() == sorted.get(i - 1).getPageNumber()) {
                throw new IllegalArgumentException("Duplicate page " + sorted.get(i).getPageNumber());
            }
        }
        this.pages = Collections.unmodifiableList(sorted);
    }

    public static PageText ofLayoutPages(String... texts) {
        List<PageRecord> records = new ArrayList<>();
        for (int i = 0; i < texts.length; i++) {
            records.add(new PageRecord(i + 1, texts[i], ExtractionMode.LAYOUT));
        }
        return new PageText(records);
    }

    public List<PageRecord> getPages() {
        return pages;
    }

    public Optional<PageRecord> getPage(int pageNumber) {
        return pages.stream().filter(p -> p.getPageNumber() == pageNumber).findFirst();
    }

    public String getFirstPageText() {
        return pages.isEmpty() ? "" : pages.get(0).getText();
    }

    /** Primary text of all pages joined by newlines. */
    public String joinedText() {
        return pages.stream().map(PageRecord::getText).collect(Collectors.joining("\n"));
    }

    /** Alternate text of all pages; pages without one contribute their primary text. */
    public String joinedAlternateText() {
        return pages.stream()
                .map(p -> p.hasAlternateText() ? p.getAlternateText() : p.getText())
                .collect(Collectors.joining("\n"));
    }

    public boolean hasAlternateText() {
        return pages.stream().anyMatch(PageRecord::hasAlternateText);
    }

    public boolean isBlank() {
        return pages.stream().allMatch(PageRecord::isBlank);
    }

    public Map<Integer, ExtractionMode> modesByPage() {
        Map<Integer, ExtractionMode> modes = new LinkedHashMap<>();
        for (PageRecord p : pages) {
            modes.put(p.getPageNumber(), p.getMode());
        }
        return modes;
    }

    public int size() {
        return pages.size();
    }
}
