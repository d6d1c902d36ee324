package com.example.magazinetoc.model;

import java.util.Objects;

/**
 * Text of one page. {@code alternateText} holds the raw-order native extraction
 * when the primary text came from layout mode; it is {@code null} otherwise.
 */
public class PageRecord {
    private final int pageNumber;
    private final String text;
    private final ExtractionMode mode;
    private final String alternateText;

    public PageRecord(int pageNumber, String text, ExtractionMode mode) {
        this(pageNumber, text, mode, null);
    }

    public PageRecord(int pageNumber, String text, ExtractionMode mode, String alternateText) {
        if (pageNumber < 1) {
            throw new IllegalArgumentException("pageNumber is 1-based, was " + pageNumber);
        }
        this.pageNumber = pageNumber;
        this.text = text == null ? "" : text;
        this.mode = Objects.requireNonNull(mode, "mode");
        this.alternateText = alternateText;
    }

    public int getPageNumber() {
        return pageNumber;
    }

    public String getText() {
        return text;
    }

    public ExtractionMode getMode() {
        return mode;
    }

    public String getAlternateText() {
        return alternateText;
    }

    public boolean hasAlternateText() {
        return alternateText != null && !alternateText.isBlank();
    }

    public boolean isBlank() {
        return text.isBlank();
    }
}
