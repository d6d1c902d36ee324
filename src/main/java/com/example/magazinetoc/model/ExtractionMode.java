package com.example.magazinetoc.model;

/**
 * How the text of a page was obtained.
 */
public enum ExtractionMode {
    /** Native text layer, layout preserved. */
    LAYOUT("layout"),
    /** Native text layer in content-stream order. */
    RAW("raw"),
    /** Rasterized page run through Tesseract. */
    OCR("ocr");

    private final String code;

    ExtractionMode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
