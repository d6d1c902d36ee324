package com.example.magazinetoc.ocr;

import java.awt.image.BufferedImage;

public interface OcrEngine {

    /**
     * Recognises the text of one rasterized page.
     */
    String doOCR(BufferedImage image) throws Exception;

    /** Short name for logs. */
    default String getName() {
        return getClass().getSimpleName();
    }
}
