package com.example.magazinetoc.ocr.impl;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TesseractEngineTest {

    @Test
    void configuredDatapathTakesPrecedence() {
        assertThat(TesseractEngine.resolveDatapath("/opt/tessdata")).isEqualTo("/opt/tessdata");
    }

    @Test
    void blankDatapathFallsBackToEnvironmentOrLocalDirectory() {
        assertThat(TesseractEngine.resolveDatapath(" ")).isNotBlank();
    }

    @Test
    void engineReportsItsName() {
        assertThat(new TesseractEngine("/opt/tessdata", "eng").getName()).isEqualTo("tesseract");
    }
}
