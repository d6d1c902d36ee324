package com.example.magazinetoc.service;

import com.example.magazinetoc.exception.ExtractionFailureException;
import com.example.magazinetoc.model.ExtractionMode;
import com.example.magazinetoc.model.PageText;
import com.example.magazinetoc.model.SourceDocument;
import com.example.magazinetoc.strategy.TextExtractionStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the layout/raw/OCR fallback order of {@link PageTextProvider}.
 */
class PageTextProviderTest {

    private static final String FULL_PAGE = "FICTION\n" + "The Lottery, by Shirley Jackson .... 34\n".repeat(20);

    private TextExtractionStrategy layout;
    private TextExtractionStrategy raw;
    private TextExtractionStrategy ocr;
    private PageTextProvider provider;
    private final SourceDocument document = new SourceDocument(Paths.get("issue.pdf"), 16, 3);

    @BeforeEach
    void setUp() {
        layout = mock(TextExtractionStrategy.class);
        raw = mock(TextExtractionStrategy.class);
        ocr = mock(TextExtractionStrategy.class);
        when(layout.getMode()).thenReturn(ExtractionMode.LAYOUT);
        when(raw.getMode()).thenReturn(ExtractionMode.RAW);
        when(ocr.getMode()).thenReturn(ExtractionMode.OCR);
        provider = new PageTextProvider(layout, raw, ocr, 300);
    }

    @Test
    void ocrRunsForExactlyTheLeadingPagesWhenSparse() throws IOException {
        when(layout.extractPages(any(), anyInt(), anyInt())).thenReturn(List.of("", " ", "", FULL_PAGE, FULL_PAGE));
        when(raw.extractPages(any(), anyInt(), anyInt())).thenReturn(List.of("", "", "", FULL_PAGE, FULL_PAGE));
        when(ocr.extractPages(any(), anyInt(), anyInt())).thenReturn(List.of("cover", "ads", "CONTENTS"));

        PageText text = provider.getText(document);

        verify(ocr).extractPages(document, 1, 3);
        assertThat(text.modesByPage()).isEqualTo(Map.of(
                1, ExtractionMode.OCR, 2, ExtractionMode.OCR, 3, ExtractionMode.OCR,
                4, ExtractionMode.LAYOUT, 5, ExtractionMode.LAYOUT));
        assertThat(text.getPage(3).orElseThrow().getText()).isEqualTo("CONTENTS");
    }

    @Test
    void ocrIsSkippedWhenLeadingPagesHaveText() throws IOException {
        when(layout.extractPages(any(), anyInt(), anyInt())).thenReturn(List.of(FULL_PAGE, FULL_PAGE));
        when(raw.extractPages(any(), anyInt(), anyInt())).thenReturn(List.of(FULL_PAGE, FULL_PAGE));

        PageText text = provider.getText(document);

        verify(ocr, never()).extractPages(any(), anyInt(), anyInt());
        assertThat(text.getPage(1).orElseThrow().hasAlternateText()).isTrue();
        assertThat(text.modesByPage().values()).containsOnly(ExtractionMode.LAYOUT);
    }

    @Test
    void imageOnlyPagesAreServedByOcr() throws IOException {
        when(layout.extractPages(any(), anyInt(), anyInt())).thenReturn(List.of("", "", ""));
        when(raw.extractPages(any(), anyInt(), anyInt())).thenReturn(List.of("", "", ""));
        when(ocr.extractPages(any(), eq(1), eq(3))).thenReturn(List.of("one", "two", "three"));

        PageText text = provider.getText(document);

        assertThat(text.modesByPage()).containsOnlyKeys(1, 2, 3);
        assertThat(text.modesByPage().values()).containsOnly(ExtractionMode.OCR);
        assertThat(text.hasAlternateText()).isFalse();
    }

    @Test
    void rawBecomesPrimaryWhenLayoutIsEmpty() throws IOException {
        when(layout.extractPages(any(), anyInt(), anyInt())).thenReturn(List.of("", ""));
        when(raw.extractPages(any(), anyInt(), anyInt())).thenReturn(List.of(FULL_PAGE, FULL_PAGE));

        PageText text = provider.getText(document);

        assertThat(text.modesByPage().values()).containsOnly(ExtractionMode.RAW);
        verify(ocr, never()).extractPages(any(), anyInt(), anyInt());
    }

    @Test
    void ocrFirstZeroDisablesOcr() throws IOException {
        SourceDocument noOcr = new SourceDocument(Paths.get("issue.pdf"), 16, 0);
        when(layout.extractPages(any(), anyInt(), anyInt())).thenReturn(List.of("x", FULL_PAGE));
        when(raw.extractPages(any(), anyInt(), anyInt())).thenReturn(List.of("x", FULL_PAGE));

        provider.getText(noOcr);

        verify(ocr, never()).extractPages(any(), anyInt(), anyInt());
    }

    @Test
    void failsWhenNoModeProducesText() throws IOException {
        IOException broken = new IOException("not a PDF");
        when(layout.extractPages(any(), anyInt(), anyInt())).thenThrow(new IOException("layout broken"));
        when(raw.extractPages(any(), anyInt(), anyInt())).thenThrow(broken);
        when(ocr.extractPages(any(), anyInt(), anyInt())).thenReturn(List.of());

        ExtractionFailureException e = assertThrows(ExtractionFailureException.class, () -> provider.getText(document));

        assertThat(e.getDocument()).isEqualTo(document.getPath());
        assertThat(e.getCause()).isSameAs(broken);
    }
}
