package com.example.magazinetoc.parser;

import com.example.magazinetoc.model.PageText;
import com.example.magazinetoc.model.ParseResult;
import com.example.magazinetoc.model.TocEntry;
import com.example.magazinetoc.model.TocOptions;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AtlanticParserTest {

    private final AtlanticParser parser = new AtlanticParser();

    @Test
    void bylineLineCreditsPrecedingItem() {
        PageText text = PageText.ofLayoutPages(String.join("\n",
                "CONTENTS",
                "FEATURES",
                "The Great Divide .... 24",
                "By Jane Doe",
                "The Last Frontier .... 40 - John Roe"));

        ParseResult result = parser.parse(text, TocOptions.defaults());

        assertThat(result.getItems()).containsExactly(
                TocEntry.item("FEATURES", "The Great Divide", "Jane Doe", 24),
                TocEntry.item("FEATURES", "The Last Frontier", "John Roe", 40));
    }

    @Test
    void longDotLeadersKeepHeadingAndItem() {
        PageText text = PageText.ofLayoutPages(String.join("\n",
                "CONTENTS",
                "FEATURES ............................ 24",
                "The Great Divide ........................ 24",
                "By Jane Doe"));

        ParseResult result = parser.parse(text, TocOptions.defaults());

        assertThat(result.getEntries()).containsExactly(
                TocEntry.heading("FEATURES", 24),
                TocEntry.item("FEATURES", "The Great Divide", "Jane Doe", 24));
    }

    @Test
    void bylineWithoutPrecedingItemIsUnmatched() {
        PageText text = PageText.ofLayoutPages("DISPATCHES\nBy Jane Doe\nThe Week .... 12");

        ParseResult result = parser.parse(text, TocOptions.defaults());

        assertThat(result.getItems()).containsExactly(TocEntry.item("DISPATCHES", "The Week", null, 12));
        assertThat(result.getDiagnostics().getUnmatchedLines()).isEqualTo(1);
    }

    @Test
    void bylineDoesNotOverrideExistingAuthor() {
        PageText text = PageText.ofLayoutPages("IDEAS\nThe Case, by Ann Lee .... 30\nBy Jane Doe");

        ParseResult result = parser.parse(text, TocOptions.defaults());

        assertThat(result.getItems()).containsExactly(TocEntry.item("IDEAS", "The Case", "Ann Lee", 30));
    }
}
