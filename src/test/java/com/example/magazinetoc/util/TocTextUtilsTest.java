package com.example.magazinetoc.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TocTextUtilsTest {

    @Test
    void normalizeFoldsTypography() {
        assertThat(TocTextUtils.normalize("“Evening” — Jane’s poem\tfiﬁ"))
                .isEqualTo("\"Evening\" - Jane's poem  fifi");
    }

    @Test
    void dehyphenateRejoinsBrokenWords() {
        assertThat(TocTextUtils.dehyphenate("maga-\nzine\nNEW-\nYORK")).isEqualTo("magazine\nNEW-\nYORK");
    }

    @Test
    void countsOnlyLettersAndDigits() {
        assertThat(TocTextUtils.countSignificantChars("a b. 1 \n ...")).isEqualTo(3);
        assertThat(TocTextUtils.countSignificantChars(null)).isZero();
    }

    @Test
    void recognisesPageNumbers() {
        assertThat(TocTextUtils.isPageNumberOnly("  34 ")).isTrue();
        assertThat(TocTextUtils.isPageNumberOnly("1999")).isFalse();
        assertThat(TocTextUtils.endsWithPageNumber("The Lottery .... 34")).isTrue();
        assertThat(TocTextUtils.endsWithPageNumber("Issue 1999")).isFalse();
        assertThat(TocTextUtils.countStandaloneNumbers("LETTERS 2 READINGS 13 2024")).isEqualTo(2);
    }

    @Test
    void flagsSymbolHeavyLinesAsGarbage() {
        assertThat(TocTextUtils.isGarbageLine("~~~~ ||| ---- ***")).isTrue();
        assertThat(TocTextUtils.isGarbageLine("The Lottery .... 34")).isFalse();
        assertThat(TocTextUtils.isGarbageLine("The Lottery ........................ 34")).isFalse();
        assertThat(TocTextUtils.isGarbageLine("FICTION \u2026\u2026\u2026\u2026\u2026\u2026\u2026\u2026 50")).isFalse();
        assertThat(TocTextUtils.isGarbageLine("...")).isFalse();
    }

    @Test
    void squashCollapsesWhitespace() {
        assertThat(TocTextUtils.squash("  The   Deadline \t now ")).isEqualTo("The Deadline now");
    }
}
