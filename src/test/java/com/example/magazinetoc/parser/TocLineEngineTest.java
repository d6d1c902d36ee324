package com.example.magazinetoc.parser;

import com.example.magazinetoc.model.Brand;
import com.example.magazinetoc.model.TocEntry;
import com.example.magazinetoc.model.TocOptions;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TocLineEngineTest {

    private final TocLineEngine engine = new TocLineEngine();
    private final BrandLayout layout = BrandLayout.builder(Brand.NEW_YORKER)
            .sections(BrandVocabulary.NEW_YORKER_SECTIONS)
            .itemPatterns(
                    ItemPatterns.TITLE_TRAILING_PAGE,
                    ItemPatterns.TITLE_LEADERS_PAGE,
                    ItemPatterns.AUTHOR_PAGE_TITLE,
                    ItemPatterns.TITLE_SPACES_PAGE)
            .noiseMarkers(CommonNoise.MARKERS)
            .noisePatterns(CommonNoise.PATTERNS)
            .build();

    private ParseContext parse(String text, TocOptions options) {
        ParseContext ctx = engine.newContext();
        engine.parseBlock(text, layout, options, ctx);
        return ctx;
    }

    @Test
    void patternsAreTriedMostSpecificFirst() {
        assertThat(layout.getItemPatterns()).containsExactly(
                ItemPatterns.AUTHOR_PAGE_TITLE,
                ItemPatterns.TITLE_LEADERS_PAGE,
                ItemPatterns.TITLE_SPACES_PAGE,
                ItemPatterns.TITLE_TRAILING_PAGE);
    }

    @Test
    void itemsBeforeAnyHeadingGoToDefaultSection() {
        ParseContext ctx = parse("Opening .... 3", TocOptions.defaults());

        assertThat(ctx.getEntries()).containsExactly(TocEntry.item(TocEntry.DEFAULT_SECTION, "Opening", null, 3));
    }

    @Test
    void joinsWrappedTitleWithPagedContinuation() {
        ParseContext ctx = parse("FICTION\nThe Long and Winding Road,\nof Memory .... 44", TocOptions.defaults());

        assertThat(ctx.getEntries()).contains(
                TocEntry.item("FICTION", "The Long and Winding Road, of Memory", null, 44));
        assertThat(ctx.getJoinedLines()).isEqualTo(1);
    }

    @Test
    void appendsSubtitleToAuthorPageTitleItem() {
        ParseContext ctx = parse("PROFILES\nJill Lepore    34    The Deadline\nHow a newspaper learned to stop",
                TocOptions.defaults());

        assertThat(ctx.getEntries()).contains(
                TocEntry.item("PROFILES", "The Deadline - How a newspaper learned to stop", "Jill Lepore", 34));
    }

    @Test
    void rejectsOutOfRangePages() {
        ParseContext ctx = parse("FICTION\nChapter .... 0", TocOptions.defaults());

        assertThat(ctx.getItemCount()).isZero();
        assertThat(ctx.getUnmatchedLines()).isEqualTo(1);
    }

    @Test
    void sectionNameIsNeverAnItemTitle() {
        ParseContext ctx = parse("FICTION\nThe Critics .... 70", TocOptions.defaults());

        assertThat(ctx.getItemCount()).isZero();
    }

    @Test
    void repeatedHeadingIsEmittedOnceAndGainsPage() {
        ParseContext ctx = parse("FICTION\nStory .... 50\nFICTION  48", TocOptions.defaults());

        assertThat(ctx.getEntries()).containsExactly(
                TocEntry.heading("FICTION", 48),
                TocEntry.item("FICTION", "Story", null, 50));
    }

    @Test
    void duplicateItemsAreDropped() {
        ParseContext ctx = parse("FICTION\nStory .... 50\nStory .... 50", TocOptions.defaults());

        assertThat(ctx.getItemCount()).isEqualTo(1);
        assertThat(ctx.getMatchedLines()).isEqualTo(2);
    }

    @Test
    void noiseLinesAreCountedAndSkipped() {
        ParseContext ctx = parse("FICTION\nIllustrations by Someone Else\nMarch 4, 2024\nStory .... 50",
                TocOptions.defaults());

        assertThat(ctx.getNoiseLines()).isEqualTo(2);
        assertThat(ctx.getItemCount()).isEqualTo(1);
    }

    @Test
    void headingTakesPageFromNextLine() {
        ParseContext ctx = parse("THE CRITICS\n72\nA Life in Letters .... 74", TocOptions.defaults());

        assertThat(ctx.getEntries()).startsWith(TocEntry.heading("THE CRITICS", 72));
    }

    @Test
    void findsIssueTitle() {
        assertThat(engine.findIssueTitle("cover\nThe Atlantic   MAY 2024\nmore"))
                .isEqualTo("The Atlantic MAY 2024");
        assertThat(engine.findIssueTitle("no title here")).isNull();
    }

    @Test
    void validPagesRangeFromOneTo999() {
        assertThat(TocLineEngine.isValidPage(0)).isFalse();
        assertThat(TocLineEngine.isValidPage(1)).isTrue();
        assertThat(TocLineEngine.isValidPage(999)).isTrue();
        assertThat(TocLineEngine.isValidPage(1000)).isFalse();
    }
}
