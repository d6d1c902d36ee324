package com.example.magazinetoc.service;

import com.example.magazinetoc.exception.RenderingException;
import com.example.magazinetoc.model.Brand;
import com.example.magazinetoc.model.ParseDiagnostics;
import com.example.magazinetoc.model.ParseResult;
import com.example.magazinetoc.model.RenderedReport;
import com.example.magazinetoc.model.ReportFormat;
import com.example.magazinetoc.model.TocEntry;
import com.example.magazinetoc.model.TocOptions;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ReportRendererTest {

    private static final TocOptions WITH_MAIL = TocOptions.builder().includeMail(true).build();

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ReportRenderer renderer = new ReportRenderer(objectMapper);

    private static ParseResult result(String issueTitle, TocEntry... entries) {
        return new ParseResult(List.of(entries), issueTitle, ParseDiagnostics.builder(Brand.NEW_YORKER).build());
    }

    private static ParseResult sample() {
        return result("THE NEW YORKER, OCTOBER 20, 2025",
                TocEntry.heading("THE MAIL", 6),
                TocEntry.heading("PERSONAL HISTORY", 20),
                TocEntry.item("PERSONAL HISTORY", "Transitions", "James Marcus", 20),
                TocEntry.heading("FICTION", null),
                TocEntry.item("FICTION", "The Lottery", null, 34),
                TocEntry.item("FICTION", "Second Story", "Ann Lee", 50));
    }

    @Test
    void rendersOverviewThenSections() {
        RenderedReport report = renderer.render(sample(), ReportFormat.TEXT, WITH_MAIL);

        assertThat(report.getContent()).isEqualTo(String.join("\n",
                "THE NEW YORKER, OCTOBER 20, 2025",
                "",
                "THE MAIL (p. 6)",
                "PERSONAL HISTORY (p. 20)",
                "FICTION",
                "",
                "PERSONAL HISTORY",
                "• Transitions (p. 20) — James Marcus",
                "",
                "FICTION",
                "• The Lottery (p. 34)",
                "• Second Story (p. 50) — Ann Lee") + "\n");
    }

    @Test
    void renderingIsIdempotent() {
        TocOptions options = TocOptions.builder().suppressEmpty(true).build();

        String first = renderer.render(sample(), ReportFormat.TEXT, options).getContent();
        String second = renderer.render(sample(), ReportFormat.TEXT, options).getContent();

        assertThat(second).isEqualTo(first);
    }

    @Test
    void suppressEmptyOmitsSectionsWithoutItems() {
        String suppressed = renderer.render(sample(), ReportFormat.TEXT,
                WITH_MAIL.toBuilder().suppressEmpty(true).build()).getContent();
        String full = renderer.render(sample(), ReportFormat.TEXT, WITH_MAIL).getContent();

        assertThat(suppressed).doesNotContain("THE MAIL");
        assertThat(full).contains("THE MAIL");
        assertThat(suppressed.length()).isLessThanOrEqualTo(full.length());
    }

    @Test
    void excludingMailNeverGrowsTheReport() {
        String withMail = renderer.render(sample(), ReportFormat.TEXT, WITH_MAIL).getContent();
        String withoutMail = renderer.render(sample(), ReportFormat.TEXT, TocOptions.defaults()).getContent();

        assertThat(withoutMail).doesNotContain("THE MAIL");
        assertThat(withoutMail.length()).isLessThanOrEqualTo(withMail.length());
    }

    @Test
    void maxItemsLimitsBulletsPerSection() {
        String content = renderer.render(sample(), ReportFormat.TEXT,
                TocOptions.builder().maxItemsPerSection(1).build()).getContent();

        assertThat(content).contains("• The Lottery (p. 34)").doesNotContain("Second Story");
    }

    @Test
    void itemsBeforeAnyHeadingRenderUnderDefaultSection() {
        String content = renderer.render(result(null, TocEntry.item(TocEntry.DEFAULT_SECTION, "Opening", null, 3)),
                ReportFormat.TEXT, TocOptions.defaults()).getContent();

        assertThat(content).isEqualTo("CONTENTS\n• Opening (p. 3)\n");
    }

    @Test
    void emptyResultRendersEmptyReport() {
        assertThat(renderer.render(result(null), ReportFormat.TEXT, TocOptions.defaults()).getContent()).isEmpty();
    }

    @Test
    void itemBeforeItsHeadingIsRejected() {
        ParseResult broken = result(null,
                TocEntry.item("FICTION", "The Lottery", null, 34),
                TocEntry.heading("FICTION", null));

        assertThrows(RenderingException.class,
                () -> renderer.render(broken, ReportFormat.TEXT, TocOptions.defaults()));
    }

    @Test
    void structuredFormatIsFlatJsonInSourceOrder() throws Exception {
        String json = renderer.render(sample(), ReportFormat.STRUCTURED, WITH_MAIL).getContent();

        JsonNode array = objectMapper.readTree(json);
        assertThat(array.isArray()).isTrue();
        assertThat(array.size()).isEqualTo(6);
        assertThat(array.get(0).get("kind").asText()).isEqualTo("section_heading");
        assertThat(array.get(0).get("page").asInt()).isEqualTo(6);
        assertThat(array.get(0).get("title").isNull()).isTrue();
        assertThat(array.get(2).get("kind").asText()).isEqualTo("item");
        assertThat(array.get(2).get("author").asText()).isEqualTo("James Marcus");
        assertThat(array.get(3).get("page").isNull()).isTrue();
        assertThat(json).endsWith("\n");
    }
}
