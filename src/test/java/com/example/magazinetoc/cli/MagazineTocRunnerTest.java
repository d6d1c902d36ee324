package com.example.magazinetoc.cli;

import com.example.magazinetoc.exception.RenderingException;
import com.example.magazinetoc.model.Brand;
import com.example.magazinetoc.model.DocumentOutcome;
import com.example.magazinetoc.model.ParseDiagnostics;
import com.example.magazinetoc.model.ParseResult;
import com.example.magazinetoc.model.RenderedReport;
import com.example.magazinetoc.model.ReportFormat;
import com.example.magazinetoc.model.SourceDocument;
import com.example.magazinetoc.service.MagazineTocService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Exit codes and output routing of the command-line runner, with the pipeline stubbed.
 */
class MagazineTocRunnerTest {

    @TempDir
    Path tempDir;

    private MagazineTocService service;
    private MagazineTocRunner runner;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void setUp() {
        service = mock(MagazineTocService.class);
        when(service.process(any(), any(), any(), any())).thenAnswer(inv -> {
            SourceDocument doc = inv.getArgument(0);
            String name = doc.getFileName();
            if (name.startsWith("issue42")) {
                ParseResult empty = ParseResult.empty(
                        ParseDiagnostics.builder(Brand.UNKNOWN).brandUnresolved(true).build());
                return DocumentOutcome.unresolved(doc.getPath(), empty);
            }
            if (name.startsWith("broken")) {
                throw new RenderingException("item before heading");
            }
            ParseResult result = new ParseResult(List.of(), null, ParseDiagnostics.builder(Brand.NEW_YORKER).build());
            return DocumentOutcome.success(doc.getPath(), result,
                    new RenderedReport(ReportFormat.TEXT, "report of " + name + "\n"));
        });
        runner = new MagazineTocRunner(service, 16, 3, true, true, false, true, 0, "text");
        runner.setStreams(new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private Path pdf(String name) throws IOException {
        return Files.writeString(tempDir.resolve(name), "%PDF-1.4");
    }

    private int run(String... args) {
        runner.run(new DefaultApplicationArguments(args));
        return runner.getExitCode();
    }

    @Test
    void successfulRunExitsZeroAndPrintsReports() throws IOException {
        Path a = pdf("newyorker-a.pdf");
        Path b = pdf("newyorker-b.pdf");

        int code = run(a.toString(), b.toString());

        assertThat(code).isEqualTo(MagazineTocRunner.EXIT_OK);
        assertThat(out.toString(StandardCharsets.UTF_8))
                .isEqualTo("report of newyorker-a.pdf\n\nreport of newyorker-b.pdf\n");
    }

    @Test
    void unresolvedDocumentFailsRunButOthersAreStillProcessed() throws IOException {
        Path unknown = pdf("issue42.pdf");
        Path good = pdf("newyorker.pdf");

        int code = run(unknown.toString(), good.toString());

        assertThat(code).isEqualTo(MagazineTocRunner.EXIT_DOCUMENT_FAILED);
        assertThat(out.toString(StandardCharsets.UTF_8)).isEqualTo("report of newyorker.pdf\n");
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("issue42.pdf");
        verify(service, times(2)).process(any(), any(), any(), any());
    }

    @Test
    void missingInputAndPipelineErrorsCountAsFailures() throws IOException {
        Path broken = pdf("broken.pdf");

        int code = run(tempDir.resolve("absent.pdf").toString(), broken.toString());

        assertThat(code).isEqualTo(MagazineTocRunner.EXIT_DOCUMENT_FAILED);
        assertThat(out.toString(StandardCharsets.UTF_8)).isEmpty();
    }

    @Test
    void usageErrorsExitTwo() {
        assertThat(run()).isEqualTo(MagazineTocRunner.EXIT_USAGE);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Usage:");
        assertThat(run("--pages=abc", "x.pdf")).isEqualTo(MagazineTocRunner.EXIT_USAGE);
    }

    @Test
    void outputFileIsTruncatedThenAppended() throws IOException {
        Path target = tempDir.resolve("toc.txt");
        Files.writeString(target, "stale content from an earlier run\n");
        Path a = pdf("newyorker-a.pdf");
        Path b = pdf("newyorker-b.pdf");

        int code = run("--output=" + target, a.toString(), b.toString());

        assertThat(code).isZero();
        assertThat(Files.readString(target)).isEqualTo("report of newyorker-a.pdf\n\nreport of newyorker-b.pdf\n");
        assertThat(out.size()).isZero();
    }
}
