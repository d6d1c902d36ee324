package com.example.magazinetoc.cli;

import com.example.magazinetoc.exception.InvalidOptionException;
import com.example.magazinetoc.exception.MagazineTocException;
import com.example.magazinetoc.model.DocumentOutcome;
import com.example.magazinetoc.model.ParseResult;
import com.example.magazinetoc.model.ReportFormat;
import com.example.magazinetoc.model.SourceDocument;
import com.example.magazinetoc.model.TocOptions;
import com.example.magazinetoc.output.ConsoleOutputSink;
import com.example.magazinetoc.output.FileOutputSink;
import com.example.magazinetoc.output.OutputSink;
import com.example.magazinetoc.service.MagazineTocService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command-line entry: processes every input PDF in order and records the process
 * exit code. A failing document does not stop the batch.
 */
@Component
public class MagazineTocRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_DOCUMENT_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    static final String DIAGNOSTICS_LOGGER = "com.example.magazinetoc.diagnostics";

    private static final Logger logger = LoggerFactory.getLogger(MagazineTocRunner.class);
    private static final Logger diagnostics = LoggerFactory.getLogger(DIAGNOSTICS_LOGGER);

    private final MagazineTocService tocService;
    private final RunOptions defaults;
    private PrintStream stdout = System.out;
    private PrintStream stderr = System.err;
    private int exitCode = EXIT_OK;

    public MagazineTocRunner(MagazineTocService tocService,
                             @Value("${magtoc.pages:16}") int pages,
                             @Value("${magtoc.ocr-first:3}") int ocrFirst,
                             @Value("${magtoc.include-mail:false}") boolean includeMail,
                             @Value("${magtoc.include-contributors:false}") boolean includeContributors,
                             @Value("${magtoc.suppress-empty:false}") boolean suppressEmpty,
                             @Value("${magtoc.join-lines:true}") boolean joinLines,
                             @Value("${magtoc.max-items:0}") int maxItems,
                             @Value("${magtoc.format:text}") String format) {
        this.tocService = tocService;
        this.defaults = RunOptions.builder()
                .maxPages(pages)
                .ocrFirstPages(ocrFirst)
                .format(ReportFormat.fromOption(format))
                .tocOptions(TocOptions.builder()
                        .includeMail(includeMail)
                        .includeContributors(includeContributors)
                        .suppressEmpty(suppressEmpty)
                        .joinWrappedLines(joinLines)
                        .maxItemsPerSection(maxItems)
                        .build())
                .build();
    }

    @Override
    public void run(ApplicationArguments args) {
        RunOptions options;
        try {
            options = RunOptions.parse(args, defaults);
        } catch (InvalidOptionException e) {
            stderr.println("error: " + e.getMessage());
            stderr.println(RunOptions.usage());
            exitCode = EXIT_USAGE;
            return;
        }
        exitCode = execute(options);
    }

    /**
     * @return the exit code of the run
     */
    public int execute(RunOptions options) {
        if (options.isVerbose()) {
            LoggingSystem.get(getClass().getClassLoader()).setLogLevel("com.example.magazinetoc", LogLevel.INFO);
        }
        OutputSink sink = options.getOutput() != null
                ? new FileOutputSink(options.getOutput())
                : new ConsoleOutputSink(stdout);

        int failed = 0;
        int emitted = 0;
        for (Path input : options.getInputs()) {
            DocumentOutcome outcome = processOne(input, options);
            report(outcome, options.isVerbose());
            if (!outcome.isSuccess()) {
                failed++;
                continue;
            }
            try {
                String content = outcome.getReport().getContent();
                sink.write(emitted > 0 && options.getFormat() == ReportFormat.TEXT ? "\n" + content : content);
                emitted++;
            } catch (IOException e) {
                logger.error("Could not write report for {} to {}: {}", input, sink.describe(), e.getMessage());
                failed++;
            }
        }

        logger.info("{} document(s) processed, {} failed", options.getInputs().size(), failed);
        return failed > 0 ? EXIT_DOCUMENT_FAILED : EXIT_OK;
    }

    private DocumentOutcome processOne(Path input, RunOptions options) {
        if (!Files.isRegularFile(input)) {
            logger.error("Input not found: {}", input);
            return DocumentOutcome.failed(input, "input not found");
        }
        try {
            SourceDocument document = new SourceDocument(input, options.getMaxPages(), options.getOcrFirstPages());
            return tocService.process(document, options.getBrandHint(), options.getTocOptions(), options.getFormat());
        } catch (MagazineTocException e) {
            logger.error("Failed to process {}", input, e);
            return DocumentOutcome.failed(input, e.getMessage());
        }
    }

    private void report(DocumentOutcome outcome, boolean verbose) {
        String name = String.valueOf(outcome.getPath().getFileName());
        ParseResult result = outcome.getResult();
        String line = result != null
                ? "[" + name + "] status=" + outcome.getStatus() + " " + result.getDiagnostics().summary()
                : "[" + name + "] status=" + outcome.getStatus() + " " + outcome.getMessage();
        if (verbose) {
            diagnostics.info(line);
        } else {
            diagnostics.debug(line);
        }
        if (!outcome.isSuccess()) {
            stderr.println(name + ": " + outcome.getMessage());
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    void setStreams(PrintStream out, PrintStream err) {
        this.stdout = out;
        this.stderr = err;
    }
}
