package com.example.magazinetoc.cli;

import com.example.magazinetoc.exception.InvalidOptionException;
import com.example.magazinetoc.model.Brand;
import com.example.magazinetoc.model.ReportFormat;
import com.example.magazinetoc.model.TocOptions;
import org.springframework.boot.ApplicationArguments;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Settings of one command-line run. Built from {@code --name=value} arguments over
 * the configured defaults.
 */
public class RunOptions {

    static final Set<String> KNOWN_OPTIONS = Set.of(
            "pages", "ocr-first", "brand", "include-mail", "include-contributors", "suppress-empty",
            "format", "output", "verbose", "max-items", "join-lines");

    private final List<Path> inputs;
    private final int maxPages;
    private final int ocrFirstPages;
    private final Brand brandHint;
    private final TocOptions tocOptions;
    private final ReportFormat format;
    private final Path output;
    private final boolean verbose;

    private RunOptions(Builder b) {
        this.inputs = Collections.unmodifiableList(new ArrayList<>(b.inputs));
        this.maxPages = b.maxPages;
        this.ocrFirstPages = b.ocrFirstPages;
        this.brandHint = b.brandHint;
        this.tocOptions = b.tocOptions;
        this.format = b.format;
        this.output = b.output;
        this.verbose = b.verbose;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Overlays the command line on {@code defaults}.
     *
     * @throws InvalidOptionException for unknown options, malformed values or a missing input
     */
    public static RunOptions parse(ApplicationArguments args, RunOptions defaults) {
        for (String name : args.getOptionNames()) {
            if (!KNOWN_OPTIONS.contains(name) && !isFrameworkOption(name)) {
                throw new InvalidOptionException("Unknown option --" + name);
            }
        }

        Builder b = defaults.toBuilder();
        b.inputs.clear();
        for (String arg : args.getNonOptionArgs()) {
            b.inputs.add(Paths.get(arg));
        }
        if (b.inputs.isEmpty()) {
            throw new InvalidOptionException("No input PDF given");
        }

        b.maxPages = intOption(args, "pages", defaults.maxPages, 1);
        b.ocrFirstPages = intOption(args, "ocr-first", defaults.ocrFirstPages, 0);

        String brand = stringOption(args, "brand");
        if (brand != null) {
            try {
                b.brandHint = Brand.fromOption(brand).orElse(null);
            } catch (IllegalArgumentException e) {
                throw new InvalidOptionException(e.getMessage(), e);
            }
        }

        String format = stringOption(args, "format");
        if (format != null) {
            try {
                b.format = ReportFormat.fromOption(format);
            } catch (IllegalArgumentException e) {
                throw new InvalidOptionException(e.getMessage(), e);
            }
        }

        String output = stringOption(args, "output");
        if (output != null) {
            b.output = output.isBlank() || "-".equals(output.trim()) ? null : Paths.get(output.trim());
        }

        TocOptions toc = defaults.tocOptions;
        b.tocOptions = toc.toBuilder()
                .includeMail(booleanOption(args, "include-mail", toc.isIncludeMail()))
                .includeContributors(booleanOption(args, "include-contributors", toc.isIncludeContributors()))
                .suppressEmpty(booleanOption(args, "suppress-empty", toc.isSuppressEmpty()))
                .joinWrappedLines(booleanOption(args, "join-lines", toc.isJoinWrappedLines()))
                .maxItemsPerSection(intOption(args, "max-items", toc.getMaxItemsPerSection(), 0))
                .build();
        b.verbose = booleanOption(args, "verbose", defaults.verbose);
        return b.build();
    }

    /** Properties Spring Boot itself reads from the command line. */
    private static boolean isFrameworkOption(String name) {
        return name.startsWith("spring.") || name.startsWith("logging.") || name.startsWith("magtoc.")
                || "debug".equals(name) || "trace".equals(name);
    }

    public static String usage() {
        return String.join("\n",
                "Usage: magazine-toc [options] <pdf>...",
                "  --pages=N                  leading pages to read (default 16)",
                "  --ocr-first=N              pages eligible for OCR when sparse (default 3)",
                "  --brand=auto|newyorker|atlantic|harpers",
                "  --include-mail[=true|false]         keep THE MAIL / LETTERS / CORRESPONDENCE (default off)",
                "  --include-contributors[=true|false] keep CONTRIBUTORS (default off)",
                "  --suppress-empty[=true|false]",
                "  --format=text|structured",
                "  --output=FILE              write the report to FILE instead of stdout",
                "  --max-items=N              items per section, 0 for all",
                "  --join-lines=true|false    join wrapped titles and page-number lines",
                "  --verbose");
    }

    private static String stringOption(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) return null;
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            throw new InvalidOptionException("Option --" + name + " needs a value");
        }
        return values.get(values.size() - 1);
    }

    private static int intOption(ApplicationArguments args, String name, int defaultValue, int min) {
        String value = stringOption(args, name);
        if (value == null) return defaultValue;
        int n;
        try {
            n = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidOptionException("Option --" + name + " expects a number, got '" + value + "'", e);
        }
        if (n < min) {
            throw new InvalidOptionException("Option --" + name + " must be at least " + min + ", got " + n);
        }
        return n;
    }

    private static boolean booleanOption(ApplicationArguments args, String name, boolean defaultValue) {
        if (!args.containsOption(name)) return defaultValue;
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) return true;
        String v = values.get(values.size() - 1).trim().toLowerCase(Locale.ROOT);
        switch (v) {
            case "true":
            case "yes":
            case "1":
                return true;
            case "false":
            case "no":
            case "0":
                return false;
            default:
                throw new InvalidOptionException("Option --" + name + " expects true or false, got '" + v + "'");
        }
    }

    public List<Path> getInputs() {
        return inputs;
    }

    public int getMaxPages() {
        return maxPages;
    }

    public int getOcrFirstPages() {
        return ocrFirstPages;
    }

    /** Null means auto-detect. */
    public Brand getBrandHint() {
        return brandHint;
    }

    public TocOptions getTocOptions() {
        return tocOptions;
    }

    public ReportFormat getFormat() {
        return format;
    }

    /** Null means stdout. */
    public Path getOutput() {
        return output;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.inputs.addAll(inputs);
        b.maxPages = maxPages;
        b.ocrFirstPages = ocrFirstPages;
        b.brandHint = brandHint;
        b.tocOptions = tocOptions;
        b.format = format;
        b.output = output;
        b.verbose = verbose;
        return b;
    }

    public static final class Builder {
        private final List<Path> inputs = new ArrayList<>();
        private int maxPages = 16;
        private int ocrFirstPages = 3;
        private Brand brandHint;
        private TocOptions tocOptions = TocOptions.defaults();
        private ReportFormat format = ReportFormat.TEXT;
        private Path output;
        private boolean verbose;

        private Builder() {
        }

        public Builder input(Path path) {
            inputs.add(path);
            return this;
        }

        public Builder maxPages(int v) {
            maxPages = v;
            return this;
        }

        public Builder ocrFirstPages(int v) {
            ocrFirstPages = v;
            return this;
        }

        public Builder brandHint(Brand v) {
            brandHint = v;
            return this;
        }

        public Builder tocOptions(TocOptions v) {
            tocOptions = v;
            return this;
        }

        public Builder format(ReportFormat v) {
            format = v;
            return this;
        }

        public Builder output(Path v) {
            output = v;
            return this;
        }

        public Builder verbose(boolean v) {
            verbose = v;
            return this;
        }

        public RunOptions build() {
            return new RunOptions(this);
        }
    }
}
