package com.example.magazinetoc.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * What happened to one input document of a run.
 */
public class DocumentOutcome {

    public enum Status {
        OK,
        BRAND_UNRESOLVED,
        EXTRACTION_FAILED
    }

    private final Path path;
    private final Status status;
    private final ParseResult result;
    private final RenderedReport report;
    private final String message;

    private DocumentOutcome(Path path, Status status, ParseResult result, RenderedReport report, String message) {
        this.path = Objects.requireNonNull(path, "path");
        this.status = status;
        this.result = result;
        this.report = report;
        this.message = message;
    }

    public static DocumentOutcome success(Path path, ParseResult result, RenderedReport report) {
        return new DocumentOutcome(path, Status.OK, result, report, null);
    }

    public static DocumentOutcome unresolved(Path path, ParseResult result) {
        return new DocumentOutcome(path, Status.BRAND_UNRESOLVED, result, null,
                "brand could not be determined; pass --brand to choose one");
    }

    public static DocumentOutcome failed(Path path, String message) {
        return new DocumentOutcome(path, Status.EXTRACTION_FAILED, null, null, message);
    }

    public Path getPath() {
        return path;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.OK;
    }

    /** Null when extraction failed. */
    public ParseResult getResult() {
        return result;
    }

    /** Present only for successful documents. */
    public RenderedReport getReport() {
        return report;
    }

    public String getMessage() {
        return message;
    }
}
