package com.example.magazinetoc.exception;

import java.nio.file.Path;

/**
 * No extraction mode produced any text for a document. Fatal for that document only.
 */
public class ExtractionFailureException extends MagazineTocException {
    private final Path document;

    public ExtractionFailureException(Path document, String message) {
        super(message);
        this.document = document;
    }

    public ExtractionFailureException(Path document, String message, Throwable cause) {
        super(message, cause);
        this.document = document;
    }

    public Path getDocument() {
        return document;
    }
}
