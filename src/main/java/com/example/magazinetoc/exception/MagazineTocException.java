package com.example.magazinetoc.exception;

/**
 * Base type for the extractor's own failures.
 */
public abstract class MagazineTocException extends RuntimeException {

    protected MagazineTocException(String message) {
        super(message);
    }

    protected MagazineTocException(String message, Throwable cause) {
        super(message, cause);
    }
}
