package com.example.magazinetoc.exception;

/**
 * A command-line option had a value that cannot be used.
 */
public class InvalidOptionException extends MagazineTocException {

    public InvalidOptionException(String message) {
        super(message);
    }

    public InvalidOptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
