package com.example.magazinetoc.exception;

/**
 * The parse result handed to the renderer broke the section-before-item ordering.
 * Indicates a parser defect, not bad input.
 */
public class RenderingException extends MagazineTocException {

    public RenderingException(String message) {
        super(message);
    }

    public RenderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
