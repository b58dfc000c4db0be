package com.example.styleverify.exception;

/**
 * The template exists but has no active version; the run never starts.
 */
public class TemplateInactiveException extends StyleVerifyException {

    public TemplateInactiveException(String message) {
        super(message);
    }
}
