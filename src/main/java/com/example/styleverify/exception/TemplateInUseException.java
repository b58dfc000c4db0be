package com.example.styleverify.exception;

/**
 * The template is referenced by stored verification results and cannot be deleted.
 */
public class TemplateInUseException extends StyleVerifyException {

    public TemplateInUseException(String message) {
        super(message);
    }
}
