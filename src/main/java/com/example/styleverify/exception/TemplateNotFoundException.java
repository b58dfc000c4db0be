package com.example.styleverify.exception;

public class TemplateNotFoundException extends StyleVerifyException {

    public TemplateNotFoundException(String message) {
        super(message);
    }
}
