package com.example.styleverify.exception;

/**
 * Base exception for style verification errors.
 */
public class StyleVerifyException extends RuntimeException {

    public StyleVerifyException(String message) {
        super(message);
    }

    public StyleVerifyException(String message, Throwable cause) {
        super(message, cause);
    }
}
