package com.example.styleverify.exception;

/**
 * The document could not be turned into formatting contexts. Deterministic for a given input,
 * so the run is marked failed and never retried.
 */
public class ExtractionFailedException extends StyleVerifyException {

    public ExtractionFailedException(String message) {
        super(message);
    }

    public ExtractionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
