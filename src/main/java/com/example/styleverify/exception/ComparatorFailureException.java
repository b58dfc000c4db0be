package com.example.styleverify.exception;

/**
 * A comparator failed on a well-formed pair. This is a defect, so the run is aborted instead of
 * reporting a possibly wrong mismatch list.
 */
public class ComparatorFailureException extends StyleVerifyException {

    public ComparatorFailureException(String message) {
        super(message);
    }

    public ComparatorFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
