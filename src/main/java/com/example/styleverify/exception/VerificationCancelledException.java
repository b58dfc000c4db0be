package com.example.styleverify.exception;

public class VerificationCancelledException extends StyleVerifyException {

    public VerificationCancelledException(String message) {
        super(message);
    }
}
