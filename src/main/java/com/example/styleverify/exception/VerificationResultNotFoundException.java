package com.example.styleverify.exception;

public class VerificationResultNotFoundException extends StyleVerifyException {

    public VerificationResultNotFoundException(String message) {
        super(message);
    }
}
