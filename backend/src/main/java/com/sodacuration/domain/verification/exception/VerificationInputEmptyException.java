package com.sodacuration.domain.verification.exception;

public class VerificationInputEmptyException extends RuntimeException {

    public VerificationInputEmptyException(String message) {
        super(message);
    }
}
