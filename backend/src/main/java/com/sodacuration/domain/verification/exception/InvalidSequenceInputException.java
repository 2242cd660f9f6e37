package com.sodacuration.domain.verification.exception;

public class InvalidSequenceInputException extends RuntimeException {

    public InvalidSequenceInputException(String message) {
        super(message);
    }
}
