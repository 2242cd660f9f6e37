package com.sodacuration.domain.execution.exception;

public class MergeShapeMismatchException extends RuntimeException {

    public MergeShapeMismatchException(String message) {
        super(message);
    }

    public MergeShapeMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
