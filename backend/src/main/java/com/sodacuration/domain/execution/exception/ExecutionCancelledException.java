package com.sodacuration.domain.execution.exception;

/**
 * An execution was abandoned because its deadline elapsed or the calling thread was interrupted.
 */
public class ExecutionCancelledException extends RuntimeException {

    public ExecutionCancelledException(String message) {
        super(message);
    }

    public ExecutionCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
