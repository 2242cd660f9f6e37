package com.sodacuration.domain.execution.exception;

/**
 * A request could not be split below the input-token limit of the last available model.
 */
public class PartitionInfeasibleException extends RuntimeException {

    public PartitionInfeasibleException(String message) {
        super(message);
    }

    public PartitionInfeasibleException(String message, Throwable cause) {
        super(message, cause);
    }
}
