package com.sodacuration.domain.execution.exception;

/**
 * The provider rejected a request because it exceeds the model's context window.
 */
public class ContextLengthException extends ProviderException {

    public ContextLengthException(String message) {
        super(message);
    }

    public ContextLengthException(String message, Throwable cause) {
        super(message, cause);
    }
}
