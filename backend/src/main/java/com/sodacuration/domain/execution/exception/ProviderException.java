package com.sodacuration.domain.execution.exception;

/**
 * Non-recoverable failure reported by a model provider. The message is the provider's own diagnostic text.
 */
public class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
