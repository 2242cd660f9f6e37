package com.sodacuration.infrastructure.ai;

import com.sodacuration.domain.execution.exception.ContextLengthException;
import com.sodacuration.domain.execution.exception.ProviderException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Tells context-window rejections apart from every other provider failure by
 * matching the provider's error message.
 */
@Component
public class ContextLengthErrorClassifier {

    private static final List<String> CONTEXT_INDICATORS = List.of(
            "context length",
            "maximum context length",
            "token limit",
            "too long",
            "context window",
            "maximum tokens",
            "input too long",
            "length limit",
            "length was reached",
            "context_length_exceeded"
    );

    public boolean isContextLengthError(String message) {
        if (message == null || message.isBlank()) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return CONTEXT_INDICATORS.stream().anyMatch(lower::contains);
    }

    /**
     * Wrap a provider failure in the matching exception, keeping the provider's message.
     */
    public ProviderException classify(String message, Throwable cause) {
        String text = message != null ? message : String.valueOf(cause);
        if (isContextLengthError(text)) {
            return new ContextLengthException(text, cause);
        }
        return new ProviderException(text, cause);
    }
}
