package com.sodacuration.infrastructure.ai.validation;

import com.sodacuration.domain.verification.exception.VerificationInputEmptyException;
import com.sodacuration.domain.verification.model.VerificationResult;
import com.sodacuration.infrastructure.ai.preprocessing.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Checks that model-extracted text appears verbatim (after normalization) in its source.
 * Strict contiguous containment: a quote that keeps the start and end of a passage but
 * skips its middle is not verbatim.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VerbatimVerifier {

    static final String VERBATIM = "The extraction is verbatim";
    static final String NOT_VERBATIM = "The extraction is NOT verbatim";
    static final String EMPTY_INPUT = "One or both texts are empty";

    private final TextNormalizer textNormalizer;

    public VerificationResult verify(String extracted, String original) {
        try {
            String normalizedExtracted = normalizeRequired(extracted);
            String normalizedOriginal = normalizeRequired(original);

            boolean verbatim = normalizedOriginal.contains(normalizedExtracted);
            if (!verbatim) {
                log.info("[VerbatimVerifier] Extraction of {} normalized chars not found in source of {} chars",
                        normalizedExtracted.length(), normalizedOriginal.length());
            }
            return new VerificationResult(verbatim, verbatim ? VERBATIM : NOT_VERBATIM);
        } catch (VerificationInputEmptyException e) {
            return new VerificationResult(false, e.getMessage());
        }
    }

    // Markup-only or punctuation-only text counts as empty
    private String normalizeRequired(String text) {
        String normalized = textNormalizer.normalizeForComparison(text);
        if (normalized.isEmpty()) {
            throw new VerificationInputEmptyException(EMPTY_INPUT);
        }
        return normalized;
    }
}
