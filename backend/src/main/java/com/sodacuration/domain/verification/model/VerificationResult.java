package com.sodacuration.domain.verification.model;

/**
 * Outcome of a verbatim-extraction check.
 *
 * @param verbatim true if the normalized extraction is a contiguous substring of the normalized source
 * @param detail   human-readable explanation
 */
public record VerificationResult(boolean verbatim, String detail) {}
