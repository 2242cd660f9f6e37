package com.sodacuration.domain.verification.model;

import java.util.List;

/**
 * Outcome of a label-sequence check.
 *
 * @param valid         true if the labels form a gap-free run
 * @param fixedSequence the contiguous run between the observed minimum and maximum label
 * @param detail        human-readable explanation
 */
public record SequenceResult(boolean valid, List<String> fixedSequence, String detail) {}
