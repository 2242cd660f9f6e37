package com.sodacuration.domain.execution.model;

/**
 * Immutable description of a model: its input-token limit and whether it accepts
 * sampling parameters (temperature, top-p, penalties, max-tokens).
 */
public record ModelProfile(
        String id,
        int inputTokenLimit,
        boolean supportsSamplingParams,
        ModelProvider provider
) {}
