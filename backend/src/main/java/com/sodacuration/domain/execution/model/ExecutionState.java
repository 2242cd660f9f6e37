package com.sodacuration.domain.execution.model;

/**
 * States of the bounded escalation ladder: model swap before payload swap.
 */
public enum ExecutionState {
    DIRECT,
    FALLBACK,
    CHUNKED_PRIMARY,
    CHUNKED_FALLBACK,
    FAILED,
    SUCCEEDED
}
