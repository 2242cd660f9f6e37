package com.sodacuration.domain.execution.model;

/**
 * Declared shape of a model response. Resolved once when the request is built and used
 * both for the response format sent to the provider and for merging chunk results.
 */
public enum ResponseShape {
    /** Free text; not structurally mergeable. */
    RAW,
    /** JSON array; chunk results are concatenated. */
    GENERIC_LIST,
    /** JSON object; chunk results are unioned by key. */
    GENERIC_MAP,
    /** {@code {"assigned_files": [...], "not_assigned_files": [...]}}. */
    ASSIGNED_FILES;

    public boolean isStructured() {
        return this != RAW;
    }
}
