package com.sodacuration.domain.execution.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-manuscript usage ledger: one running {@link Usage} per curation stage plus a total.
 * Not thread-safe; owned by the caller processing one manuscript.
 */
public class ProcessingCost {

    private final Map<CurationStage, Usage> stages = new EnumMap<>(CurationStage.class);
    private Usage total = Usage.ZERO;

    public void record(CurationStage stage, Usage usage) {
        stages.merge(stage, usage, Usage::plus);
        total = total.plus(usage);
    }

    public Usage stage(CurationStage stage) {
        return stages.getOrDefault(stage, Usage.ZERO);
    }

    public Usage total() {
        return total;
    }

    public Map<CurationStage, Usage> stages() {
        return Collections.unmodifiableMap(stages);
    }
}
