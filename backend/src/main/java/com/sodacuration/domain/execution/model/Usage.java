package com.sodacuration.domain.execution.model;

import java.math.BigDecimal;

/**
 * Token usage and cost of one or more model calls. Usages accumulate by addition.
 */
public record Usage(long promptTokens, long completionTokens, long totalTokens, BigDecimal cost) {

    public static final Usage ZERO = new Usage(0, 0, 0, BigDecimal.ZERO);

    public Usage plus(Usage other) {
        if (other == null) {
            return this;
        }
        return new Usage(
                promptTokens + other.promptTokens,
                completionTokens + other.completionTokens,
                totalTokens + other.totalTokens,
                cost.add(other.cost));
    }
}
