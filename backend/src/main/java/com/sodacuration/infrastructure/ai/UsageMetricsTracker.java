package com.sodacuration.infrastructure.ai;

import com.sodacuration.domain.execution.model.Usage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

@Slf4j
@Component
public class UsageMetricsTracker {

    private final AtomicLong totalCalls = new AtomicLong();
    private final AtomicLong totalPromptTokens = new AtomicLong();
    private final AtomicLong totalCompletionTokens = new AtomicLong();
    private final AtomicReference<BigDecimal> totalCost = new AtomicReference<>(BigDecimal.ZERO);

    public void recordUsage(String modelId, Usage usage) {
        long calls = totalCalls.incrementAndGet();
        totalPromptTokens.addAndGet(usage.promptTokens());
        totalCompletionTokens.addAndGet(usage.completionTokens());
        BigDecimal cost = totalCost.accumulateAndGet(usage.cost(), BigDecimal::add);

        log.info("Usage metrics - call #{} [{}]: promptTokens={}, completionTokens={}, cost=${}, " +
                        "cumulative: promptTokens={}, completionTokens={}, cost=${}",
                calls, modelId, usage.promptTokens(), usage.completionTokens(), usage.cost().toPlainString(),
                totalPromptTokens.get(), totalCompletionTokens.get(), cost.toPlainString());
    }

    public long getTotalCalls() {
        return totalCalls.get();
    }

    public long getTotalPromptTokens() {
        return totalPromptTokens.get();
    }

    public BigDecimal getTotalCost() {
        return totalCost.get();
    }
}
