package com.sodacuration.infrastructure.ai;

import com.sodacuration.infrastructure.ai.token.ModelProfileRegistry;
import com.sodacuration.infrastructure.ai.token.PriceTable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Read-only model tables and the bounded pool used for chunk calls.
 */
@Configuration
public class ExecutionConfig {

    @Value("#{${execution.token-limit-overrides:{:}}}")
    private Map<String, Integer> tokenLimitOverrides;

    @Value("${execution.chunking.max-concurrency:4}")
    private int maxConcurrency;

    @Bean
    public ModelProfileRegistry modelProfileRegistry() {
        return new ModelProfileRegistry(tokenLimitOverrides);
    }

    @Bean
    public PriceTable priceTable() {
        return PriceTable.defaults();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService chunkCallExecutor() {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException(
                    String.format("Chunk concurrency must be positive, value: `%d`", maxConcurrency));
        }
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(maxConcurrency, runnable -> {
            Thread thread = new Thread(runnable, "chunk-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
