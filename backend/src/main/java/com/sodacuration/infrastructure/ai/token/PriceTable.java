package com.sodacuration.infrastructure.ai.token;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-model prices in USD per million input/output tokens.
 */
@Slf4j
public class PriceTable {

    public record Price(BigDecimal inputPerMillion, BigDecimal outputPerMillion) {
        public static Price of(String input, String output) {
            return new Price(new BigDecimal(input), new BigDecimal(output));
        }
    }

    private static final BigDecimal ONE_MILLION = BigDecimal.valueOf(1_000_000);

    private static final Map<String, Price> DEFAULT_PRICES = Map.of(
            "gpt-4o", Price.of("5.00", "10.00"),
            "gpt-4o-mini", Price.of("0.15", "0.60"),
            "gpt-5", Price.of("1.25", "10.00")
    );

    private final Map<String, Price> prices;
    private final Set<String> warnedModels = ConcurrentHashMap.newKeySet();

    public PriceTable(Map<String, Price> prices) {
        this.prices = Map.copyOf(prices);
    }

    public static PriceTable defaults() {
        return new PriceTable(DEFAULT_PRICES);
    }

    public BigDecimal costOf(String modelId, long promptTokens, long completionTokens) {
        Price price = modelId == null ? null : prices.get(modelId);
        if (price == null) {
            if (warnedModels.add(String.valueOf(modelId))) {
                log.warn("[PriceTable] No pricing for model {}, cost recorded as 0", modelId);
            }
            return BigDecimal.ZERO;
        }
        BigDecimal input = price.inputPerMillion().multiply(BigDecimal.valueOf(promptTokens));
        BigDecimal output = price.outputPerMillion().multiply(BigDecimal.valueOf(completionTokens));
        return input.add(output).divide(ONE_MILLION, 8, RoundingMode.HALF_UP);
    }
}
