package com.sodacuration.infrastructure.ai.token;

import com.sodacuration.domain.execution.model.ModelProfile;
import com.sodacuration.domain.execution.model.ModelProvider;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Read-only table of model input-token limits. Built once from the static defaults plus
 * configured overrides; safe for unsynchronized concurrent reads.
 */
@Slf4j
public class ModelProfileRegistry {

    public static final int DEFAULT_TOKEN_LIMIT = 120_000;

    /** Model class that rejects temperature, top-p, penalties and max-tokens. */
    public static final String PARAMETERLESS_MODEL = "gpt-5";

    private static final Map<String, Integer> DEFAULT_LIMITS = Map.of(
            "gpt-4o", 120_000,
            "gpt-4o-mini", 120_000,
            "gpt-5", 250_000,
            "claude-3-5-sonnet", 200_000,
            "claude-3-7-sonnet", 200_000,
            "claude-sonnet-4", 200_000
    );

    // Dated snapshots ("claude-3-5-sonnet-20241022") resolve to their family entry
    private static final Set<String> PREFIX_FAMILIES = Set.of(
            "claude-3-5-sonnet", "claude-3-7-sonnet", "claude-sonnet-4"
    );

    private final Map<String, Integer> limits;

    public ModelProfileRegistry(Map<String, Integer> overrides) {
        Map<String, Integer> merged = new LinkedHashMap<>(DEFAULT_LIMITS);
        if (overrides != null) {
            overrides.forEach((model, limit) -> {
                if (limit == null || limit <= 0) {
                    throw new IllegalArgumentException(
                            String.format("Token limit override for `%s` must be positive, value: `%s`", model, limit));
                }
                merged.put(model, limit);
            });
            if (!overrides.isEmpty()) {
                log.info("[ModelProfileRegistry] Applied token limit overrides: {}", overrides);
            }
        }
        this.limits = Map.copyOf(merged);
    }

    public static ModelProfileRegistry defaults() {
        return new ModelProfileRegistry(Map.of());
    }

    public int limitFor(String modelId) {
        if (modelId == null) {
            return DEFAULT_TOKEN_LIMIT;
        }
        Integer exact = limits.get(modelId);
        if (exact != null) {
            return exact;
        }
        for (String family : PREFIX_FAMILIES) {
            if (modelId.startsWith(family) && limits.containsKey(family)) {
                return limits.get(family);
            }
        }
        return DEFAULT_TOKEN_LIMIT;
    }

    public boolean supportsParams(String modelId) {
        return !PARAMETERLESS_MODEL.equals(modelId);
    }

    public ModelProfile profile(String modelId) {
        return new ModelProfile(modelId, limitFor(modelId), supportsParams(modelId), providerOf(modelId));
    }

    static ModelProvider providerOf(String modelId) {
        if (modelId != null && modelId.toLowerCase(Locale.ROOT).startsWith("claude")) {
            return ModelProvider.ANTHROPIC;
        }
        return ModelProvider.OPENAI;
    }
}
