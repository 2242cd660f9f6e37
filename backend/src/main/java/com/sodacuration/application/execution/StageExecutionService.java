package com.sodacuration.application.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.sodacuration.domain.execution.model.CurationStage;
import com.sodacuration.domain.execution.model.ExecutionRequest;
import com.sodacuration.domain.execution.model.ExecutionResult;
import com.sodacuration.domain.execution.model.Message;
import com.sodacuration.domain.execution.model.ProcessingCost;
import com.sodacuration.domain.execution.model.ResponseShape;
import com.sodacuration.domain.execution.model.SamplingParams;
import com.sodacuration.infrastructure.ai.chunking.ChunkExecutor;
import com.sodacuration.infrastructure.ai.token.ModelProfileRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Entry point for curation stages: runs a conversation with the configured models and
 * records its usage under the stage in the manuscript's cost ledger.
 */
@Slf4j
@Service
public class StageExecutionService {

    private final ChunkExecutor chunkExecutor;
    private final ModelProfileRegistry registry;
    private final String primaryModel;
    private final String fallbackModel;
    private final boolean chunkingEnabled;
    private final Duration timeout;
    private final SamplingParams samplingParams;

    public StageExecutionService(ChunkExecutor chunkExecutor,
                                 ModelProfileRegistry registry,
                                 @Value("${execution.primary-model:gpt-4o}") String primaryModel,
                                 @Value("${execution.fallback-model:gpt-5}") String fallbackModel,
                                 @Value("${execution.chunking-enabled:true}") boolean chunkingEnabled,
                                 @Value("${execution.timeout-seconds:0}") long timeoutSeconds,
                                 @Value("${execution.sampling.temperature:#{null}}") Double temperature,
                                 @Value("${execution.sampling.top-p:#{null}}") Double topP,
                                 @Value("${execution.sampling.frequency-penalty:#{null}}") Double frequencyPenalty,
                                 @Value("${execution.sampling.presence-penalty:#{null}}") Double presencePenalty,
                                 @Value("${execution.sampling.max-tokens:#{null}}") Integer maxTokens) {
        this.chunkExecutor = chunkExecutor;
        this.registry = registry;
        this.primaryModel = primaryModel;
        this.fallbackModel = fallbackModel;
        this.chunkingEnabled = chunkingEnabled;
        this.timeout = timeoutSeconds > 0 ? Duration.ofSeconds(timeoutSeconds) : null;
        this.samplingParams = validated(
                new SamplingParams(temperature, topP, frequencyPenalty, presencePenalty, maxTokens));
    }

    private SamplingParams validated(SamplingParams params) {
        if (!registry.supportsParams(primaryModel)) {
            if (!params.isEmpty()) {
                log.warn("[StageExecutionService] Model {} does not support sampling parameters, ignoring {}",
                        primaryModel, params);
            }
            return params;
        }
        params.validateFor(registry.profile(primaryModel).provider());
        if (registry.supportsParams(fallbackModel)) {
            params.validateFor(registry.profile(fallbackModel).provider());
        }
        return params;
    }

    /**
     * Runs one stage call. Usage is added to {@code cost} only when the call succeeds.
     *
     * @param jsonSchema strict response schema, or {@code null} for plain JSON mode / raw text
     */
    public ExecutionResult execute(CurationStage stage,
                                   List<Message> conversation,
                                   ResponseShape shape,
                                   JsonNode jsonSchema,
                                   ProcessingCost cost) {
        var request = new ExecutionRequest(
                registry.profile(primaryModel),
                conversation,
                shape,
                jsonSchema,
                samplingParams,
                registry.profile(fallbackModel),
                chunkingEnabled
        );

        log.info("[StageExecutionService] Stage {} with model {} (fallback {}, {} messages)",
                stage, primaryModel, fallbackModel, conversation.size());
        ExecutionResult result = chunkExecutor.execute(request, timeout);
        if (cost != null) {
            cost.record(stage, result.usage());
        }
        return result;
    }

    public ExecutionResult execute(CurationStage stage, List<Message> conversation, ProcessingCost cost) {
        return execute(stage, conversation, ResponseShape.RAW, null, cost);
    }

    SamplingParams samplingParams() {
        return samplingParams;
    }
}
