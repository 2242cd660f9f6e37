package com.sodacuration.domain.execution.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * A conversation to execute within the token limits of a primary model, with a fallback
 * model for context-length escalation.
 *
 * @param model           primary model
 * @param conversation    ordered messages; the last user message may carry a file list
 * @param shape           response shape used for the response format and for merging
 * @param jsonSchema      strict JSON schema for the response (nullable)
 * @param samplingParams  sampling parameters (nullable)
 * @param fallbackModel   model used after a context-length error (nullable)
 * @param chunkingEnabled whether oversized requests may be partitioned
 */
public record ExecutionRequest(
        ModelProfile model,
        List<Message> conversation,
        ResponseShape shape,
        JsonNode jsonSchema,
        SamplingParams samplingParams,
        ModelProfile fallbackModel,
        boolean chunkingEnabled
) {
    public ExecutionRequest {
        conversation = List.copyOf(conversation);
    }
}
