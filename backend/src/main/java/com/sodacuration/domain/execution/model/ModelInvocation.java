package com.sodacuration.domain.execution.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * A single call to the model-calling service.
 */
public record ModelInvocation(
        ModelProfile model,
        List<Message> conversation,
        ResponseShape shape,
        JsonNode jsonSchema,
        SamplingParams samplingParams
) {}
