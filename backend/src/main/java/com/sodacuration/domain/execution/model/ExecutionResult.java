package com.sodacuration.domain.execution.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of a model call, or of a merged multi-chunk execution.
 *
 * @param content shape-dependent content; a text node for {@link ResponseShape#RAW}
 * @param usage   token usage and cost, summed over every call that produced the content
 */
public record ExecutionResult(JsonNode content, Usage usage) {}
