package com.sodacuration.infrastructure.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.sodacuration.domain.execution.exception.ContextLengthException;
import com.sodacuration.domain.execution.exception.ExecutionCancelledException;
import com.sodacuration.domain.execution.exception.ProviderException;
import com.sodacuration.domain.execution.model.ExecutionResult;
import com.sodacuration.domain.execution.model.Message;
import com.sodacuration.domain.execution.model.ModelInvocation;
import com.sodacuration.domain.execution.model.Role;
import com.sodacuration.domain.execution.model.SamplingParams;
import com.sodacuration.domain.execution.model.Usage;
import com.sodacuration.domain.execution.service.ModelCallService;
import com.sodacuration.infrastructure.ai.token.PriceTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Messages API call over plain HTTP. System messages go to the top-level {@code system} field.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnthropicModelCallService implements ModelCallService {

    private static final String API_VERSION = "2023-06-01";
    private static final int DEFAULT_MAX_TOKENS = 2048;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final PriceTable priceTable;
    private final ContextLengthErrorClassifier errorClassifier;

    @Value("${anthropic.api-key:}")
    private String apiKey;

    @Value("${anthropic.base-url:https://api.anthropic.com}")
    private String baseUrl;

    @Value("${anthropic.timeout-seconds:120}")
    private int timeoutSeconds;

    @Override
    public ExecutionResult call(ModelInvocation invocation) {
        String modelName = invocation.model().id();
        log.info("Attempting API call with model: {}", modelName);

        JsonNode response = send(buildPayload(invocation), modelName);

        long promptTokens = response.path("usage").path("input_tokens").asLong(0);
        long completionTokens = response.path("usage").path("output_tokens").asLong(0);
        log.info("Token usage [{}] - prompt: {}, completion: {}, total: {}",
                modelName, promptTokens, completionTokens, promptTokens + completionTokens);
        Usage usage = new Usage(promptTokens, completionTokens, promptTokens + completionTokens,
                priceTable.costOf(modelName, promptTokens, completionTokens));

        String text = firstText(response)
                .orElseThrow(() -> new ProviderException("Anthropic response has no text content [" + modelName + "]"));

        if (!invocation.shape().isStructured()) {
            return new ExecutionResult(TextNode.valueOf(text.trim()), usage);
        }
        try {
            return new ExecutionResult(objectMapper.readTree(stripCodeFence(text)), usage);
        } catch (JsonProcessingException e) {
            if ("max_tokens".equals(response.path("stop_reason").asText())) {
                throw new ContextLengthException(OpenAiModelCallService.LENGTH_LIMIT_MESSAGE, e);
            }
            throw new ProviderException("Anthropic returned malformed JSON [" + modelName + "]: " + e.getOriginalMessage(), e);
        }
    }

    ObjectNode buildPayload(ModelInvocation invocation) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", invocation.model().id());

        SamplingParams params = invocation.samplingParams();
        int maxTokens = params != null && params.maxTokens() != null ? params.maxTokens() : DEFAULT_MAX_TOKENS;
        payload.put("max_tokens", maxTokens);
        if (params != null) {
            if (params.temperature() != null) {
                // Messages API accepts temperature in [0, 1]
                double temperature = params.temperature();
                if (temperature > 1.0) {
                    log.warn("Temperature {} is above the Anthropic maximum, sending 1.0 [{}]",
                            temperature, invocation.model().id());
                    temperature = 1.0;
                }
                payload.put("temperature", temperature);
            }
            if (params.topP() != null) {
                payload.put("top_p", params.topP());
            }
        }

        List<String> systemParts = new ArrayList<>();
        ArrayNode messages = payload.putArray("messages");
        for (Message message : invocation.conversation()) {
            if (message.role() == Role.SYSTEM) {
                systemParts.add(message.content());
                continue;
            }
            ObjectNode msg = messages.addObject();
            msg.put("role", message.role().wireName());
            msg.put("content", message.content());
        }
        if (invocation.shape().isStructured()) {
            String instruction = invocation.jsonSchema() != null
                    ? "Respond only with a JSON document matching this JSON schema:\n" + invocation.jsonSchema()
                    : "Respond only with a JSON document.";
            systemParts.add(instruction);
        }
        if (!systemParts.isEmpty()) {
            payload.put("system", String.join("\n\n", systemParts));
        }
        return payload;
    }

    private JsonNode send(ObjectNode payload, String modelName) {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl.replaceAll("/+$", "") + "/v1/messages"))
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .header("Content-Type", "application/json")
                    .header("x-api-key", apiKey)
                    .header("anthropic-version", API_VERSION)
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload)))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                String message = errorMessage(response.body(), status);
                log.error("Anthropic API call failed [{}]: {}", modelName, message);
                throw errorClassifier.classify(message, null);
            }
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            log.error("Anthropic API call failed [{}]", modelName, e);
            throw errorClassifier.classify(e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionCancelledException("Interrupted while calling model " + modelName, e);
        }
    }

    private String errorMessage(String body, int status) {
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            String message = error.path("message").asText("");
            if (!message.isEmpty()) {
                return "Anthropic request failed (" + status + "): " + message;
            }
        } catch (JsonProcessingException ignored) {
            // non-JSON error body, reported verbatim below
        }
        return "Anthropic request failed (" + status + "): " + body;
    }

    private static Optional<String> firstText(JsonNode response) {
        JsonNode content = response.path("content");
        if (content.isArray()) {
            for (JsonNode block : content) {
                JsonNode text = block.path("text");
                if (!text.isMissingNode()) {
                    return Optional.of(text.asText());
                }
            }
        }
        return Optional.empty();
    }

    static String stripCodeFence(String text) {
        String trimmed = text.trim();
        int fence = trimmed.indexOf("```json");
        if (fence >= 0) {
            trimmed = trimmed.substring(fence + "```json".length());
        } else if (trimmed.startsWith("```")) {
            trimmed = trimmed.substring(3);
        }
        int end = trimmed.lastIndexOf("```");
        if (end >= 0) {
            trimmed = trimmed.substring(0, end);
        }
        return trimmed.trim();
    }
}
