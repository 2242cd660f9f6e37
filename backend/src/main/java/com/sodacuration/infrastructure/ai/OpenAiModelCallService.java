package com.sodacuration.infrastructure.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.openai.client.OpenAIClient;
import com.openai.core.JsonValue;
import com.openai.errors.OpenAIException;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.ResponseFormatJsonSchema;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionAssistantMessageParam;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.sodacuration.domain.execution.exception.ContextLengthException;
import com.sodacuration.domain.execution.exception.ProviderException;
import com.sodacuration.domain.execution.model.ExecutionResult;
import com.sodacuration.domain.execution.model.Message;
import com.sodacuration.domain.execution.model.ModelInvocation;
import com.sodacuration.domain.execution.model.SamplingParams;
import com.sodacuration.domain.execution.model.Usage;
import com.sodacuration.domain.execution.service.ModelCallService;
import com.sodacuration.infrastructure.ai.token.PriceTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Chat Completions call through the OpenAI SDK.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAiModelCallService implements ModelCallService {

    static final String LENGTH_LIMIT_MESSAGE = "Could not parse response content as the length limit was reached";

    private final OpenAIClient openAIClient;
    private final ObjectMapper objectMapper;
    private final PriceTable priceTable;
    private final ContextLengthErrorClassifier errorClassifier;

    @Override
    public ExecutionResult call(ModelInvocation invocation) {
        String modelName = invocation.model().id();
        ChatCompletion completion;
        try {
            log.info("Attempting API call with model: {}", modelName);
            completion = openAIClient.chat().completions().create(buildParams(invocation));
        } catch (OpenAIException e) {
            ProviderException classified = errorClassifier.classify(e.getMessage(), e);
            log.error("OpenAI API call failed [{}]: {}", modelName, e.getMessage());
            throw classified;
        }

        long promptTokens = 0;
        long completionTokens = 0;
        if (completion.usage().isPresent()) {
            var usage = completion.usage().get();
            promptTokens = usage.promptTokens();
            completionTokens = usage.completionTokens();
            log.info("Token usage [{}] - prompt: {}, completion: {}, total: {}",
                    modelName, promptTokens, completionTokens, usage.totalTokens());
        }
        Usage usage = new Usage(promptTokens, completionTokens, promptTokens + completionTokens,
                priceTable.costOf(modelName, promptTokens, completionTokens));

        ChatCompletion.Choice choice = completion.choices().stream()
                .findFirst()
                .orElseThrow(() -> new ProviderException("OpenAI response has no choices [" + modelName + "]"));
        String content = choice.message().content()
                .orElseThrow(() -> new ProviderException("OpenAI response has no content [" + modelName + "]"));

        if (!invocation.shape().isStructured()) {
            return new ExecutionResult(TextNode.valueOf(content.trim()), usage);
        }
        try {
            return new ExecutionResult(objectMapper.readTree(content), usage);
        } catch (JsonProcessingException e) {
            if (ChatCompletion.Choice.FinishReason.LENGTH.equals(choice.finishReason())) {
                throw new ContextLengthException(LENGTH_LIMIT_MESSAGE, e);
            }
            throw new ProviderException("OpenAI returned malformed JSON [" + modelName + "]: " + e.getOriginalMessage(), e);
        }
    }

    ChatCompletionCreateParams buildParams(ModelInvocation invocation) {
        var builder = ChatCompletionCreateParams.builder()
                .model(invocation.model().id());

        for (Message message : invocation.conversation()) {
            switch (message.role()) {
                case SYSTEM -> builder.addSystemMessage(message.content());
                case USER -> builder.addUserMessage(message.content());
                case ASSISTANT -> builder.addMessage(ChatCompletionAssistantMessageParam.builder()
                        .content(message.content())
                        .build());
            }
        }

        if (invocation.jsonSchema() != null) {
            builder.responseFormat(toResponseFormat(invocation.jsonSchema()));
        } else if (invocation.shape().isStructured()) {
            builder.responseFormat(ResponseFormatJsonObject.builder().build());
        }

        SamplingParams params = invocation.samplingParams();
        if (params != null) {
            if (params.temperature() != null) {
                builder.temperature(params.temperature());
            }
            if (params.topP() != null) {
                builder.topP(params.topP());
            }
            if (params.frequencyPenalty() != null) {
                builder.frequencyPenalty(params.frequencyPenalty());
            }
            if (params.presencePenalty() != null) {
                builder.presencePenalty(params.presencePenalty());
            }
            if (params.maxTokens() != null) {
                builder.maxCompletionTokens(params.maxTokens().longValue());
            }
        }
        return builder.build();
    }

    private ResponseFormatJsonSchema toResponseFormat(JsonNode schema) {
        Map<String, Object> schemaMap = objectMapper.convertValue(schema, new TypeReference<Map<String, Object>>() {});
        Map<String, JsonValue> properties = new LinkedHashMap<>();
        schemaMap.forEach((key, value) -> properties.put(key, JsonValue.from(value)));

        String name = schema.path("title").asText("structured_response");
        return ResponseFormatJsonSchema.builder()
                .jsonSchema(ResponseFormatJsonSchema.JsonSchema.builder()
                        .name(name.replaceAll("[^A-Za-z0-9_-]", "_"))
                        .schema(ResponseFormatJsonSchema.JsonSchema.Schema.builder()
                                .putAllAdditionalProperties(properties)
                                .build())
                        .strict(true)
                        .build())
                .build();
    }
}
