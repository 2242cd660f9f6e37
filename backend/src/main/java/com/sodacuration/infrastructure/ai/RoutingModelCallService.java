package com.sodacuration.infrastructure.ai;

import com.sodacuration.domain.execution.model.ExecutionResult;
import com.sodacuration.domain.execution.model.ModelInvocation;
import com.sodacuration.domain.execution.service.ModelCallService;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

/**
 * Dispatches each invocation to the vendor adapter of its model's provider.
 */
@Primary
@Service
@RequiredArgsConstructor
public class RoutingModelCallService implements ModelCallService {

    private final OpenAiModelCallService openAiModelCallService;
    private final AnthropicModelCallService anthropicModelCallService;

    @Override
    public ExecutionResult call(ModelInvocation invocation) {
        return switch (invocation.model().provider()) {
            case ANTHROPIC -> anthropicModelCallService.call(invocation);
            case OPENAI -> openAiModelCallService.call(invocation);
        };
    }
}
