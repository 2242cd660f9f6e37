package com.sodacuration.domain.execution.service;

import com.sodacuration.domain.execution.exception.ContextLengthException;
import com.sodacuration.domain.execution.exception.ProviderException;
import com.sodacuration.domain.execution.model.ExecutionResult;
import com.sodacuration.domain.execution.model.ModelInvocation;

/**
 * Capability to call a language model and get its (optionally structured) answer.
 * One implementation per vendor; the executor only depends on this interface.
 */
public interface ModelCallService {

    /**
     * Issue one model call.
     *
     * @param invocation model, conversation, response format and sampling parameters
     * @return content and usage of the call
     * @throws ContextLengthException if the provider rejects the request as too large
     * @throws ProviderException      for any other provider failure, message preserved
     */
    ExecutionResult call(ModelInvocation invocation);
}
