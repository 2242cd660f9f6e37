package com.sodacuration.infrastructure.ai.chunking;

import com.sodacuration.domain.execution.exception.ContextLengthException;
import com.sodacuration.domain.execution.exception.ExecutionCancelledException;
import com.sodacuration.domain.execution.exception.PartitionInfeasibleException;
import com.sodacuration.domain.execution.exception.ProviderException;
import com.sodacuration.domain.execution.model.ExecutionRequest;
import com.sodacuration.domain.execution.model.ExecutionResult;
import com.sodacuration.domain.execution.model.ExecutionState;
import com.sodacuration.domain.execution.model.Message;
import com.sodacuration.domain.execution.model.ModelInvocation;
import com.sodacuration.domain.execution.model.ModelProfile;
import com.sodacuration.domain.execution.model.SamplingParams;
import com.sodacuration.domain.execution.service.ModelCallService;
import com.sodacuration.infrastructure.ai.UsageMetricsTracker;
import com.sodacuration.infrastructure.ai.token.TokenAccountant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Executes a request within the provider's token limits.
 *
 * Escalation ladder (each state entered at most once):
 *   DIRECT → (context error) FALLBACK → (still too large) CHUNKED_FALLBACK
 *   over the primary limit up front → CHUNKED_PRIMARY → (context error) FALLBACK
 *   no distinct fallback: a DIRECT context error propagates, an oversized request starts in CHUNKED_FALLBACK
 *
 * Chunk calls run on a bounded pool, fail fast, and are reassembled in chunk order.
 */
@Slf4j
@Component
public class ChunkExecutor {

    private final ModelCallService modelCallService;
    private final TokenAccountant tokenAccountant;
    private final RequestPartitioner partitioner;
    private final ResponseMerger merger;
    private final UsageMetricsTracker usageMetrics;
    private final Executor chunkCallExecutor;

    public ChunkExecutor(ModelCallService modelCallService,
                         TokenAccountant tokenAccountant,
                         RequestPartitioner partitioner,
                         ResponseMerger merger,
                         UsageMetricsTracker usageMetrics,
                         @Qualifier("chunkCallExecutor") Executor chunkCallExecutor) {
        this.modelCallService = modelCallService;
        this.tokenAccountant = tokenAccountant;
        this.partitioner = partitioner;
        this.merger = merger;
        this.usageMetrics = usageMetrics;
        this.chunkCallExecutor = chunkCallExecutor;
    }

    private record IndexedResult(int index, ExecutionResult result) {}

    private record Deadline(long nanos) {
        static final Deadline NONE = new Deadline(-1);

        static Deadline after(Duration timeout) {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                return NONE;
            }
            return new Deadline(System.nanoTime() + timeout.toNanos());
        }

        boolean isSet() {
            return this != NONE;
        }

        long remainingNanos() {
            return nanos - System.nanoTime();
        }
    }

    public ExecutionResult execute(ExecutionRequest request) {
        return execute(request, null);
    }

    /**
     * @param timeout overall deadline for every call this execution issues (null or zero: none)
     * @throws ContextLengthException       if no rung of the ladder could accommodate the request
     * @throws PartitionInfeasibleException if the fixed content alone overflows the last model
     * @throws ProviderException            for any non-recoverable provider failure
     * @throws ExecutionCancelledException  if the deadline elapses or the caller is interrupted
     */
    public ExecutionResult execute(ExecutionRequest request, Duration timeout) {
        long start = System.currentTimeMillis();
        try {
            ExecutionResult result = runLadder(request, Deadline.after(timeout));
            log.info("[ChunkExecutor] {} (model {}): {} tokens, {}ms", ExecutionState.SUCCEEDED,
                    request.model().id(), result.usage().totalTokens(), System.currentTimeMillis() - start);
            return result;
        } catch (RuntimeException e) {
            log.error("[ChunkExecutor] {} (model {}): {}", ExecutionState.FAILED, request.model().id(), e.getMessage());
            throw e;
        }
    }

    private ExecutionResult runLadder(ExecutionRequest request, Deadline deadline) {
        ModelProfile primary = request.model();
        ModelProfile fallback = request.fallbackModel() != null ? request.fallbackModel() : primary;
        boolean canSwap = !fallback.id().equals(primary.id());
        List<Message> conversation = request.conversation();

        ExecutionState state = ExecutionState.DIRECT;
        ContextLengthException rejectedWhole = null;
        int tokens = tokenAccountant.countConversationTokens(conversation, primary.id());
        if (request.chunkingEnabled() && tokens > primary.inputTokenLimit()) {
            state = canSwap ? ExecutionState.CHUNKED_PRIMARY : ExecutionState.CHUNKED_FALLBACK;
            log.info("[ChunkExecutor] Request is ~{} tokens, over the {}-token limit of {}",
                    tokens, primary.inputTokenLimit(), primary.id());
        }

        while (true) {
            log.info("[ChunkExecutor] State {}", state);
            switch (state) {
                case DIRECT -> {
                    try {
                        return invoke(primary, conversation, request, deadline);
                    } catch (ContextLengthException e) {
                        log.warn("[ChunkExecutor] Context length error with model {}: {}", primary.id(), e.getMessage());
                        if (!canSwap) {
                            // Estimate is within the limit (else chunked up front): splitting cannot help
                            throw e;
                        }
                        state = ExecutionState.FALLBACK;
                    }
                }
                case FALLBACK -> {
                    try {
                        return invoke(fallback, conversation, request, deadline);
                    } catch (ContextLengthException e) {
                        int fallbackTokens = tokenAccountant.countConversationTokens(conversation, fallback.id());
                        if (request.chunkingEnabled() && fallbackTokens > fallback.inputTokenLimit()) {
                            log.warn("[ChunkExecutor] Fallback model {} also overflowed (~{} of {} tokens)",
                                    fallback.id(), fallbackTokens, fallback.inputTokenLimit());
                            rejectedWhole = e;
                            state = ExecutionState.CHUNKED_FALLBACK;
                        } else {
                            log.error("[ChunkExecutor] Fallback model {} also failed: {}", fallback.id(), e.getMessage());
                            throw e;
                        }
                    }
                }
                case CHUNKED_PRIMARY -> {
                    try {
                        return executeChunked(primary, request, ExecutionState.CHUNKED_PRIMARY, null, deadline);
                    } catch (ContextLengthException e) {
                        log.warn("[ChunkExecutor] Chunked call overflowed model {}, escalating to {}: {}",
                                primary.id(), fallback.id(), e.getMessage());
                        state = ExecutionState.FALLBACK;
                    }
                }
                case CHUNKED_FALLBACK -> {
                    return executeChunked(fallback, request, ExecutionState.CHUNKED_FALLBACK, rejectedWhole, deadline);
                }
                default -> throw new IllegalStateException("Unexpected execution state " + state);
            }
        }
    }

    /**
     * @param rejectedWhole the context error {@code model} already returned for the whole
     *                      conversation, or null if it has not been sent to {@code model} yet
     */
    private ExecutionResult executeChunked(ModelProfile model, ExecutionRequest request, ExecutionState state,
                                           ContextLengthException rejectedWhole, Deadline deadline) {
        List<List<Message>> chunks = partitioner.partition(request.conversation(), model.id(), model.inputTokenLimit());

        if (chunks.size() == 1 && rejectedWhole != null) {
            // The single chunk is the payload the model just rejected
            throw new PartitionInfeasibleException(String.format(
                    "Request cannot be split below the %d-token limit of %s: %s",
                    model.inputTokenLimit(), model.id(), rejectedWhole.getMessage()), rejectedWhole);
        }
        if (chunks.size() == 1) {
            log.info("[ChunkExecutor] {} produced a single chunk for {}, issuing one direct call", state, model.id());
            try {
                return invoke(model, chunks.get(0), request, deadline);
            } catch (ContextLengthException e) {
                if (state == ExecutionState.CHUNKED_FALLBACK) {
                    throw new PartitionInfeasibleException(String.format(
                            "Request cannot be split below the %d-token limit of %s: %s",
                            model.inputTokenLimit(), model.id(), e.getMessage()), e);
                }
                throw e;
            }
        }

        log.info("[ChunkExecutor] {} with model {}: {} chunks", state, model.id(), chunks.size());
        List<ExecutionResult> results = runBatch(model, chunks, request, deadline);
        return merger.merge(results, request.shape());
    }

    /**
     * Runs every chunk call and returns the results in chunk order. The first failure
     * cancels in-flight calls, skips calls not yet started and is rethrown unchanged.
     */
    private List<ExecutionResult> runBatch(ModelProfile model, List<List<Message>> chunks,
                                           ExecutionRequest request, Deadline deadline) {
        int total = chunks.size();
        AtomicReference<RuntimeException> firstFailure = new AtomicReference<>();
        ExecutorCompletionService<IndexedResult> completion = new ExecutorCompletionService<>(chunkCallExecutor);
        List<Future<IndexedResult>> futures = new ArrayList<>(total);

        for (int i = 0; i < total; i++) {
            int index = i;
            List<Message> chunk = chunks.get(i);
            futures.add(completion.submit(() -> {
                if (firstFailure.get() != null) {
                    throw new ExecutionCancelledException(
                            String.format("Chunk %d of %d skipped after an earlier chunk failed", index + 1, total));
                }
                try {
                    return new IndexedResult(index, invoke(model, chunk, request, deadline));
                } catch (RuntimeException e) {
                    firstFailure.compareAndSet(null, e);
                    throw e;
                }
            }));
        }

        ExecutionResult[] ordered = new ExecutionResult[total];
        try {
            for (int done = 0; done < total; done++) {
                Future<IndexedResult> next = deadline.isSet()
                        ? completion.poll(Math.max(0, deadline.remainingNanos()), TimeUnit.NANOSECONDS)
                        : completion.take();
                if (next == null) {
                    throw new ExecutionCancelledException(String.format(
                            "Deadline exceeded with %d of %d chunk calls completed", done, total));
                }
                IndexedResult indexed = next.get();
                ordered[indexed.index()] = indexed.result();
            }
        } catch (ExecutionException e) {
            RuntimeException failure = firstFailure.get();
            if (failure == null) {
                failure = e.getCause() instanceof RuntimeException re
                        ? re
                        : new ProviderException(e.getCause().getMessage(), e.getCause());
            }
            log.error("[ChunkExecutor] Chunk call failed, aborting the batch of {}: {}", total, failure.getMessage());
            throw failure;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionCancelledException("Interrupted while waiting for chunk calls", e);
        } finally {
            futures.forEach(future -> future.cancel(true));
        }
        return Arrays.asList(ordered);
    }

    private ExecutionResult invoke(ModelProfile model, List<Message> conversation,
                                   ExecutionRequest request, Deadline deadline) {
        if (deadline.isSet() && deadline.remainingNanos() <= 0) {
            throw new ExecutionCancelledException("Deadline exceeded before calling model " + model.id());
        }
        ModelInvocation invocation = new ModelInvocation(
                model, conversation, request.shape(), request.jsonSchema(),
                paramsFor(model, request.samplingParams()));
        ExecutionResult result = modelCallService.call(invocation);
        usageMetrics.recordUsage(model.id(), result.usage());
        return result;
    }

    private SamplingParams paramsFor(ModelProfile model, SamplingParams params) {
        if (params == null || params.isEmpty()) {
            return null;
        }
        if (!model.supportsSamplingParams()) {
            log.info("[ChunkExecutor] Model {} does not support sampling parameters, using basic configuration", model.id());
            return null;
        }
        return params;
    }
}
