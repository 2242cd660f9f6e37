package com.sodacuration.infrastructure.ai.token;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import com.sodacuration.domain.execution.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Estimates token cost of text and conversations for a model.
 * Uses the model family's BPE encoding when known, otherwise ~4 characters per token.
 * Never throws: null or malformed input counts as 0.
 */
@Slf4j
@Component
public class TokenAccountant {

    static final int TOKENS_PER_MESSAGE = 3;
    static final int REPLY_PRIMING_TOKENS = 3;
    static final int CHARS_PER_TOKEN = 4;

    private static final List<String> O200K_PREFIXES = List.of("gpt-4o", "gpt-4.1", "gpt-5", "o1", "o3", "o4");
    private static final List<String> CL100K_PREFIXES = List.of("gpt-4", "gpt-3.5");

    private final EncodingRegistry registry = Encodings.newDefaultEncodingRegistry();
    private final Set<String> heuristicWarned = ConcurrentHashMap.newKeySet();

    public int countTokens(String text, String modelId) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        try {
            Encoding encoding = encodingFor(modelId);
            if (encoding == null) {
                return text.length() / CHARS_PER_TOKEN;
            }
            // Special-token literals such as <|endoftext|> in manuscript text count as ordinary text
            return encoding.countTokensOrdinary(text);
        } catch (RuntimeException e) {
            log.warn("[TokenAccountant] Token counting failed for model {}, counting as 0: {}", modelId, e.getMessage());
            return 0;
        }
    }

    public int countConversationTokens(List<Message> messages, String modelId) {
        if (messages == null || messages.isEmpty()) {
            return 0;
        }
        int total = 0;
        for (Message message : messages) {
            if (message == null) {
                continue;
            }
            total += TOKENS_PER_MESSAGE;
            if (message.role() != null) {
                total += countTokens(message.role().wireName(), modelId);
            }
            total += countTokens(message.content(), modelId);
        }
        return total + REPLY_PRIMING_TOKENS;
    }

    private Encoding encodingFor(String modelId) {
        EncodingType type = encodingTypeFor(modelId);
        if (type == null) {
            if (heuristicWarned.add(String.valueOf(modelId))) {
                log.warn("[TokenAccountant] No tokenizer for model {}, estimating {} chars per token (degraded accuracy)",
                        modelId, CHARS_PER_TOKEN);
            }
            return null;
        }
        return registry.getEncoding(type);
    }

    static EncodingType encodingTypeFor(String modelId) {
        if (modelId == null) {
            return null;
        }
        String id = modelId.toLowerCase(Locale.ROOT);
        if (O200K_PREFIXES.stream().anyMatch(id::startsWith)) {
            return EncodingType.O200K_BASE;
        }
        if (CL100K_PREFIXES.stream().anyMatch(id::startsWith)) {
            return EncodingType.CL100K_BASE;
        }
        return null;
    }
}
