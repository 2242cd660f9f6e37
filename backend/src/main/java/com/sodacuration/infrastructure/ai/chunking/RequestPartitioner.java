package com.sodacuration.infrastructure.ai.chunking;

import com.sodacuration.domain.execution.model.Message;
import com.sodacuration.domain.execution.model.Role;
import com.sodacuration.infrastructure.ai.token.TokenAccountant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits an oversized conversation into token-bounded conversations.
 *
 * The variable-length part is the file list embedded in the last user message. Everything
 * before it (all other messages and the start of the user message) is fixed and replicated
 * into every chunk. Chunks partition the list lines exhaustively, without overlap, in order.
 */
@Slf4j
@Component
public class RequestPartitioner {

    // Labeled marker line, e.g. "File list:" (last occurrence wins)
    private static final Pattern LIST_MARKER = Pattern.compile(
            "(?im)^[ \\t]*(?:file list|files|file paths|source data files)[ \\t]*:[ \\t]*\\r?\\n"
    );

    private static final Pattern BLOCK_SEPARATOR = Pattern.compile("\\n[ \\t]*\\n");

    private final TokenAccountant tokenAccountant;
    private final int safetyMarginTokens;

    public RequestPartitioner(TokenAccountant tokenAccountant,
                              @Value("${execution.chunking.safety-margin-tokens:500}") int safetyMarginTokens) {
        this.tokenAccountant = tokenAccountant;
        this.safetyMarginTokens = safetyMarginTokens;
    }

    /**
     * Position of the variable-length list inside the last user message.
     *
     * @param messageIndex index of the last user message in the conversation
     * @param prefix       fixed text of that message, replicated into every chunk
     * @param lines        non-blank list lines, in order
     */
    record SplitPoint(int messageIndex, String prefix, List<String> lines) {}

    /**
     * Partition the conversation so that each chunk fits {@code tokenLimit} for {@code modelId}.
     *
     * @return the original conversation as a single element when nothing needs (or can be) split,
     *         otherwise one conversation per chunk, in list order
     */
    public List<List<Message>> partition(List<Message> conversation, String modelId, int tokenLimit) {
        SplitPoint split = locate(conversation);
        if (split == null || split.lines().isEmpty()) {
            log.info("[Partitioner] No variable-length list found, request left whole");
            return List.of(conversation);
        }

        List<Message> fixedOnly = replaceContent(conversation, split.messageIndex(), split.prefix());
        // Chunk count never exceeds the line count, so this suffix is the longest one sent
        int lineCount = split.lines().size();
        int fixedTokens = tokenAccountant.countConversationTokens(fixedOnly, modelId)
                + tokenAccountant.countTokens(chunkSuffix(lineCount, lineCount), modelId);
        int budget = tokenLimit - fixedTokens - safetyMarginTokens;
        if (budget <= 0) {
            log.warn("[Partitioner] Fixed content ({} tokens with the chunk note) leaves no room under the {}-token limit of {}, cannot partition",
                    fixedTokens, tokenLimit, modelId);
            return List.of(conversation);
        }

        List<List<String>> chunks = packLines(split.lines(), modelId, budget);
        if (chunks.size() <= 1) {
            return List.of(conversation);
        }

        int total = chunks.size();
        List<List<Message>> result = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            String content = split.prefix() + String.join("\n", chunks.get(i))
                    + chunkSuffix(i + 1, total);
            result.add(replaceContent(conversation, split.messageIndex(), content));
        }
        log.info("[Partitioner] Split {} list lines into {} chunks (budget {} tokens/chunk, fixed {} tokens, model {})",
                split.lines().size(), total, budget, fixedTokens, modelId);
        return result;
    }

    /**
     * Greedy packing: a line goes into the current chunk unless it would push it past the budget.
     * A line that alone exceeds the budget becomes its own chunk.
     */
    List<List<String>> packLines(List<String> lines, String modelId, int budget) {
        List<List<String>> chunks = new ArrayList<>();
        List<String> current = new ArrayList<>();
        int currentTokens = 0;

        for (String line : lines) {
            int lineTokens = tokenAccountant.countTokens(line + "\n", modelId);

            if (lineTokens > budget) {
                log.warn("[Partitioner] List line of {} tokens exceeds the {}-token chunk budget, sending it as its own chunk",
                        lineTokens, budget);
                if (!current.isEmpty()) {
                    chunks.add(current);
                    current = new ArrayList<>();
                    currentTokens = 0;
                }
                chunks.add(List.of(line));
                continue;
            }

            if (!current.isEmpty() && currentTokens + lineTokens > budget) {
                chunks.add(current);
                current = new ArrayList<>();
                currentTokens = 0;
            }
            current.add(line);
            currentTokens += lineTokens;
        }
        if (!current.isEmpty()) {
            chunks.add(current);
        }
        return chunks;
    }

    /**
     * Find the list in the last user message: after a labeled marker, else the last
     * blank-line-separated block, else every line after the first.
     */
    SplitPoint locate(List<Message> conversation) {
        int index = lastUserMessage(conversation);
        if (index < 0) {
            return null;
        }
        String content = conversation.get(index).content();
        if (content == null || content.isBlank()) {
            return null;
        }

        Matcher marker = LIST_MARKER.matcher(content);
        int markerEnd = -1;
        while (marker.find()) {
            markerEnd = marker.end();
        }
        if (markerEnd >= 0) {
            return new SplitPoint(index, content.substring(0, markerEnd), listLines(content.substring(markerEnd)));
        }

        Matcher separator = BLOCK_SEPARATOR.matcher(content);
        int blockStart = -1;
        while (separator.find()) {
            blockStart = separator.end();
        }
        if (blockStart >= 0) {
            List<String> blockLines = listLines(content.substring(blockStart));
            if (blockLines.size() > 1) {
                return new SplitPoint(index, content.substring(0, blockStart), blockLines);
            }
        }

        int firstNewline = content.indexOf('\n');
        if (firstNewline < 0) {
            return null;
        }
        return new SplitPoint(index, content.substring(0, firstNewline + 1), listLines(content.substring(firstNewline + 1)));
    }

    static String chunkSuffix(int index, int total) {
        return String.format("\n\n[Chunk %d of %d: the list above is partial; the remaining entries are sent separately.]",
                index, total);
    }

    private static List<String> listLines(String text) {
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\\r?\\n")) {
            if (!line.isBlank()) {
                lines.add(line);
            }
        }
        return lines;
    }

    private static int lastUserMessage(List<Message> conversation) {
        for (int i = conversation.size() - 1; i >= 0; i--) {
            if (conversation.get(i).role() == Role.USER) {
                return i;
            }
        }
        return -1;
    }

    private static List<Message> replaceContent(List<Message> conversation, int index, String content) {
        List<Message> copy = new ArrayList<>(conversation);
        copy.set(index, conversation.get(index).withContent(content));
        return List.copyOf(copy);
    }
}
