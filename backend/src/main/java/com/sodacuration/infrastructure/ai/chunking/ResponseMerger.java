package com.sodacuration.infrastructure.ai.chunking;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sodacuration.domain.execution.exception.MergeShapeMismatchException;
import com.sodacuration.domain.execution.model.ExecutionResult;
import com.sodacuration.domain.execution.model.ResponseShape;
import com.sodacuration.domain.execution.model.Usage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Combines partial chunk results into one logical result. Content is merged in chunk order
 * according to the declared shape; usage is always summed, even when the merge degrades.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResponseMerger {

    public static final String ASSIGNED_FILES = "assigned_files";
    public static final String NOT_ASSIGNED_FILES = "not_assigned_files";

    private final ObjectMapper objectMapper;

    public ExecutionResult merge(List<ExecutionResult> results, ResponseShape shape) {
        if (results == null || results.isEmpty()) {
            throw new IllegalArgumentException("Cannot merge an empty list of results");
        }
        if (results.size() == 1) {
            return results.get(0);
        }

        Usage usage = Usage.ZERO;
        for (ExecutionResult result : results) {
            usage = usage.plus(result.usage());
        }

        try {
            JsonNode content = switch (shape) {
                case ASSIGNED_FILES -> mergeAssignedFiles(results);
                case GENERIC_LIST -> mergeLists(results);
                case GENERIC_MAP -> mergeMaps(results);
                case RAW -> throw new MergeShapeMismatchException("Raw text responses have no mergeable structure");
            };
            log.info("[ResponseMerger] Merged {} {} results, total tokens {}", results.size(), shape, usage.totalTokens());
            return new ExecutionResult(content, usage);
        } catch (MergeShapeMismatchException e) {
            log.warn("[ResponseMerger] {}; keeping the first of {} results (usage still summed)",
                    e.getMessage(), results.size());
            return new ExecutionResult(results.get(0).content(), usage);
        }
    }

    private JsonNode mergeAssignedFiles(List<ExecutionResult> results) {
        ArrayNode assigned = objectMapper.createArrayNode();
        ArrayNode notAssigned = objectMapper.createArrayNode();
        for (int i = 0; i < results.size(); i++) {
            JsonNode content = results.get(i).content();
            if (content == null || !content.isObject()) {
                throw new MergeShapeMismatchException("Chunk " + (i + 1) + " is not an assigned-files object");
            }
            assigned.addAll(arrayField(content, ASSIGNED_FILES, i).deepCopy());
            notAssigned.addAll(arrayField(content, NOT_ASSIGNED_FILES, i).deepCopy());
        }
        ObjectNode merged = objectMapper.createObjectNode();
        merged.set(ASSIGNED_FILES, assigned);
        merged.set(NOT_ASSIGNED_FILES, notAssigned);
        return merged;
    }

    private ArrayNode arrayField(JsonNode content, String field, int chunkIndex) {
        JsonNode value = content.get(field);
        if (value == null || value.isNull()) {
            return objectMapper.createArrayNode();
        }
        if (!value.isArray()) {
            throw new MergeShapeMismatchException(
                    "Chunk " + (chunkIndex + 1) + " has a non-list '" + field + "' field");
        }
        return (ArrayNode) value;
    }

    private JsonNode mergeLists(List<ExecutionResult> results) {
        ArrayNode merged = objectMapper.createArrayNode();
        for (int i = 0; i < results.size(); i++) {
            JsonNode content = results.get(i).content();
            if (content == null || !content.isArray()) {
                throw new MergeShapeMismatchException("Chunk " + (i + 1) + " is not a list");
            }
            merged.addAll(((ArrayNode) content).deepCopy());
        }
        return merged;
    }

    private JsonNode mergeMaps(List<ExecutionResult> results) {
        ObjectNode merged = objectMapper.createObjectNode();
        for (int i = 0; i < results.size(); i++) {
            JsonNode content = results.get(i).content();
            if (content == null || !content.isObject()) {
                throw new MergeShapeMismatchException("Chunk " + (i + 1) + " is not a mapping");
            }
            mergeInto(merged, (ObjectNode) content, "");
        }
        return merged;
    }

    private void mergeInto(ObjectNode target, ObjectNode source, String path) {
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode incoming = field.getValue();
            JsonNode existing = target.get(key);

            if (existing == null) {
                target.set(key, incoming.deepCopy());
            } else if (existing.isArray() && incoming.isArray()) {
                ((ArrayNode) existing).addAll(((ArrayNode) incoming).deepCopy());
            } else if (existing.isObject() && incoming.isObject()) {
                mergeInto((ObjectNode) existing, (ObjectNode) incoming, path + key + ".");
            } else if (!existing.equals(incoming)) {
                log.warn("[ResponseMerger] Lossy merge: key '{}{}' differs across chunks, keeping the first chunk's value",
                        path, key);
            }
        }
    }
}
