package com.sodacuration.infrastructure.ai.chunking;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.sodacuration.domain.execution.model.ExecutionResult;
import com.sodacuration.domain.execution.model.ResponseShape;
import com.sodacuration.domain.execution.model.Usage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseMergerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ResponseMerger merger;

    @BeforeEach
    void setUp() {
        merger = new ResponseMerger(objectMapper);
    }

    private ExecutionResult result(String json, long prompt, long completion, String cost) throws Exception {
        return new ExecutionResult(objectMapper.readTree(json),
                new Usage(prompt, completion, prompt + completion, new BigDecimal(cost)));
    }

    @Nested
    @DisplayName("Assigned-files shape")
    class AssignedFiles {

        @Test
        @DisplayName("assigned and unassigned lists are concatenated in chunk order")
        void concatenates() throws Exception {
            ExecutionResult first = result("""
                    {"assigned_files": [{"panel_label": "A", "panel_sd_files": ["a.csv"]}],
                     "not_assigned_files": ["readme.txt"]}""", 100, 10, "0.001");
            ExecutionResult second = result("""
                    {"assigned_files": [{"panel_label": "B", "panel_sd_files": ["b.csv"]}],
                     "not_assigned_files": ["notes.docx"]}""", 200, 20, "0.002");

            ExecutionResult merged = merger.merge(List.of(first, second), ResponseShape.ASSIGNED_FILES);

            JsonNode content = merged.content();
            assertThat(content.get("assigned_files")).hasSize(2);
            assertThat(content.get("assigned_files").get(0).get("panel_label").asText()).isEqualTo("A");
            assertThat(content.get("assigned_files").get(1).get("panel_label").asText()).isEqualTo("B");
            assertThat(content.get("not_assigned_files").get(0).asText()).isEqualTo("readme.txt");
            assertThat(content.get("not_assigned_files").get(1).asText()).isEqualTo("notes.docx");
            assertThat(merged.usage()).isEqualTo(new Usage(300, 30, 330, new BigDecimal("0.003")));
        }

        @Test
        @DisplayName("the merged tree holds copies of the chunk entries")
        void entries_copied() throws Exception {
            ExecutionResult first = result("""
                    {"assigned_files": [{"panel_label": "A", "panel_sd_files": ["a.csv"]}]}""", 1, 0, "0");
            ExecutionResult second = result("{\"assigned_files\": []}", 1, 0, "0");

            JsonNode content = merger.merge(List.of(first, second), ResponseShape.ASSIGNED_FILES).content();
            ((ObjectNode) content.get("assigned_files").get(0)).put("panel_label", "Z");

            assertThat(content.get("assigned_files").get(0)).isNotSameAs(first.content().get("assigned_files").get(0));
            assertThat(first.content().get("assigned_files").get(0).get("panel_label").asText()).isEqualTo("A");
        }

        @Test
        @DisplayName("a missing list counts as empty")
        void missing_field() throws Exception {
            ExecutionResult first = result("{\"assigned_files\": []}", 1, 1, "0");
            ExecutionResult second = result("{\"not_assigned_files\": [\"x.txt\"], \"assigned_files\": null}", 1, 1, "0");

            JsonNode content = merger.merge(List.of(first, second), ResponseShape.ASSIGNED_FILES).content();

            assertThat(content.get("assigned_files")).isEmpty();
            assertThat(content.get("not_assigned_files")).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Generic shapes")
    class Generic {

        @Test
        @DisplayName("lists are concatenated in chunk order")
        void lists() throws Exception {
            ExecutionResult merged = merger.merge(List.of(
                    result("[1, 2]", 10, 1, "0"),
                    result("[3]", 10, 1, "0"),
                    result("[]", 10, 1, "0")), ResponseShape.GENERIC_LIST);

            assertThat(merged.content().toString()).isEqualTo("[1,2,3]");
            assertThat(merged.usage().totalTokens()).isEqualTo(33);
        }

        @Test
        @DisplayName("maps merge recursively; lists under the same key concatenate")
        void maps() throws Exception {
            ExecutionResult merged = merger.merge(List.of(
                    result("{\"figures\": {\"1\": [\"a\"]}, \"count\": 1}", 1, 0, "0"),
                    result("{\"figures\": {\"1\": [\"b\"], \"2\": [\"c\"]}, \"source\": \"zip\"}", 1, 0, "0")),
                    ResponseShape.GENERIC_MAP);

            JsonNode content = merged.content();
            assertThat(content.get("figures").get("1").toString()).isEqualTo("[\"a\",\"b\"]");
            assertThat(content.get("figures").get("2").toString()).isEqualTo("[\"c\"]");
            assertThat(content.get("count").asInt()).isEqualTo(1);
            assertThat(content.get("source").asText()).isEqualTo("zip");
        }

        @Test
        @DisplayName("conflicting scalars keep the first chunk's value")
        void conflicting_scalars() throws Exception {
            JsonNode content = merger.merge(List.of(
                    result("{\"status\": \"partial\"}", 1, 0, "0"),
                    result("{\"status\": \"complete\"}", 1, 0, "0")), ResponseShape.GENERIC_MAP).content();

            assertThat(content.get("status").asText()).isEqualTo("partial");
        }

        @Test
        @DisplayName("merging does not modify the chunk results")
        void inputs_untouched() throws Exception {
            ExecutionResult first = result("{\"files\": [\"a\"]}", 1, 0, "0");
            ExecutionResult second = result("{\"files\": [\"b\"]}", 1, 0, "0");

            merger.merge(List.of(first, second), ResponseShape.GENERIC_MAP);

            assertThat(first.content().get("files")).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Degraded merges")
    class Degraded {

        @Test
        @DisplayName("shape mismatch keeps the first content with summed usage")
        void shape_mismatch() throws Exception {
            ExecutionResult first = result("[1]", 5, 5, "0.1");
            ExecutionResult second = result("{\"not\": \"a list\"}", 7, 3, "0.2");

            ExecutionResult merged = merger.merge(List.of(first, second), ResponseShape.GENERIC_LIST);

            assertThat(merged.content()).isSameAs(first.content());
            assertThat(merged.usage()).isEqualTo(new Usage(12, 8, 20, new BigDecimal("0.3")));
        }

        @Test
        @DisplayName("raw text is not merged")
        void raw() {
            ExecutionResult first = new ExecutionResult(TextNode.valueOf("first"), new Usage(1, 1, 2, BigDecimal.ZERO));
            ExecutionResult second = new ExecutionResult(TextNode.valueOf("second"), new Usage(1, 1, 2, BigDecimal.ZERO));

            ExecutionResult merged = merger.merge(List.of(first, second), ResponseShape.RAW);

            assertThat(merged.content().asText()).isEqualTo("first");
            assertThat(merged.usage().totalTokens()).isEqualTo(4);
        }

        @Test
        @DisplayName("a single result is returned unchanged")
        void single() throws Exception {
            ExecutionResult only = result("[1]", 1, 1, "0");

            assertThat(merger.merge(List.of(only), ResponseShape.GENERIC_LIST)).isSameAs(only);
        }

        @Test
        @DisplayName("an empty result list is rejected")
        void empty() {
            assertThatThrownBy(() -> merger.merge(List.of(), ResponseShape.GENERIC_LIST))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
