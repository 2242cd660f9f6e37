package com.sodacuration.infrastructure.ai.chunking;

import com.sodacuration.domain.execution.model.Message;
import com.sodacuration.infrastructure.ai.token.TokenAccountant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class RequestPartitionerTest {

    // No tokenizer for this id: 4 characters per token keeps the arithmetic predictable
    private static final String MODEL = "test-model";
    private static final String SYSTEM_PROMPT = "You assign source data files to figure panels.";
    private static final String PREFIX = "Assign each file to a panel.\nFile list:\n";

    private TokenAccountant accountant;
    private RequestPartitioner partitioner;

    @BeforeEach
    void setUp() {
        accountant = new TokenAccountant();
        partitioner = new RequestPartitioner(accountant, 0);
    }

    // "file_001.txt\n" is 13 characters, 3 tokens
    private static List<String> files(int count) {
        return IntStream.rangeClosed(1, count)
                .mapToObj(i -> String.format("file_%03d.txt", i))
                .collect(Collectors.toList());
    }

    private static List<Message> conversation(String userContent) {
        return List.of(Message.system(SYSTEM_PROMPT), Message.user(userContent));
    }

    private int fixedTokens() {
        return accountant.countConversationTokens(conversation(PREFIX), MODEL);
    }

    // Fixed content plus the chunk note sent with a list of lineCount lines
    private int chunkOverhead(int lineCount) {
        return fixedTokens() + accountant.countTokens(RequestPartitioner.chunkSuffix(lineCount, lineCount), MODEL);
    }

    private static List<String> listedFiles(List<Message> chunk) {
        String content = chunk.get(chunk.size() - 1).content();
        return content.lines().filter(line -> line.startsWith("file_")).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Splitting a file list")
    class Splitting {

        @Test
        @DisplayName("chunks partition the list exactly once, in order")
        void exhaustive_and_ordered() {
            List<String> files = files(25);
            List<Message> conversation = conversation(PREFIX + String.join("\n", files));

            // budget of 30 tokens: 10 lines per chunk
            List<List<Message>> chunks = partitioner.partition(conversation, MODEL, chunkOverhead(25) + 30);

            assertThat(chunks).hasSize(3);
            List<String> rejoined = new ArrayList<>();
            chunks.forEach(chunk -> rejoined.addAll(listedFiles(chunk)));
            assertThat(rejoined).containsExactlyElementsOf(files);
            assertThat(listedFiles(chunks.get(0))).hasSize(10);
            assertThat(listedFiles(chunks.get(2))).hasSize(5);
        }

        @Test
        @DisplayName("fixed content is replicated and each chunk is annotated")
        void fixed_content_replicated() {
            List<Message> conversation = conversation(PREFIX + String.join("\n", files(25)));

            List<List<Message>> chunks = partitioner.partition(conversation, MODEL, chunkOverhead(25) + 30);

            for (int i = 0; i < chunks.size(); i++) {
                List<Message> chunk = chunks.get(i);
                assertThat(chunk.get(0)).isEqualTo(Message.system(SYSTEM_PROMPT));
                assertThat(chunk.get(1).content())
                        .startsWith(PREFIX)
                        .endsWith(RequestPartitioner.chunkSuffix(i + 1, 3));
            }
            assertThat(chunks.get(1).get(1).content()).contains("[Chunk 2 of 3");
        }

        @Test
        @DisplayName("every chunk, chunk note included, stays within the limit")
        void chunk_note_budgeted() {
            // "file_01.txt\n" is 12 characters, exactly 3 tokens
            List<String> lines = IntStream.rangeClosed(1, 30)
                    .mapToObj(i -> String.format("file_%02d.txt", i))
                    .collect(Collectors.toList());
            List<Message> conversation = conversation(PREFIX + String.join("\n", lines));
            int limit = chunkOverhead(lines.size()) + 12;

            List<List<Message>> chunks = partitioner.partition(conversation, MODEL, limit);

            assertThat(chunks).hasSize(8);
            assertThat(chunks).allSatisfy(chunk ->
                    assertThat(accountant.countConversationTokens(chunk, MODEL)).isLessThanOrEqualTo(limit));
        }

        @Test
        @DisplayName("an oversized line becomes its own chunk instead of being dropped")
        void oversized_line() {
            String huge = "file_" + "x".repeat(400) + ".txt";
            List<String> lines = List.of("file_001.txt", "file_002.txt", huge, "file_003.txt");
            List<Message> conversation = conversation(PREFIX + String.join("\n", lines));

            List<List<Message>> chunks = partitioner.partition(conversation, MODEL, chunkOverhead(lines.size()) + 30);

            assertThat(chunks).hasSize(3);
            assertThat(listedFiles(chunks.get(0))).containsExactly("file_001.txt", "file_002.txt");
            assertThat(listedFiles(chunks.get(1))).containsExactly(huge);
            assertThat(listedFiles(chunks.get(2))).containsExactly("file_003.txt");
        }

        @Test
        @DisplayName("blank lines inside the list are not sent")
        void blank_lines_dropped() {
            List<String> files = files(12);
            String content = PREFIX + String.join("\n\n", files);

            List<List<Message>> chunks = partitioner.partition(conversation(content), MODEL, chunkOverhead(files.size()) + 15);

            List<String> rejoined = new ArrayList<>();
            chunks.forEach(chunk -> rejoined.addAll(listedFiles(chunk)));
            assertThat(rejoined).containsExactlyElementsOf(files);
        }
    }

    @Nested
    @DisplayName("Locating the list")
    class Locating {

        @Test
        @DisplayName("labeled marker wins")
        void marker() {
            RequestPartitioner.SplitPoint split = partitioner.locate(conversation(PREFIX + "a.txt\nb.txt"));

            assertThat(split.prefix()).isEqualTo(PREFIX);
            assertThat(split.lines()).containsExactly("a.txt", "b.txt");
            assertThat(split.messageIndex()).isEqualTo(1);
        }

        @Test
        @DisplayName("without a marker the last blank-line block is the list")
        void last_block() {
            String content = "Match the files below.\n\nThey come from the archive.\n\na.txt\nb.txt\nc.txt";

            RequestPartitioner.SplitPoint split = partitioner.locate(conversation(content));

            assertThat(split.prefix()).isEqualTo("Match the files below.\n\nThey come from the archive.\n\n");
            assertThat(split.lines()).containsExactly("a.txt", "b.txt", "c.txt");
        }

        @Test
        @DisplayName("without a block, lines after the first line are the list")
        void raw_lines() {
            RequestPartitioner.SplitPoint split = partitioner.locate(conversation("Files:x\na.txt\nb.txt"));

            assertThat(split.prefix()).isEqualTo("Files:x\n");
            assertThat(split.lines()).containsExactly("a.txt", "b.txt");
        }

        @Test
        @DisplayName("only the last user message is considered")
        void last_user_message() {
            List<Message> conversation = List.of(
                    Message.user(PREFIX + "old.txt"),
                    Message.assistant("Noted."),
                    Message.user(PREFIX + "new.txt\nnewer.txt"),
                    Message.assistant("Working on it."));

            RequestPartitioner.SplitPoint split = partitioner.locate(conversation);

            assertThat(split.messageIndex()).isEqualTo(2);
            assertThat(split.lines()).containsExactly("new.txt", "newer.txt");
        }
    }

    @Nested
    @DisplayName("Nothing to split")
    class NothingToSplit {

        @Test
        @DisplayName("a request that already fits stays whole")
        void fits() {
            List<Message> conversation = conversation(PREFIX + String.join("\n", files(5)));

            List<List<Message>> chunks = partitioner.partition(conversation, MODEL, 10_000);

            assertThat(chunks).containsExactly(conversation);
        }

        @Test
        @DisplayName("no list in the user message")
        void no_list() {
            List<Message> conversation = conversation("Extract every figure caption.");

            assertThat(partitioner.partition(conversation, MODEL, 10)).containsExactly(conversation);
        }

        @Test
        @DisplayName("empty list after the marker")
        void empty_list() {
            List<Message> conversation = conversation(PREFIX + "\n\n");

            assertThat(partitioner.partition(conversation, MODEL, 10)).containsExactly(conversation);
        }

        @Test
        @DisplayName("fixed content alone over the limit returns the original")
        void fixed_content_too_large() {
            List<Message> conversation = conversation(PREFIX + String.join("\n", files(25)));

            List<List<Message>> chunks = partitioner.partition(conversation, MODEL, fixedTokens());

            assertThat(chunks).containsExactly(conversation);
        }

        @Test
        @DisplayName("no user message")
        void no_user_message() {
            List<Message> conversation = List.of(Message.system(SYSTEM_PROMPT));

            assertThat(partitioner.partition(conversation, MODEL, 5)).containsExactly(conversation);
        }
    }
}
