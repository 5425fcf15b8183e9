package org.knowhub.service;

import org.junit.jupiter.api.Test;
import org.knowhub.DTO.BoundedPrompt;
import org.knowhub.DTO.Message;
import org.knowhub.DTO.RankedChunk;
import org.knowhub.DTO.SearchResult;
import org.knowhub.config.AiProperties;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PromptBuilderTest {

    private final PromptBuilder promptBuilder = new PromptBuilder(new AiProperties());

    @Test
    void referencesAreLabelledInRankOrderAheadOfQuestion() {
        List<RankedChunk> chunks = List.of(
                new RankedChunk(2, result("guide", 4, "Second best.")),
                new RankedChunk(1, result("guide", 1, "Best match.")));

        BoundedPrompt prompt = promptBuilder.build("How do I deploy?", chunks,
                List.of(new Message("user", "earlier"), new Message("assistant", "reply")), 10_000);

        List<Message> messages = prompt.getMessages();
        assertThat(messages).extracting(Message::getRole).containsExactly("system", "user", "assistant", "user");
        assertThat(messages.get(messages.size() - 1).getContent()).isEqualTo("How do I deploy?");
        String system = messages.get(0).getContent();
        assertThat(system).contains("[1] (source: guide.md#1)\nBest match.");
        assertThat(system.indexOf("[1]")).isLessThan(system.indexOf("[2] (source: guide.md#4)"));
        assertThat(system).contains("<<REF>>").endsWith("<<END>>");
        assertThat(prompt.getReferences().get(1).getChunkId()).isEqualTo("guide:1");
        assertThat(prompt.getDroppedCount()).isZero();
    }

    @Test
    void lowestRankedChunksAreDroppedWholeWhenOverBudget() {
        String text = "x".repeat(80);
        List<RankedChunk> chunks = List.of(
                new RankedChunk(1, result("a", 0, text)),
                new RankedChunk(2, result("a", 1, text)),
                new RankedChunk(3, result("a", 2, text)));

        BoundedPrompt prompt = promptBuilder.build("q", chunks, List.of(), 250);

        assertThat(prompt.getReferences()).containsOnlyKeys(1, 2);
        assertThat(prompt.getDroppedCount()).isEqualTo(1);
        assertThat(prompt.getContextChars()).isLessThanOrEqualTo(250);
        assertThat(prompt.getMessages().get(0).getContent()).doesNotContain("a.md#2");
    }

    @Test
    void nothingFitsMeansNoReferences() {
        BoundedPrompt prompt = promptBuilder.build("q",
                List.of(new RankedChunk(1, result("a", 0, "y".repeat(500)))), List.of(), 100);

        assertThat(prompt.hasReferences()).isFalse();
        assertThat(prompt.getDroppedCount()).isEqualTo(1);
    }

    static SearchResult result(String documentId, int sequence, String text) {
        return SearchResult.builder()
                .chunkId(documentId + ":" + sequence)
                .documentId(documentId)
                .version(1)
                .sequenceIndex(sequence)
                .textContent(text)
                .fileName(documentId + ".md")
                .score(0.9)
                .build();
    }
}
