package org.knowhub.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.knowhub.DTO.ChatResponse;
import org.knowhub.DTO.Citation;
import org.knowhub.DTO.Conversation;
import org.knowhub.DTO.Turn;
import org.knowhub.exception.GenerationException;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RagServiceTest {

    private RagTestFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new RagTestFixture();
        fixture.ragProperties.getChunking().setMaxChars(30);
        fixture.ragProperties.getChunking().setOverlap(5);
        fixture.ingestMarkdown("ops", "Deploy via `terraform apply`\n\nOur office is in Berlin.\n\nLunch is served at noon.\n");
    }

    @Test
    void deployQuestionIsAnsweredWithCitation() {
        when(fixture.chatClient.complete(anyList())).thenReturn("Run terraform apply [1].");

        ChatResponse response = fixture.ragService.ask("conv-b", "How do I deploy?", 3);

        assertThat(response.isGrounded()).isTrue();
        assertThat(response.getCitations()).extracting(Citation::getChunkId).containsExactly("ops:0");
        Conversation conversation = fixture.conversationService.load("conv-b");
        assertThat(conversation.getTurns()).hasSize(1);
        assertThat(conversation.getTurns().get(0).getRetrievedChunkIds()).first().isEqualTo("ops:0");
        assertThat(conversation.getTurns().get(0).getTurnId()).isEqualTo(response.getTurnId());
    }

    @Test
    void unanswerableQuestionGetsNoGroundingMessage() {
        ChatResponse response = fixture.ragService.ask("conv-d", "quantum chromodynamics lecture", 3);

        assertThat(response.getAnswer()).isEqualTo(fixture.aiProperties.getPrompt().getNoGroundingText());
        assertThat(response.getCitations()).isEmpty();
        assertThat(response.isGrounded()).isFalse();
        verify(fixture.chatClient, never()).complete(anyList());
    }

    @Test
    void followupQuestionCarriesPreviousTopic() {
        when(fixture.chatClient.complete(anyList())).thenReturn("It takes a week [1].");
        fixture.ragService.ask("conv-c", "What is the onboarding process?", 3);

        ChatResponse second = fixture.ragService.ask("conv-c", "What about day one?", 3);

        assertThat(second.getQuestion()).isEqualTo("What about day one?");
        assertThat(second.getResolvedQuestion()).contains("onboarding process").isNotEqualTo("What about day one?");
        assertThat(fixture.conversationService.load("conv-c").getTurns()).hasSize(2);
    }

    @Test
    void concurrentQuestionsInSameConversationKeepBothTurns() throws Exception {
        when(fixture.chatClient.complete(anyList())).thenAnswer(inv -> {
            Thread.sleep(50);
            return "Run terraform apply [1].";
        });
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        List<Future<ChatResponse>> futures = new ArrayList<>();
        for (String question : List.of("How do I deploy?", "How do I deploy with terraform?")) {
            futures.add(pool.submit(() -> {
                start.await();
                return fixture.ragService.ask("conv-p", question, 3);
            }));
        }
        start.countDown();
        List<String> turnIds = new ArrayList<>();
        for (Future<ChatResponse> future : futures) {
            turnIds.add(future.get(10, TimeUnit.SECONDS).getTurnId());
        }
        pool.shutdown();

        Conversation conversation = fixture.conversationService.load("conv-p");
        assertThat(conversation.getTurns()).hasSize(2);
        assertThat(conversation.getTurns()).extracting(Turn::getTurnId).containsExactlyInAnyOrderElementsOf(turnIds);
    }

    @Test
    void newConversationIdIsAssignedWhenMissing() {
        ChatResponse response = fixture.ragService.ask(null, "quantum chromodynamics lecture", 3);

        assertThat(response.getConversationId()).isNotBlank();
    }

    @Test
    void generationFailureDoesNotRecordTurn() {
        when(fixture.chatClient.complete(anyList())).thenThrow(new GenerationException("model down"));

        assertThatThrownBy(() -> fixture.ragService.ask("conv-e", "How do I deploy?", 3))
                .isInstanceOf(GenerationException.class);
        assertThat(fixture.conversationService.load("conv-e").getTurns()).isEmpty();
    }

    @Test
    void streamedAnswerIsRecordedWithCitations() {
        when(fixture.chatClient.stream(anyList())).thenReturn(Flux.just("Run terraform ", "apply [1]."));
        AtomicReference<ChatResponse> completed = new AtomicReference<>();

        List<String> tokens = fixture.ragService.streamAsk("conv-s", "How do I deploy?", 3, completed::set)
                .collectList().block();

        assertThat(tokens).containsExactly("Run terraform ", "apply [1].");
        assertThat(completed.get().getAnswer()).isEqualTo("Run terraform apply [1].");
        assertThat(completed.get().getCitations()).extracting(Citation::getChunkId).containsExactly("ops:0");
        assertThat(fixture.conversationService.load("conv-s").getTurns()).hasSize(1);
    }

    @Test
    void cancelledStreamIsNotRecordedAndReleasesConversation() {
        when(fixture.chatClient.stream(anyList())).thenReturn(Flux.concat(Flux.just("partial"), Flux.never()));
        AtomicReference<ChatResponse> completed = new AtomicReference<>();

        List<String> tokens = fixture.ragService.streamAsk("conv-x", "How do I deploy?", 3, completed::set)
                .take(1).collectList().block();

        assertThat(tokens).containsExactly("partial");
        assertThat(completed.get()).isNull();
        assertThat(fixture.conversationService.load("conv-x").getTurns()).isEmpty();

        // 许可已释放，同一会话可以继续提问
        ChatResponse next = fixture.ragService.ask("conv-x", "quantum chromodynamics lecture", 3);
        assertThat(next.isGrounded()).isFalse();
    }

    @Test
    void blankQuestionIsRejected() {
        assertThatThrownBy(() -> fixture.ragService.ask("conv-z", "  ", 3))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
