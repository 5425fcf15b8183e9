package org.knowhub.service;

import org.knowhub.DTO.AnswerStream;
import org.knowhub.DTO.ChatResponse;
import org.knowhub.DTO.Citation;
import org.knowhub.DTO.Conversation;
import org.knowhub.DTO.Message;
import org.knowhub.DTO.SearchResult;
import org.knowhub.DTO.SynthesizedAnswer;
import org.knowhub.DTO.Turn;
import org.knowhub.config.RagProperties;
import org.knowhub.utils.LogUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * 问答主流程：追问改写 → 混合检索 → 生成回答 → 记录本轮。
 * 同一会话的请求依次执行。
 */
@Service
public class RagService {

    private static final Logger logger = LoggerFactory.getLogger(RagService.class);

    private final ConversationService conversationService;
    private final HybridSearchService hybridSearchService;
    private final AnswerSynthesisService answerSynthesisService;
    private final RagProperties ragProperties;
    private final Clock clock;

    public RagService(ConversationService conversationService,
                      HybridSearchService hybridSearchService,
                      AnswerSynthesisService answerSynthesisService,
                      RagProperties ragProperties,
                      Clock clock) {
        this.conversationService = conversationService;
        this.hybridSearchService = hybridSearchService;
        this.answerSynthesisService = answerSynthesisService;
        this.ragProperties = ragProperties;
        this.clock = clock;
    }

    public ChatResponse ask(String conversationId, String question, Integer topK) {
        validateQuestion(question);
        String id = conversationIdOrNew(conversationId);
        return conversationService.withConversation(id, conversation -> {
            String resolved = conversationService.resolveFollowup(question, conversation);
            List<SearchResult> retrieved = hybridSearchService.search(resolved, effectiveTopK(topK));
            List<Message> history = conversationService.history(conversation,
                    ragProperties.getConversation().getMaxHistoryTurns());

            SynthesizedAnswer answer = answerSynthesisService.answer(resolved, retrieved, history);
            Turn turn = newTurn(question, resolved, retrieved, answer.getAnswer(), answer.getCitations());
            conversationService.appendTurn(conversation, turn);
            LogUtils.logChat(id, turn.getTurnId(), question.length(), answer.getCitations().size());
            return toResponse(id, turn, answer.isGrounded());
        });
    }

    /**
     * 流式问答。返回的 Flux 必须被订阅，会话许可在流结束、出错或取消时释放。
     * 只有完整输出的回答才会记入会话，取消的不记录。
     *
     * @param onComplete 回答完整结束后回调，参数包含引用
     */
    public Flux<String> streamAsk(String conversationId, String question, Integer topK,
                                  Consumer<ChatResponse> onComplete) {
        validateQuestion(question);
        String id = conversationIdOrNew(conversationId);
        ConversationService.ConversationPermit permit = conversationService.acquire(id);

        Conversation conversation;
        String resolved;
        List<SearchResult> retrieved;
        AnswerStream stream;
        try {
            conversation = conversationService.load(id);
            resolved = conversationService.resolveFollowup(question, conversation);
            retrieved = hybridSearchService.search(resolved, effectiveTopK(topK));
            List<Message> history = conversationService.history(conversation,
                    ragProperties.getConversation().getMaxHistoryTurns());
            stream = answerSynthesisService.stream(resolved, retrieved, history);
        } catch (RuntimeException e) {
            permit.release();
            throw e;
        }

        StringBuilder buffer = new StringBuilder();
        return stream.getTokens()
                .doOnNext(buffer::append)
                .doOnComplete(() -> {
                    String text = buffer.toString();
                    List<Citation> citations = answerSynthesisService.extractCitations(text, stream.getPrompt());
                    Turn turn = newTurn(question, resolved, retrieved, text, citations);
                    conversationService.appendTurn(conversation, turn);
                    LogUtils.logChat(id, turn.getTurnId(), question.length(), citations.size());
                    if (onComplete != null) {
                        onComplete.accept(toResponse(id, turn, stream.getPrompt() != null));
                    }
                })
                .doOnCancel(() -> logger.info("会话 {} 的回答被取消，本轮不记录", id))
                .doFinally(signal -> permit.release());
    }

    public Conversation conversation(String conversationId) {
        return conversationService.load(conversationId);
    }

    private Turn newTurn(String question, String resolved, List<SearchResult> retrieved,
                         String answer, List<Citation> citations) {
        List<String> chunkIds = new ArrayList<>(retrieved.size());
        for (SearchResult result : retrieved) {
            chunkIds.add(result.getChunkId());
        }
        return Turn.builder()
                .turnId(UUID.randomUUID().toString())
                .question(question)
                .resolvedQuestion(resolved)
                .retrievedChunkIds(chunkIds)
                .answer(answer)
                .citations(citations)
                .timestamp(clock.instant())
                .build();
    }

    private ChatResponse toResponse(String conversationId, Turn turn, boolean grounded) {
        return ChatResponse.builder()
                .conversationId(conversationId)
                .turnId(turn.getTurnId())
                .question(turn.getQuestion())
                .resolvedQuestion(turn.getResolvedQuestion())
                .answer(turn.getAnswer())
                .citations(turn.getCitations())
                .grounded(grounded)
                .build();
    }

    private int effectiveTopK(Integer topK) {
        return topK != null ? topK : ragProperties.getRetrieval().getDefaultTopK();
    }

    private static String conversationIdOrNew(String conversationId) {
        return conversationId == null || conversationId.isBlank() ? UUID.randomUUID().toString() : conversationId;
    }

    private static void validateQuestion(String question) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("问题不能为空");
        }
    }
}
