package org.knowhub.service;

import org.knowhub.DTO.AnswerStream;
import org.knowhub.DTO.BoundedPrompt;
import org.knowhub.DTO.Citation;
import org.knowhub.DTO.Message;
import org.knowhub.DTO.RankedChunk;
import org.knowhub.DTO.SearchResult;
import org.knowhub.DTO.SynthesizedAnswer;
import org.knowhub.client.ChatCompletionClient;
import org.knowhub.config.AiProperties;
import org.knowhub.config.RagProperties;
import org.knowhub.exception.GenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 基于检索结果生成带引用的回答。
 */
@Service
public class AnswerSynthesisService {

    private static final Logger logger = LoggerFactory.getLogger(AnswerSynthesisService.class);

    // [1]、[2, 3] 形式的引用标记
    private static final Pattern CITATION_MARKER = Pattern.compile("\\[(\\d{1,4}(?:\\s*,\\s*\\d{1,4})*)]");

    private final ChatCompletionClient chatCompletionClient;
    private final PromptBuilder promptBuilder;
    private final AiProperties aiProperties;
    private final RagProperties ragProperties;

    public AnswerSynthesisService(ChatCompletionClient chatCompletionClient,
                                  PromptBuilder promptBuilder,
                                  AiProperties aiProperties,
                                  RagProperties ragProperties) {
        this.chatCompletionClient = chatCompletionClient;
        this.promptBuilder = promptBuilder;
        this.aiProperties = aiProperties;
        this.ragProperties = ragProperties;
    }

    /**
     * 生成回答。没有检索结果时直接返回兜底文案，不调用模型。
     *
     * @throws GenerationException 模型重试一次后仍不可用
     */
    public SynthesizedAnswer answer(String question, List<SearchResult> retrieved, List<Message> history) {
        if (retrieved == null || retrieved.isEmpty()) {
            return noGrounding();
        }
        BoundedPrompt prompt = prepare(question, retrieved, history);
        if (!prompt.hasReferences()) {
            return noGrounding();
        }
        String text = completeWithRetry(prompt.getMessages());
        List<Citation> citations = extractCitations(text, prompt);
        logger.info("回答生成完成，参考资料: {}, 丢弃: {}, 引用: {}",
                prompt.getReferences().size(), prompt.getDroppedCount(), citations.size());
        return new SynthesizedAnswer(text, citations, true);
    }

    /**
     * 流式回答，引用在流结束后用 {@link #extractCitations} 从完整文本中提取
     */
    public AnswerStream stream(String question, List<SearchResult> retrieved, List<Message> history) {
        if (retrieved == null || retrieved.isEmpty()) {
            return new AnswerStream(Flux.just(noGroundingText()), null);
        }
        BoundedPrompt prompt = prepare(question, retrieved, history);
        if (!prompt.hasReferences()) {
            return new AnswerStream(Flux.just(noGroundingText()), null);
        }
        return new AnswerStream(chatCompletionClient.stream(prompt.getMessages()), prompt);
    }

    public BoundedPrompt prepare(String question, List<SearchResult> retrieved, List<Message> history) {
        List<RankedChunk> ranked = new ArrayList<>(retrieved.size());
        for (int i = 0; i < retrieved.size(); i++) {
            ranked.add(new RankedChunk(i + 1, retrieved.get(i)));
        }
        return promptBuilder.build(question, ranked, history, ragProperties.getRetrieval().getMaxContextChars());
    }

    /**
     * 按首次出现顺序提取引用。只认 Prompt 中真实存在的编号，其余标记忽略。
     */
    public List<Citation> extractCitations(String answer, BoundedPrompt prompt) {
        List<Citation> citations = new ArrayList<>();
        if (answer == null || prompt == null) {
            return citations;
        }
        Set<Integer> labels = new LinkedHashSet<>();
        Matcher matcher = CITATION_MARKER.matcher(answer);
        while (matcher.find()) {
            for (String part : matcher.group(1).split(",")) {
                int label = Integer.parseInt(part.trim());
                if (prompt.getReferences().containsKey(label)) {
                    labels.add(label);
                }
            }
        }
        for (int label : labels) {
            SearchResult source = prompt.getReferences().get(label);
            citations.add(new Citation(label, source.getChunkId(), source.getDocumentId(),
                    source.getSequenceIndex(), source.getFileName()));
        }
        return citations;
    }

    public String noGroundingText() {
        return aiProperties.getPrompt().getNoGroundingText();
    }

    private SynthesizedAnswer noGrounding() {
        return new SynthesizedAnswer(noGroundingText(), List.of(), false);
    }

    private String completeWithRetry(List<Message> messages) {
        try {
            return chatCompletionClient.complete(messages);
        } catch (GenerationException first) {
            logger.warn("对话模型调用失败，重试一次: {}", first.getMessage());
            return chatCompletionClient.complete(messages);
        }
    }
}
