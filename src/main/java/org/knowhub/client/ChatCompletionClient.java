package org.knowhub.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.knowhub.DTO.Message;
import org.knowhub.config.AiProperties;
import org.knowhub.exception.GenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 对话模型客户端（DeepSeek / OpenAI 兼容的 /chat/completions 接口）。
 * 不做重试，重试策略由调用方决定。
 */
@Component
public class ChatCompletionClient {

    private static final Logger logger = LoggerFactory.getLogger(ChatCompletionClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final AiProperties aiProperties;
    private final String model;

    public ChatCompletionClient(WebClient chatWebClient,
                                ObjectMapper objectMapper,
                                AiProperties aiProperties,
                                @Value("${deepseek.api.model}") String model) {
        this.webClient = chatWebClient;
        this.objectMapper = objectMapper;
        this.aiProperties = aiProperties;
        this.model = model;
    }

    /**
     * 非流式生成，返回完整回答
     *
     * @throws GenerationException 模型不可用、超时或响应无法解析
     */
    public String complete(List<Message> messages) {
        try {
            String response = webClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(buildRequest(messages, false))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(aiProperties.getGeneration().getTimeout())
                    .block();
            if (response == null) {
                throw new GenerationException("对话模型响应为空");
            }
            JsonNode content = objectMapper.readTree(response).path("choices").path(0).path("message").path("content");
            if (content.isMissingNode() || content.isNull()) {
                throw new GenerationException("对话模型响应中没有回答内容");
            }
            return content.asText();
        } catch (GenerationException e) {
            throw e;
        } catch (Exception e) {
            throw new GenerationException("对话模型调用失败: " + e.getMessage(), e);
        }
    }

    /**
     * 流式生成。取消订阅即停止读取模型输出。
     */
    public Flux<String> stream(List<Message> messages) {
        return webClient.post()
                .uri("/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(buildRequest(messages, true))
                .retrieve()
                .bodyToFlux(String.class)
                .timeout(aiProperties.getGeneration().getTimeout())
                .concatMapIterable(this::parseStreamChunk)
                .onErrorMap(e -> !(e instanceof GenerationException),
                        e -> new GenerationException("对话模型流读取异常: " + e.getMessage(), e));
    }

    /**
     * SSE 每一行通常以 "data: " 开头，[DONE] 为结束信号
     */
    private List<String> parseStreamChunk(String chunk) {
        List<String> tokens = new ArrayList<>();
        for (String line : chunk.split("\n")) {
            String data = line.trim();
            if (data.startsWith("data:")) {
                data = data.substring(5).trim();
            }
            if (data.isEmpty() || "[DONE]".equals(data)) {
                continue;
            }
            try {
                JsonNode node = objectMapper.readTree(data);
                String content = node.path("choices").path(0).path("delta").path("content").asText("");
                if (!content.isEmpty()) {
                    tokens.add(content);
                }
            } catch (Exception e) {
                // 非内容块（心跳、metadata）直接跳过
                logger.trace("跳过不可解析的块: {}", data);
            }
        }
        return tokens;
    }

    private Map<String, Object> buildRequest(List<Message> messages, boolean stream) {
        Map<String, Object> request = new HashMap<>();
        request.put("model", model);
        request.put("messages", messages);
        request.put("stream", stream);
        AiProperties.Generation gen = aiProperties.getGeneration();
        if (gen.getTemperature() != null) {
            request.put("temperature", gen.getTemperature());
        }
        if (gen.getTopP() != null) {
            request.put("top_p", gen.getTopP());
        }
        if (gen.getMaxTokens() != null) {
            request.put("max_tokens", gen.getMaxTokens());
        }
        logger.debug("构建请求，消息数：{}，流式：{}", messages.size(), stream);
        return request;
    }
}
