package org.knowhub.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.knowhub.config.RagProperties;
import org.knowhub.exception.EmbeddingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

// 嵌入向量生成客户端（OpenAI 兼容的 /embeddings 接口）
@Component
public class EmbeddingClient {

    private static final Logger logger = LoggerFactory.getLogger(EmbeddingClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final RagProperties ragProperties;
    private final String modelId;
    private final int dimension;

    public EmbeddingClient(WebClient embeddingWebClient,
                           ObjectMapper objectMapper,
                           RagProperties ragProperties,
                           @Value("${embedding.api.model}") String modelId,
                           @Value("${embedding.api.dimension:1024}") int dimension) {
        this.webClient = embeddingWebClient;
        this.objectMapper = objectMapper;
        this.ragProperties = ragProperties;
        this.modelId = modelId;
        this.dimension = dimension;
    }

    /**
     * 调用一次 API 生成向量，分批由调用方负责。
     * 超时、5xx、429 和连接错误按指数退避重试，重试耗尽后抛出 EmbeddingException。
     *
     * @param texts 输入文本列表
     * @return 与输入顺序一致的向量列表
     */
    public List<float[]> embed(List<String> texts) {
        logger.debug("调用向量服务，文本数量: {}", texts.size());
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", modelId);
        requestBody.put("input", texts);
        requestBody.put("dimensions", dimension);
        requestBody.put("encoding_format", "float");

        RagProperties.Backend backend = ragProperties.getBackend();
        try {
            String response = webClient.post()
                    .uri("/embeddings")
                    .bodyValue(requestBody)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(backend.getTimeout())
                    .retryWhen(Retry.backoff(backend.getMaxRetries(), backend.getInitialBackoff())
                            .maxBackoff(backend.getMaxBackoff())
                            .filter(EmbeddingClient::isRetryable)
                            .doBeforeRetry(signal -> logger.warn("向量服务调用失败，第 {} 次重试: {}",
                                    signal.totalRetries() + 1, signal.failure().getMessage()))
                            .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
                    .block();
            List<float[]> vectors = parseVectors(response);
            if (vectors.size() != texts.size()) {
                throw new EmbeddingException("向量数量与输入不一致: 期望 " + texts.size() + ", 实际 " + vectors.size());
            }
            return vectors;
        } catch (EmbeddingException e) {
            throw e;
        } catch (Exception e) {
            throw new EmbeddingException("向量服务调用失败: " + e.getMessage(), e);
        }
    }

    public String getModelVersion() {
        return modelId;
    }

    static boolean isRetryable(Throwable e) {
        if (e instanceof WebClientResponseException) {
            WebClientResponseException response = (WebClientResponseException) e;
            return response.getStatusCode().is5xxServerError() || response.getStatusCode().value() == 429;
        }
        return e instanceof WebClientRequestException || e instanceof TimeoutException;
    }

    private List<float[]> parseVectors(String response) throws Exception {
        if (response == null) {
            throw new EmbeddingException("向量服务响应为空");
        }
        JsonNode data = objectMapper.readTree(response).get("data");
        if (data == null || !data.isArray()) {
            throw new EmbeddingException("API 响应格式错误: data 字段不存在或不是数组");
        }
        float[][] ordered = new float[data.size()][];
        int position = 0;
        for (JsonNode item : data) {
            // 按 index 字段还原顺序，缺省时按出现顺序
            int index = item.has("index") ? item.get("index").asInt() : position;
            if (index < 0 || index >= ordered.length) {
                throw new EmbeddingException("API 响应中的 index 越界: " + index);
            }
            JsonNode embedding = item.get("embedding");
            if (embedding != null && embedding.isArray()) {
                float[] vector = new float[embedding.size()];
                for (int i = 0; i < embedding.size(); i++) {
                    vector[i] = (float) embedding.get(i).asDouble();
                }
                ordered[index] = vector;
            }
            position++;
        }
        return Arrays.asList(ordered);
    }
}
