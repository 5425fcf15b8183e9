package org.knowhub.service;

import org.knowhub.DTO.EmbeddingBatchResult;
import org.knowhub.client.EmbeddingClient;
import org.knowhub.config.RagProperties;
import org.knowhub.exception.EmbeddingException;
import org.knowhub.utils.VectorUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;

/**
 * 文本向量化。输出向量统一做 L2 归一化并校验维度。
 */
@Service
public class EmbeddingService {

    private static final Logger logger = LoggerFactory.getLogger(EmbeddingService.class);

    private final EmbeddingClient embeddingClient;
    private final RagProperties ragProperties;
    private final int batchSize;
    private final int dimension;
    private final int maxInputChars;

    public EmbeddingService(EmbeddingClient embeddingClient,
                            RagProperties ragProperties,
                            @Value("${embedding.api.batch-size:10}") int batchSize,
                            @Value("${embedding.api.dimension:1024}") int dimension,
                            @Value("${embedding.api.max-input-chars:8000}") int maxInputChars) {
        this.embeddingClient = embeddingClient;
        this.ragProperties = ragProperties;
        this.batchSize = Math.max(1, batchSize);
        this.dimension = dimension;
        this.maxInputChars = maxInputChars;
    }

    /**
     * 单条文本向量化
     *
     * @throws EmbeddingException 文本为空、超长、服务不可用或返回维度不符
     */
    public float[] embed(String text) {
        String invalid = validate(text);
        if (invalid != null) {
            throw new EmbeddingException(invalid);
        }
        float[] vector = checkAndNormalize(embeddingClient.embed(List.of(text.strip())).get(0));
        if (vector == null) {
            throw new EmbeddingException("向量维度错误，期望 " + dimension);
        }
        return vector;
    }

    /**
     * 批量向量化。按 batch-size 拆成子批次并发调用，某个子批次失败只影响它自己的条目。
     */
    public EmbeddingBatchResult embedBatch(List<String> texts) {
        EmbeddingBatchResult result = new EmbeddingBatchResult(texts.size());
        List<Integer> valid = new ArrayList<>();
        for (int i = 0; i < texts.size(); i++) {
            String invalid = validate(texts.get(i));
            if (invalid != null) {
                result.failure(i, invalid);
            } else {
                valid.add(i);
            }
        }

        List<List<Integer>> batches = new ArrayList<>();
        for (int i = 0; i < valid.size(); i += batchSize) {
            batches.add(valid.subList(i, Math.min(i + batchSize, valid.size())));
        }
        int concurrency = Math.max(1, ragProperties.getIngestion().getEmbeddingConcurrency());
        Flux.fromIterable(batches)
                .flatMap(batch -> Mono.fromRunnable(() -> embedSubBatch(batch, texts, result))
                        .subscribeOn(Schedulers.boundedElastic()), concurrency)
                .blockLast();

        logger.info("批量向量化完成，总数: {}, 成功: {}, 失败: {}, 子批次: {}",
                texts.size(), result.successCount(), texts.size() - result.successCount(), batches.size());
        return result;
    }

    public String getModelVersion() {
        return embeddingClient.getModelVersion();
    }

    public int getDimension() {
        return dimension;
    }

    private void embedSubBatch(List<Integer> indices, List<String> texts, EmbeddingBatchResult result) {
        List<String> inputs = new ArrayList<>(indices.size());
        for (int index : indices) {
            inputs.add(texts.get(index).strip());
        }
        List<float[]> vectors;
        try {
            vectors = embeddingClient.embed(inputs);
        } catch (RuntimeException e) {
            logger.warn("子批次向量化失败，条目: {}, 错误: {}", indices, e.getMessage());
            for (int index : indices) {
                result.failure(index, "向量服务调用失败: " + e.getMessage());
            }
            return;
        }
        for (int k = 0; k < indices.size(); k++) {
            float[] vector = checkAndNormalize(vectors.get(k));
            if (vector == null) {
                result.failure(indices.get(k), "向量维度错误或为零向量，期望维度 " + dimension);
            } else {
                result.success(indices.get(k), vector);
            }
        }
    }

    private String validate(String text) {
        if (text == null || text.isBlank()) {
            return "文本为空";
        }
        if (text.strip().length() > maxInputChars) {
            return "文本长度超过上限 " + maxInputChars;
        }
        return null;
    }

    private float[] checkAndNormalize(float[] vector) {
        if (vector == null || vector.length != dimension) {
            return null;
        }
        return VectorUtils.normalize(vector);
    }
}
