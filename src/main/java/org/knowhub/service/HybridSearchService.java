package org.knowhub.service;

import org.knowhub.DTO.IndexRecord;
import org.knowhub.DTO.ScoredRecord;
import org.knowhub.DTO.SearchFilters;
import org.knowhub.DTO.SearchResult;
import org.knowhub.config.RagProperties;
import org.knowhub.exception.EmbeddingException;
import org.knowhub.exception.RetrievalException;
import org.knowhub.utils.LogUtils;
import org.knowhub.utils.RetryUtils;
import org.knowhub.utils.TextAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 混合搜索服务，结合关键词匹配和向量相似度。
 * <p>
 * 两路结果分别召回后融合：关键词得分按本次最高分归一化，向量得分取余弦值（负数记 0），
 * 再按配置权重加权。有效版本过滤下推到后端召回，同分按文档 id、分块序号排序。
 */
@Service
public class HybridSearchService {

    private static final Logger logger = LoggerFactory.getLogger(HybridSearchService.class);

    static final Comparator<SearchResult> RANKING = Comparator
            .comparingDouble(SearchResult::getScore).reversed()
            .thenComparing(SearchResult::getDocumentId)
            .thenComparingInt(SearchResult::getSequenceIndex);

    private final SearchBackend searchBackend;
    private final DocumentVersionRegistry versionRegistry;
    private final EmbeddingService embeddingService;
    private final RagProperties ragProperties;

    public HybridSearchService(SearchBackend searchBackend,
                               DocumentVersionRegistry versionRegistry,
                               EmbeddingService embeddingService,
                               RagProperties ragProperties) {
        this.searchBackend = searchBackend;
        this.versionRegistry = versionRegistry;
        this.embeddingService = embeddingService;
        this.ragProperties = ragProperties;
    }

    public List<SearchResult> search(String query, int topK) {
        return search(query, topK, SearchFilters.none());
    }

    /**
     * 混合检索。没有足够相关的结果时返回空列表。
     *
     * @throws RetrievalException 检索后端在重试后仍不可用
     */
    public List<SearchResult> search(String query, int topK, SearchFilters filters) {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK 必须大于 0");
        }
        if (query == null || query.isBlank()) {
            return List.of();
        }
        SearchFilters effectiveFilters = filters != null ? filters : SearchFilters.none();
        LogUtils.PerformanceMonitor monitor = LogUtils.startPerformanceMonitor("HYBRID_SEARCH");

        List<String> terms = TextAnalyzer.distinctContentTerms(query);
        float[] queryVector = embedQuery(query);
        int candidates = topK * Math.max(1, ragProperties.getRetrieval().getCandidateMultiplier());
        RagProperties.Backend policy = ragProperties.getBackend();

        List<SearchResult> results = versionRegistry.readConsistent(active -> {
            if (active.isEmpty()) {
                return List.<SearchResult>of();
            }
            SearchFilters scoped = effectiveFilters.withActiveVersions(Map.copyOf(active));
            List<ScoredRecord> lexical = terms.isEmpty() ? List.of()
                    : RetryUtils.callWithRetry("关键词检索", policy,
                            () -> searchBackend.lexicalSearch(terms, scoped, candidates));
            List<ScoredRecord> vector = queryVector == null ? List.of()
                    : RetryUtils.callWithRetry("向量检索", policy,
                            () -> searchBackend.vectorSearch(queryVector, scoped, candidates));
            return fuse(lexical, vector, active, topK);
        });

        monitor.end("查询词: " + terms + ", 向量: " + (queryVector != null) + ", 结果: " + results.size());
        logger.debug("混合检索完成，查询: {}, 返回: {}", query, results.size());
        return results;
    }

    /**
     * 向量生成失败时返回 null，检索退化为纯关键词
     */
    private float[] embedQuery(String query) {
        try {
            return embeddingService.embed(query);
        } catch (EmbeddingException e) {
            logger.warn("查询向量生成失败，仅使用关键词检索: {}", e.getMessage());
            return null;
        }
    }

    private List<SearchResult> fuse(List<ScoredRecord> lexical, List<ScoredRecord> vector,
                                    Map<String, Long> active, int topK) {
        RagProperties.Retrieval retrieval = ragProperties.getRetrieval();

        double maxLexical = 0;
        for (ScoredRecord hit : lexical) {
            if (isActive(hit.getRecord(), active)) {
                maxLexical = Math.max(maxLexical, hit.getScore());
            }
        }

        Map<String, SearchResult> byRecord = new LinkedHashMap<>();
        for (ScoredRecord hit : lexical) {
            if (!isActive(hit.getRecord(), active) || maxLexical <= 0) {
                continue;
            }
            byRecord.computeIfAbsent(hit.getRecord().getId(), id -> toResult(hit.getRecord()))
                    .setLexicalScore(Math.max(0, hit.getScore()) / maxLexical);
        }
        for (ScoredRecord hit : vector) {
            if (!isActive(hit.getRecord(), active)) {
                continue;
            }
            byRecord.computeIfAbsent(hit.getRecord().getId(), id -> toResult(hit.getRecord()))
                    .setVectorScore(Math.max(0, hit.getScore()));
        }

        // 同一分块只保留得分更高的一条
        Map<String, SearchResult> byChunk = new LinkedHashMap<>();
        for (SearchResult result : byRecord.values()) {
            result.setScore(retrieval.getLexicalWeight() * result.getLexicalScore()
                    + retrieval.getVectorWeight() * result.getVectorScore());
            SearchResult existing = byChunk.get(result.getChunkId());
            if (existing == null || RANKING.compare(result, existing) < 0) {
                byChunk.put(result.getChunkId(), result);
            }
        }

        List<SearchResult> ranked = new ArrayList<>();
        for (SearchResult result : byChunk.values()) {
            if (result.getScore() >= retrieval.getMinScore() && result.getScore() > 0) {
                ranked.add(result);
            }
        }
        ranked.sort(RANKING);
        return ranked.size() > topK ? new ArrayList<>(ranked.subList(0, topK)) : ranked;
    }

    private boolean isActive(IndexRecord record, Map<String, Long> active) {
        Long version = active.get(record.getDocumentId());
        return version != null && version == record.getVersion();
    }

    private SearchResult toResult(IndexRecord record) {
        return SearchResult.builder()
                .chunkId(record.getChunkId())
                .documentId(record.getDocumentId())
                .version(record.getVersion())
                .sequenceIndex(record.getSequenceIndex())
                .textContent(record.getTextContent())
                .tag(record.getTag())
                .fileName(record.getFileName())
                .build();
    }
}
