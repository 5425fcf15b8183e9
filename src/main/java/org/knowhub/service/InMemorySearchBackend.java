package org.knowhub.service;

import org.knowhub.DTO.IndexRecord;
import org.knowhub.DTO.ScoredRecord;
import org.knowhub.DTO.SearchFilters;
import org.knowhub.utils.TextAnalyzer;
import org.knowhub.utils.VectorUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内检索后端，rag.index.backend=memory 时启用。
 * 关键词检索为 BM25，向量检索为暴力余弦。
 */
@Service
@ConditionalOnProperty(name = "rag.index.backend", havingValue = "memory")
public class InMemorySearchBackend implements SearchBackend {

    private static final Logger logger = LoggerFactory.getLogger(InMemorySearchBackend.class);

    private static final double K1 = 1.2;
    private static final double B = 0.75;

    private static final Comparator<ScoredRecord> RANKING = Comparator
            .comparingDouble(ScoredRecord::getScore).reversed()
            .thenComparing(s -> s.getRecord().getDocumentId())
            .thenComparingInt(s -> s.getRecord().getSequenceIndex());

    private final Map<String, Entry> records = new ConcurrentHashMap<>();

    @Override
    public void upsert(List<IndexRecord> batch) {
        for (IndexRecord record : batch) {
            records.put(record.getId(), new Entry(record, TextAnalyzer.tokenize(record.getTextContent())));
        }
        logger.debug("内存索引写入 {} 条，当前共 {} 条", batch.size(), records.size());
    }

    @Override
    public void deleteDocument(String documentId) {
        records.values().removeIf(e -> e.record.getDocumentId().equals(documentId));
    }

    @Override
    public void deleteVersion(String documentId, long version) {
        records.values().removeIf(e -> e.record.getDocumentId().equals(documentId) && e.record.getVersion() == version);
    }

    @Override
    public void deleteVersionsExcept(String documentId, long keepVersion) {
        records.values().removeIf(e -> e.record.getDocumentId().equals(documentId) && e.record.getVersion() != keepVersion);
    }

    @Override
    public long count(String documentId, long version) {
        return records.values().stream()
                .filter(e -> e.record.getDocumentId().equals(documentId) && e.record.getVersion() == version)
                .count();
    }

    @Override
    public List<ScoredRecord> lexicalSearch(List<String> terms, SearchFilters filters, int k) {
        if (terms == null || terms.isEmpty() || k <= 0) {
            return List.of();
        }
        List<Entry> candidates = new ArrayList<>();
        for (Entry entry : records.values()) {
            if (filters.matches(entry.record)) {
                candidates.add(entry);
            }
        }
        if (candidates.isEmpty()) {
            return List.of();
        }
        double avgLength = candidates.stream().mapToInt(e -> e.tokens.size()).average().orElse(1);
        LinkedHashSet<String> queryTerms = new LinkedHashSet<>(terms);
        Map<String, Integer> documentFrequency = new HashMap<>();
        for (String term : queryTerms) {
            int df = 0;
            for (Entry entry : candidates) {
                if (entry.termFrequency.containsKey(term)) {
                    df++;
                }
            }
            documentFrequency.put(term, df);
        }

        int n = candidates.size();
        List<ScoredRecord> scored = new ArrayList<>();
        for (Entry entry : candidates) {
            double score = 0;
            for (String term : queryTerms) {
                Integer tf = entry.termFrequency.get(term);
                if (tf == null) {
                    continue;
                }
                int df = documentFrequency.get(term);
                double idf = Math.log(1 + (n - df + 0.5) / (df + 0.5));
                double norm = K1 * (1 - B + B * entry.tokens.size() / Math.max(avgLength, 1));
                score += idf * tf * (K1 + 1) / (tf + norm);
            }
            if (score > 0) {
                scored.add(new ScoredRecord(entry.record, score));
            }
        }
        scored.sort(RANKING);
        return scored.size() > k ? new ArrayList<>(scored.subList(0, k)) : scored;
    }

    @Override
    public List<ScoredRecord> vectorSearch(float[] vector, SearchFilters filters, int k) {
        if (vector == null || k <= 0) {
            return List.of();
        }
        List<ScoredRecord> scored = new ArrayList<>();
        for (Entry entry : records.values()) {
            if (entry.record.getVector() != null && filters.matches(entry.record)) {
                scored.add(new ScoredRecord(entry.record, VectorUtils.cosine(vector, entry.record.getVector())));
            }
        }
        scored.sort(RANKING);
        return scored.size() > k ? new ArrayList<>(scored.subList(0, k)) : scored;
    }

    private static final class Entry {
        private final IndexRecord record;
        private final List<String> tokens;
        private final Map<String, Integer> termFrequency = new HashMap<>();

        private Entry(IndexRecord record, List<String> tokens) {
            this.record = record;
            this.tokens = tokens;
            for (String token : tokens) {
                termFrequency.merge(token, 1, Integer::sum);
            }
        }
    }
}
