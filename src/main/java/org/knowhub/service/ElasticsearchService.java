package org.knowhub.service;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkOperation;
import co.elastic.clients.elasticsearch.core.search.Hit;
import org.knowhub.DTO.IndexRecord;
import org.knowhub.DTO.ScoredRecord;
import org.knowhub.DTO.SearchFilters;
import org.knowhub.DTO.StructuralTag;
import org.knowhub.config.RagProperties;
import org.knowhub.exception.RetrievalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

// Elasticsearch 检索后端
@Service
@ConditionalOnProperty(name = "rag.index.backend", havingValue = "elasticsearch", matchIfMissing = true)
public class ElasticsearchService implements SearchBackend {

    private static final Logger logger = LoggerFactory.getLogger(ElasticsearchService.class);

    private final ElasticsearchClient esClient;
    private final String indexName;

    public ElasticsearchService(ElasticsearchClient esClient, RagProperties ragProperties) {
        this.esClient = esClient;
        this.indexName = ragProperties.getIndex().getName();
    }

    /**
     * 批量写入分块记录，使用记录 id 作为 ES 文档 id，重复提交会覆盖而不是新增。
     * refresh=wait_for 保证返回时记录已可被检索。
     */
    @Override
    public void upsert(List<IndexRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        logger.info("开始批量索引分块到Elasticsearch，数量: {}", records.size());
        List<BulkOperation> operations = records.stream()
                .map(record -> BulkOperation.of(op -> op.index(idx -> idx
                        .index(indexName)
                        .id(record.getId())
                        .document(record))))
                .toList();
        try {
            BulkResponse response = esClient.bulk(BulkRequest.of(b -> b.operations(operations).refresh(Refresh.WaitFor)));
            if (response.errors()) {
                response.items().stream()
                        .filter(item -> item.error() != null)
                        .forEach(item -> logger.error("记录 {} 索引失败: {}", item.id(), item.error().reason()));
                throw new RetrievalException("批量索引部分失败，请检查日志");
            }
        } catch (IOException e) {
            throw new RetrievalException("批量索引失败: " + e.getMessage(), e);
        }
    }

    @Override
    public void deleteDocument(String documentId) {
        deleteByQuery(Query.of(q -> q.term(t -> t.field("documentId").value(documentId))));
    }

    @Override
    public void deleteVersion(String documentId, long version) {
        deleteByQuery(versionQuery(documentId, version));
    }

    @Override
    public void deleteVersionsExcept(String documentId, long keepVersion) {
        deleteByQuery(Query.of(q -> q.bool(b -> b
                .filter(f -> f.term(t -> t.field("documentId").value(documentId)))
                .mustNot(m -> m.term(t -> t.field("version").value(keepVersion))))));
    }

    @Override
    public long count(String documentId, long version) {
        try {
            return esClient.count(c -> c.index(indexName).query(versionQuery(documentId, version))).count();
        } catch (IOException e) {
            throw new RetrievalException("统计索引记录失败: " + e.getMessage(), e);
        }
    }

    @Override
    public List<ScoredRecord> lexicalSearch(List<String> terms, SearchFilters filters, int k) {
        if (terms == null || terms.isEmpty() || k <= 0) {
            return List.of();
        }
        String queryText = String.join(" ", terms);
        List<Query> filterQueries = filterQueries(filters);
        try {
            SearchResponse<IndexRecord> response = esClient.search(s -> s
                    .index(indexName)
                    .query(q -> q.bool(b -> {
                        b.must(m -> m.match(ma -> ma.field("textContent").query(queryText)));
                        if (!filterQueries.isEmpty()) {
                            b.filter(filterQueries);
                        }
                        return b;
                    }))
                    .size(k), IndexRecord.class);
            return toScored(response, false);
        } catch (IOException e) {
            throw new RetrievalException("关键词检索失败: " + e.getMessage(), e);
        }
    }

    @Override
    public List<ScoredRecord> vectorSearch(float[] vector, SearchFilters filters, int k) {
        if (vector == null || k <= 0) {
            return List.of();
        }
        List<Float> queryVector = new ArrayList<>(vector.length);
        for (float v : vector) {
            queryVector.add(v);
        }
        List<Query> filterQueries = filterQueries(filters);
        int numCandidates = Math.max(k * 10, 100);
        try {
            SearchResponse<IndexRecord> response = esClient.search(s -> s
                    .index(indexName)
                    .knn(kn -> {
                        kn.field("vector").queryVector(queryVector).k(k).numCandidates(numCandidates);
                        if (!filterQueries.isEmpty()) {
                            kn.filter(filterQueries);
                        }
                        return kn;
                    })
                    .size(k), IndexRecord.class);
            return toScored(response, true);
        } catch (IOException e) {
            throw new RetrievalException("向量检索失败: " + e.getMessage(), e);
        }
    }

    private List<ScoredRecord> toScored(SearchResponse<IndexRecord> response, boolean cosineSimilarity) {
        List<ScoredRecord> results = new ArrayList<>();
        for (Hit<IndexRecord> hit : response.hits().hits()) {
            if (hit.source() == null || hit.score() == null) {
                continue;
            }
            double score = hit.score();
            // cosine 相似度在 ES 中的得分为 (1 + cos) / 2，还原为余弦值
            if (cosineSimilarity) {
                score = 2 * score - 1;
            }
            results.add(new ScoredRecord(hit.source(), score));
        }
        return results;
    }

    private List<Query> filterQueries(SearchFilters filters) {
        List<Query> queries = new ArrayList<>();
        if (filters == null) {
            return queries;
        }
        if (filters.hasDocumentIds()) {
            List<FieldValue> ids = filters.getDocumentIds().stream().map(FieldValue::of).toList();
            queries.add(Query.of(q -> q.terms(t -> t.field("documentId").terms(tv -> tv.value(ids)))));
        }
        if (filters.hasTags()) {
            List<FieldValue> tags = filters.getTags().stream().map(StructuralTag::name).map(FieldValue::of).toList();
            queries.add(Query.of(q -> q.terms(t -> t.field("tag").terms(tv -> tv.value(tags)))));
        }
        if (filters.getActiveVersions() != null) {
            List<FieldValue> keys = filters.getActiveVersions().entrySet().stream()
                    .map(e -> IndexRecord.versionKey(e.getKey(), e.getValue()))
                    .map(FieldValue::of)
                    .toList();
            queries.add(Query.of(q -> q.terms(t -> t.field("versionKey").terms(tv -> tv.value(keys)))));
        }
        return queries;
    }

    private Query versionQuery(String documentId, long version) {
        return Query.of(q -> q.bool(b -> b
                .filter(f -> f.term(t -> t.field("documentId").value(documentId)))
                .filter(f -> f.term(t -> t.field("version").value(version)))));
    }

    private void deleteByQuery(Query query) {
        try {
            esClient.deleteByQuery(DeleteByQueryRequest.of(d -> d.index(indexName).query(query).refresh(true)));
        } catch (IOException e) {
            throw new RetrievalException("删除索引记录失败: " + e.getMessage(), e);
        }
    }
}
