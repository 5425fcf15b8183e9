package org.knowhub.service;

import org.knowhub.DTO.IndexRecord;
import org.knowhub.DTO.ScoredRecord;
import org.knowhub.DTO.SearchFilters;

import java.util.List;

/**
 * 检索后端抽象：同时提供关键词检索和向量检索。
 * 过滤条件（含 activeVersions）必须在截取前 k 条之前生效。
 */
public interface SearchBackend {

    /**
     * 按记录 id 覆盖写入，写入完成后对检索立即可见
     */
    void upsert(List<IndexRecord> records);

    void deleteDocument(String documentId);

    void deleteVersion(String documentId, long version);

    void deleteVersionsExcept(String documentId, long keepVersion);

    long count(String documentId, long version);

    /**
     * BM25 风格关键词检索，得分越高越相关，未命中的记录不返回
     */
    List<ScoredRecord> lexicalSearch(List<String> terms, SearchFilters filters, int k);

    /**
     * 向量检索，得分为余弦相似度
     */
    List<ScoredRecord> vectorSearch(float[] vector, SearchFilters filters, int k);
}
