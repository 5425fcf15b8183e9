package org.knowhub.service;

import org.knowhub.DTO.Chunk;
import org.knowhub.DTO.IndexRecord;
import org.knowhub.DTO.IndexWriteResult;
import org.knowhub.config.RagProperties;
import org.knowhub.exception.CustomException;
import org.knowhub.exception.IndexConsistencyException;
import org.knowhub.exception.RetrievalException;
import org.knowhub.utils.LogUtils;
import org.knowhub.utils.RetryUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 把带向量的分块写入检索后端。
 * <p>
 * 写入顺序：新版本记录 → 核对数量 → 切换有效版本 → 删除旧版本记录。
 * 同一文档的提交串行执行，低于当前有效版本的提交直接拒绝。
 */
@Service
public class IndexWriterService {

    private static final Logger logger = LoggerFactory.getLogger(IndexWriterService.class);
    private static final int LOCK_STRIPES = 64;

    private final SearchBackend searchBackend;
    private final DocumentVersionRegistry versionRegistry;
    private final RagProperties ragProperties;
    private final int dimension;
    private final String modelVersion;

    // 按文档 id 分段加锁，不同文档落到同一段时串行写入
    private final ReentrantLock[] documentLocks = new ReentrantLock[LOCK_STRIPES];
    private final Set<String> haltedDocuments = ConcurrentHashMap.newKeySet();

    public IndexWriterService(SearchBackend searchBackend,
                              DocumentVersionRegistry versionRegistry,
                              RagProperties ragProperties,
                              @Value("${embedding.api.dimension:1024}") int dimension,
                              @Value("${embedding.api.model:unknown}") String modelVersion) {
        this.searchBackend = searchBackend;
        this.versionRegistry = versionRegistry;
        this.ragProperties = ragProperties;
        this.dimension = dimension;
        this.modelVersion = modelVersion;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            documentLocks[i] = new ReentrantLock();
        }
    }

    public IndexWriteResult upsert(String documentId, long version, List<Chunk> chunks) {
        return upsert(documentId, version, chunks, null);
    }

    /**
     * 写入一个文档版本的全部分块。缺少向量或维度不符的分块不会写入，而是在结果中列出。
     *
     * @throws IndexConsistencyException 文档已挂起，或写入后数量核对失败（同时挂起文档）
     * @throws CustomException           版本号低于当前有效版本
     */
    public IndexWriteResult upsert(String documentId, long version, List<Chunk> chunks, String fileName) {
        ReentrantLock lock = lockFor(documentId);
        lock.lock();
        try {
            checkNotHalted(documentId);
            Long active = versionRegistry.activeVersion(documentId);
            if (active != null && version < active) {
                throw new CustomException("文档 " + documentId + " 的版本 v" + version
                        + " 早于当前有效版本 v" + active + "，拒绝写入", HttpStatus.CONFLICT);
            }

            Map<String, String> excluded = new LinkedHashMap<>();
            List<IndexRecord> records = new ArrayList<>();
            for (Chunk chunk : chunks) {
                if (!documentId.equals(chunk.getDocumentId())) {
                    throw new IllegalArgumentException("分块 " + chunk.getChunkId() + " 不属于文档 " + documentId);
                }
                float[] vector = chunk.getEmbedding();
                if (vector == null) {
                    excluded.put(chunk.getChunkId(), "缺少向量");
                } else if (vector.length != dimension) {
                    excluded.put(chunk.getChunkId(), "向量维度错误: " + vector.length);
                } else {
                    records.add(toRecord(chunk, version, fileName));
                }
            }
            if (!excluded.isEmpty()) {
                logger.warn("文档 {} v{} 有 {} 个分块未写入: {}", documentId, version, excluded.size(), excluded.keySet());
            }
            if (records.isEmpty()) {
                return new IndexWriteResult(documentId, version, 0, excluded);
            }
            guardNoNullVectors(documentId, records);

            RagProperties.Backend policy = ragProperties.getBackend();
            boolean alreadyActive = active != null && active == version;
            if (!alreadyActive) {
                // 清掉同版本上次失败留下的残余记录
                RetryUtils.runWithRetry("清理未完成版本", policy, () -> searchBackend.deleteVersion(documentId, version));
            }
            RetryUtils.runWithRetry("写入索引", policy, () -> searchBackend.upsert(records));

            Long stored = RetryUtils.callWithRetry("核对索引", policy, () -> searchBackend.count(documentId, version));
            if (stored == null || stored != records.size()) {
                String reason = "文档 " + documentId + " v" + version + " 写入 " + records.size() + " 条，后端实际 " + stored + " 条";
                halt(documentId, reason);
                throw new IndexConsistencyException(documentId, reason);
            }

            versionRegistry.activate(documentId, version);
            if (!alreadyActive) {
                removeStaleVersions(documentId, version);
            }
            LogUtils.logIngestion(documentId, version, "INDEX", "写入 " + records.size() + " 条");
            return new IndexWriteResult(documentId, version, records.size(), excluded);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 删除文档的全部索引记录，同时解除挂起状态
     */
    public void deleteDocument(String documentId) {
        ReentrantLock lock = lockFor(documentId);
        lock.lock();
        try {
            versionRegistry.deactivate(documentId);
            RetryUtils.runWithRetry("删除文档索引", ragProperties.getBackend(), () -> searchBackend.deleteDocument(documentId));
            haltedDocuments.remove(documentId);
            logger.info("文档 {} 的索引记录已删除", documentId);
        } finally {
            lock.unlock();
        }
    }

    public boolean isHalted(String documentId) {
        return haltedDocuments.contains(documentId);
    }

    public void resolveHalt(String documentId) {
        if (haltedDocuments.remove(documentId)) {
            logger.info("文档 {} 已解除挂起", documentId);
        }
    }

    private void halt(String documentId, String reason) {
        haltedDocuments.add(documentId);
        LogUtils.logSystemError("IndexWriterService", "文档挂起: " + reason, null);
    }

    private void checkNotHalted(String documentId) {
        if (haltedDocuments.contains(documentId)) {
            throw new IndexConsistencyException(documentId, "文档 " + documentId + " 处于挂起状态，需先处理索引一致性问题");
        }
    }

    private void guardNoNullVectors(String documentId, List<IndexRecord> records) {
        for (IndexRecord record : records) {
            if (record.getVector() == null) {
                halt(documentId, "记录 " + record.getId() + " 向量为空");
                throw new IndexConsistencyException(documentId, "记录 " + record.getId() + " 向量为空，拒绝写入");
            }
        }
    }

    private void removeStaleVersions(String documentId, long version) {
        try {
            RetryUtils.runWithRetry("清理旧版本", ragProperties.getBackend(),
                    () -> searchBackend.deleteVersionsExcept(documentId, version));
        } catch (RetrievalException e) {
            // 旧版本已对检索不可见，下次写入该文档时会再次清理
            logger.warn("文档 {} 旧版本清理失败: {}", documentId, e.getMessage());
        }
    }

    private ReentrantLock lockFor(String documentId) {
        return documentLocks[Math.floorMod(documentId.hashCode(), LOCK_STRIPES)];
    }

    private IndexRecord toRecord(Chunk chunk, long version, String fileName) {
        return IndexRecord.builder()
                .id(IndexRecord.recordId(chunk.getDocumentId(), version, chunk.getSequenceIndex()))
                .documentId(chunk.getDocumentId())
                .version(version)
                .versionKey(IndexRecord.versionKey(chunk.getDocumentId(), version))
                .chunkId(chunk.getChunkId())
                .sequenceIndex(chunk.getSequenceIndex())
                .textContent(chunk.getText())
                .vector(chunk.getEmbedding())
                .tag(chunk.getTag() != null ? chunk.getTag().name() : null)
                .startOffset(chunk.getStartOffset())
                .endOffset(chunk.getEndOffset())
                .fileName(fileName)
                .modelVersion(modelVersion)
                .build();
    }
}
