package org.knowhub.service;

import org.knowhub.DTO.Chunk;
import org.knowhub.DTO.EmbeddingBatchResult;
import org.knowhub.DTO.IndexWriteResult;
import org.knowhub.DTO.StoredDocument;
import org.knowhub.config.RagProperties;
import org.knowhub.entity.DocumentStatus;
import org.knowhub.entity.KnowledgeDocument;
import org.knowhub.exception.CustomException;
import org.knowhub.exception.EmbeddingException;
import org.knowhub.exception.IndexConsistencyException;
import org.knowhub.repository.DocumentStore;
import org.knowhub.repository.KnowledgeDocumentRepository;
import org.knowhub.utils.LogUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 文档入库流水线：读取原文 → 解析 → 切分 → 向量化 → 写索引。
 * 任一步失败则整个版本失败，之前的有效版本保持可检索。
 */
@Service
public class IngestionService {

    private static final Logger logger = LoggerFactory.getLogger(IngestionService.class);

    private final KnowledgeDocumentRepository documentRepository;
    private final DocumentStore documentStore;
    private final ParseService parseService;
    private final ChunkingService chunkingService;
    private final EmbeddingService embeddingService;
    private final IndexWriterService indexWriterService;
    private final RagProperties ragProperties;

    public IngestionService(KnowledgeDocumentRepository documentRepository,
                            DocumentStore documentStore,
                            ParseService parseService,
                            ChunkingService chunkingService,
                            EmbeddingService embeddingService,
                            IndexWriterService indexWriterService,
                            RagProperties ragProperties) {
        this.documentRepository = documentRepository;
        this.documentStore = documentStore;
        this.parseService = parseService;
        this.chunkingService = chunkingService;
        this.embeddingService = embeddingService;
        this.indexWriterService = indexWriterService;
        this.ragProperties = ragProperties;
    }

    /**
     * 后台入库，结果体现在文档状态上
     */
    @Async
    public void ingestAsync(String documentId, long version) {
        try {
            ingest(documentId, version);
        } catch (Exception e) {
            logger.error("文档 {} v{} 后台入库失败: {}", documentId, version, e.getMessage(), e);
        }
    }

    /**
     * 同步入库指定版本。版本已不是最新上传时直接跳过，返回 null。
     */
    public IndexWriteResult ingest(String documentId, long version) {
        KnowledgeDocument document = documentRepository.findById(documentId)
                .orElseThrow(() -> new CustomException("文档不存在: " + documentId, HttpStatus.NOT_FOUND));
        if (version != document.getLatestVersion()) {
            logger.info("文档 {} v{} 已被 v{} 取代，跳过入库", documentId, version, document.getLatestVersion());
            return null;
        }

        LogUtils.PerformanceMonitor monitor = LogUtils.startPerformanceMonitor("INGEST_DOCUMENT");
        try {
            StoredDocument stored = documentStore.fetch(document.getStorageKey());
            String text = parseService.extractText(stored.getContent(), document.getSourceType());
            LogUtils.logIngestion(documentId, version, "PARSE", "提取 " + text.length() + " 字符");

            List<Chunk> chunks = chunkingService.chunk(documentId, text, document.getSourceType());
            LogUtils.logIngestion(documentId, version, "CHUNK", "切分 " + chunks.size() + " 块");
            updateStatus(documentId, DocumentStatus.PARSED, null);

            List<Chunk> embedded = embedAll(documentId, chunks);
            LogUtils.logIngestion(documentId, version, "EMBED", "向量化 " + embedded.size() + " 块");

            IndexWriteResult result = indexWriterService.upsert(documentId, version, embedded, document.getFileName());

            KnowledgeDocument latest = reload(documentId);
            latest.setActiveVersion(version);
            latest.setChunkCount(result.getCommitted());
            // 入库期间又有新上传时，状态留给新版本的入库去更新
            if (latest.getLatestVersion() == version) {
                latest.setStatus(DocumentStatus.INDEXED);
                latest.setErrorMessage(null);
            }
            documentRepository.save(latest);
            monitor.end("入库成功: " + documentId + " v" + version);
            return result;
        } catch (IndexConsistencyException e) {
            updateStatus(documentId, DocumentStatus.HALTED, e.getMessage());
            LogUtils.logIngestion(documentId, version, "HALT", e.getMessage());
            monitor.end("入库挂起: " + e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            updateStatus(documentId, DocumentStatus.FAILED, e.getMessage());
            LogUtils.logIngestion(documentId, version, "FAILED", e.getMessage());
            monitor.end("入库失败: " + e.getMessage());
            throw e;
        }
    }

    /**
     * 向量化全部分块，失败的条目按配置次数重试；仍有失败则整个版本失败
     */
    List<Chunk> embedAll(String documentId, List<Chunk> chunks) {
        List<String> texts = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            texts.add(chunk.getText());
        }
        EmbeddingBatchResult result = embeddingService.embedBatch(texts);

        int retries = ragProperties.getIngestion().getEmbeddingRetries();
        for (int attempt = 1; attempt <= retries && !result.isComplete(); attempt++) {
            List<Integer> failed = result.failedIndices();
            logger.warn("文档 {} 有 {} 个分块向量化失败，第 {} 次重试", documentId, failed.size(), attempt);
            List<String> retryTexts = new ArrayList<>(failed.size());
            for (int index : failed) {
                retryTexts.add(texts.get(index));
            }
            EmbeddingBatchResult retry = embeddingService.embedBatch(retryTexts);
            for (int i = 0; i < failed.size(); i++) {
                float[] vector = retry.vectorAt(i);
                if (vector != null) {
                    result.success(failed.get(i), vector);
                } else {
                    result.failure(failed.get(i), retry.getFailures().get(i));
                }
            }
        }

        if (!result.isComplete()) {
            throw new EmbeddingException("文档 " + documentId + " 有 " + result.failedIndices().size()
                    + " 个分块向量化失败: " + result.getFailures());
        }
        List<Chunk> embedded = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            embedded.add(chunks.get(i).toBuilder().embedding(result.vectorAt(i)).build());
        }
        return embedded;
    }

    private void updateStatus(String documentId, DocumentStatus status, String errorMessage) {
        documentRepository.findById(documentId).ifPresent(document -> {
            document.setStatus(status);
            document.setErrorMessage(errorMessage);
            documentRepository.save(document);
        });
    }

    private KnowledgeDocument reload(String documentId) {
        return documentRepository.findById(documentId)
                .orElseThrow(() -> new CustomException("文档入库期间被删除: " + documentId, HttpStatus.CONFLICT));
    }
}
