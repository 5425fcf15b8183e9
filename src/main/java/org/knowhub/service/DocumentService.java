package org.knowhub.service;

import org.knowhub.entity.DocumentStatus;
import org.knowhub.entity.KnowledgeDocument;
import org.knowhub.entity.SourceType;
import org.knowhub.exception.CustomException;
import org.knowhub.repository.DocumentStore;
import org.knowhub.repository.KnowledgeDocumentRepository;
import org.knowhub.utils.LogUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

/**
 * 文档管理：上传新版本、重新入库、删除。
 */
@Service
public class DocumentService {

    private static final Logger logger = LoggerFactory.getLogger(DocumentService.class);

    private final KnowledgeDocumentRepository documentRepository;
    private final DocumentStore documentStore;
    private final IngestionService ingestionService;
    private final IndexWriterService indexWriterService;

    public DocumentService(KnowledgeDocumentRepository documentRepository,
                           DocumentStore documentStore,
                           IngestionService ingestionService,
                           IndexWriterService indexWriterService) {
        this.documentRepository = documentRepository;
        this.documentStore = documentStore;
        this.ingestionService = ingestionService;
        this.indexWriterService = indexWriterService;
    }

    public KnowledgeDocument upload(String documentId, MultipartFile file) {
        try {
            return upload(documentId, file.getOriginalFilename(), file.getContentType(), file.getBytes());
        } catch (IOException e) {
            throw new CustomException("读取上传文件失败: " + e.getMessage(), HttpStatus.BAD_REQUEST, e);
        }
    }

    /**
     * 上传文档。已有 documentId 时作为新版本，内容未变且已入库时不重复处理。
     * 入库在后台进行。
     */
    public KnowledgeDocument upload(String documentId, String fileName, String contentType, byte[] content) {
        if (content == null || content.length == 0) {
            throw new IllegalArgumentException("文件内容不能为空");
        }
        SourceType sourceType = SourceType.detect(fileName, contentType);
        String md5 = DigestUtils.md5DigestAsHex(content);
        String id = documentId == null || documentId.isBlank()
                ? UUID.randomUUID().toString().replace("-", "")
                : documentId;

        KnowledgeDocument document = documentRepository.findById(id).orElseGet(() -> {
            KnowledgeDocument created = new KnowledgeDocument();
            created.setId(id);
            return created;
        });
        if (md5.equals(document.getContentMd5()) && document.getStatus() == DocumentStatus.INDEXED) {
            logger.info("文档 {} 内容未变化，跳过入库", id);
            return document;
        }

        long version = document.getLatestVersion() + 1;
        String storageKey = id + "/v" + version + "/" + fileName;
        documentStore.store(storageKey, content, contentType);

        document.setFileName(fileName);
        document.setSourceType(sourceType);
        document.setContentType(contentType);
        document.setContentMd5(md5);
        document.setStorageKey(storageKey);
        document.setLatestVersion(version);
        document.setStatus(DocumentStatus.PENDING);
        document.setErrorMessage(null);
        KnowledgeDocument saved = documentRepository.save(document);
        LogUtils.logIngestion(id, version, "UPLOAD", fileName + ", " + content.length + " bytes");

        ingestionService.ingestAsync(id, version);
        return saved;
    }

    /**
     * 以新版本号重新入库当前内容
     */
    public KnowledgeDocument reindex(String documentId) {
        KnowledgeDocument document = get(documentId);
        if (indexWriterService.isHalted(documentId)) {
            throw new CustomException("文档 " + documentId + " 处于挂起状态，请先解除挂起", HttpStatus.CONFLICT);
        }
        long version = document.getLatestVersion() + 1;
        document.setLatestVersion(version);
        document.setStatus(DocumentStatus.PENDING);
        document.setErrorMessage(null);
        KnowledgeDocument saved = documentRepository.save(document);
        ingestionService.ingestAsync(documentId, version);
        return saved;
    }

    /**
     * 人工确认索引一致性问题已处理后解除挂起，并重新入库
     */
    public KnowledgeDocument resolveHalt(String documentId) {
        get(documentId);
        indexWriterService.resolveHalt(documentId);
        return reindex(documentId);
    }

    public void delete(String documentId) {
        KnowledgeDocument document = get(documentId);
        indexWriterService.deleteDocument(documentId);
        for (long v = 1; v <= document.getLatestVersion(); v++) {
            documentStore.remove(documentId + "/v" + v + "/" + document.getFileName());
        }
        documentRepository.delete(document);
        logger.info("文档 {} 已删除", documentId);
    }

    public KnowledgeDocument get(String documentId) {
        return documentRepository.findById(documentId)
                .orElseThrow(() -> new CustomException("文档不存在: " + documentId, HttpStatus.NOT_FOUND));
    }

    public List<KnowledgeDocument> list() {
        return documentRepository.findAll();
    }
}
