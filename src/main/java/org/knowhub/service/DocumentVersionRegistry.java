package org.knowhub.service;

import jakarta.annotation.PostConstruct;
import org.knowhub.entity.KnowledgeDocument;
import org.knowhub.repository.KnowledgeDocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * 记录每个文档当前对检索可见的版本。
 * <p>
 * 检索在读锁内完成"读版本表 + 查后端 + 按版本过滤"，版本切换持写锁。
 * 因此一次检索看到的要么全是旧版本，要么全是新版本；旧版本记录只在切换完成后才删除。
 */
@Component
public class DocumentVersionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(DocumentVersionRegistry.class);

    private final Map<String, Long> activeVersions = new ConcurrentHashMap<>();
    // 公平锁，避免持续的检索请求饿死版本切换
    private final ReentrantReadWriteLock switchLock = new ReentrantReadWriteLock(true);
    private final KnowledgeDocumentRepository documentRepository;

    public DocumentVersionRegistry(KnowledgeDocumentRepository documentRepository) {
        this.documentRepository = documentRepository;
    }

    @PostConstruct
    public void load() {
        for (KnowledgeDocument document : documentRepository.findByActiveVersionIsNotNull()) {
            activeVersions.put(document.getId(), document.getActiveVersion());
        }
        logger.info("已加载文档有效版本 {} 条", activeVersions.size());
    }

    public Long activeVersion(String documentId) {
        return activeVersions.get(documentId);
    }

    public boolean isActive(String documentId, long version) {
        Long active = activeVersions.get(documentId);
        return active != null && active == version;
    }

    public void activate(String documentId, long version) {
        switchLock.writeLock().lock();
        try {
            Long previous = activeVersions.put(documentId, version);
            logger.info("文档 {} 有效版本切换: v{} -> v{}", documentId, previous, version);
        } finally {
            switchLock.writeLock().unlock();
        }
    }

    public void deactivate(String documentId) {
        switchLock.writeLock().lock();
        try {
            activeVersions.remove(documentId);
        } finally {
            switchLock.writeLock().unlock();
        }
    }

    /**
     * 在版本表不变的前提下执行 reader，传入的是只读视图
     */
    public <T> T readConsistent(Function<Map<String, Long>, T> reader) {
        switchLock.readLock().lock();
        try {
            return reader.apply(Collections.unmodifiableMap(activeVersions));
        } finally {
            switchLock.readLock().unlock();
        }
    }
}
