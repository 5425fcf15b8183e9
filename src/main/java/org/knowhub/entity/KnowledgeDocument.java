package org.knowhub.entity;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

// 知识库文档，对应数据库中的 'knowledge_document' 表
@Data
@Entity
@Table(name = "knowledge_document")
public class KnowledgeDocument {

    @Id
    @Column(length = 64)
    private String id;

    private String fileName;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private SourceType sourceType;

    @Column(name = "content_type", length = 128)
    private String contentType;

    // 最新一次上传内容的 MD5
    @Column(name = "content_md5", length = 32, nullable = false)
    private String contentMd5;

    // 对象存储中的 key
    @Column(name = "storage_key", length = 512, nullable = false)
    private String storageKey;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private DocumentStatus status = DocumentStatus.PENDING;

    // 最近一次上传分配的版本号，每次重新上传加一
    private long latestVersion;

    // 当前对检索可见的版本，从未成功入库时为 null
    private Long activeVersion;

    private int chunkCount;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
