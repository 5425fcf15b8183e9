package org.knowhub.entity;

public enum DocumentStatus {
    PENDING,   // 已上传，等待入库
    PARSED,    // 已切分，正在向量化/写索引
    INDEXED,   // 当前版本可检索
    FAILED,    // 本版本入库失败，旧版本（如有）仍然有效
    HALTED     // 索引一致性异常，等待人工处理
}
