package org.knowhub.repository;

import org.knowhub.DTO.StoredDocument;

/**
 * 原始文档内容的存取。
 */
public interface DocumentStore {

    void store(String key, byte[] content, String contentType);

    StoredDocument fetch(String key);

    void remove(String key);
}
