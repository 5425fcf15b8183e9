package org.knowhub.DTO;

import lombok.AllArgsConstructor;
import lombok.Getter;

// 对象存储中取回的原始文档
@Getter
@AllArgsConstructor
public class StoredDocument {
    private final byte[] content;
    private final String contentType;
}
