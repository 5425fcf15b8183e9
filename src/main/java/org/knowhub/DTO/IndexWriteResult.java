package org.knowhub.DTO;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

// 单次写索引的结果
@Getter
@ToString
@AllArgsConstructor
public class IndexWriteResult {
    private final String documentId;
    private final long version;
    private final int committed;
    /** 未写入的分块：chunkId -> 原因 */
    private final Map<String, String> excluded;
}
