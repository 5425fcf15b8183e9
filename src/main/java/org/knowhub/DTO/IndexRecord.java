package org.knowhub.DTO;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 写入检索后端的分块记录（ES 文档结构）。
 */
@Data
@Builder
@NoArgsConstructor  // Jackson 反序列化
@AllArgsConstructor
public class IndexRecord {

    private String id;             // {documentId}_v{version}_{sequenceIndex}
    private String documentId;
    private long version;
    private String versionKey;     // {documentId}_v{version}，检索时按有效版本过滤
    private String chunkId;
    private int sequenceIndex;
    private String textContent;
    private float[] vector;
    private String tag;
    private int startOffset;
    private int endOffset;
    private String fileName;
    private String modelVersion;

    public static String recordId(String documentId, long version, int sequenceIndex) {
        return versionKey(documentId, version) + "_" + sequenceIndex;
    }

    public static String versionKey(String documentId, long version) {
        return documentId + "_v" + version;
    }
}
