package org.knowhub.DTO;

import lombok.Builder;
import lombok.Value;

/**
 * 文档切分后的连续文本片段。text 恒等于原文 [startOffset, endOffset) 区间的内容。
 */
@Value
@Builder(toBuilder = true)
public class Chunk {
    String documentId;
    int sequenceIndex;      // 从 0 开始连续编号
    String text;
    int startOffset;
    int endOffset;          // 不含
    StructuralTag tag;
    float[] embedding;      // 向量化前为 null

    public String getChunkId() {
        return chunkId(documentId, sequenceIndex);
    }

    public static String chunkId(String documentId, int sequenceIndex) {
        return documentId + ":" + sequenceIndex;
    }
}
