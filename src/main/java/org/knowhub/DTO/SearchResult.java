package org.knowhub.DTO;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

// 检索结果
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResult {
    private String chunkId;
    private String documentId;
    private long version;
    private int sequenceIndex;
    private String textContent;
    private String tag;
    private String fileName;
    private double score;          // 融合后得分
    private double lexicalScore;   // 归一化后的关键词得分
    private double vectorScore;    // 余弦相似度
}
