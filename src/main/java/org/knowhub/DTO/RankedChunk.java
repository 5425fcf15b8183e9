package org.knowhub.DTO;

import lombok.AllArgsConstructor;
import lombok.Getter;

// 按检索排名传给 PromptBuilder 的分块，rank 从 1 开始
@Getter
@AllArgsConstructor
public class RankedChunk {
    private final int rank;
    private final SearchResult result;
}
