package org.knowhub.DTO;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

// 后端返回的原始命中及得分
@Getter
@ToString
@AllArgsConstructor
public class ScoredRecord {
    private final IndexRecord record;
    private final double score;
}
