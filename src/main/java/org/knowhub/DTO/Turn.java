package org.knowhub.DTO;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * 一轮问答。turnId 同时作为回答的标识，反馈通过它关联到本轮。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Turn {
    private String turnId;
    private String question;
    private String resolvedQuestion;
    private List<String> retrievedChunkIds;
    private String answer;
    private List<Citation> citations;
    private Instant timestamp;
}
