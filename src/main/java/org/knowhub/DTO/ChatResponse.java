package org.knowhub.DTO;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {
    private String conversationId;
    private String turnId;
    private String question;
    private String resolvedQuestion;
    private String answer;
    private List<Citation> citations;
    private boolean grounded;
}
