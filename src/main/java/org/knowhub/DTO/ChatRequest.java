package org.knowhub.DTO;

import lombok.Data;

@Data
public class ChatRequest {
    private String conversationId;   // 为空时新建会话
    private String question;
    private Integer topK;
}
