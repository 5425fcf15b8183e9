package org.knowhub.DTO;

import lombok.Data;
import org.knowhub.entity.FeedbackKind;

@Data
public class FeedbackRequest {
    private String turnRef;
    private String author;
    private FeedbackKind kind;
    private String comment;
    private String conversationId;
}
