package org.knowhub.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 聊天平台推送的表情回应事件。
 * type 为 reaction_added / reaction_removed，turnRef 为被回应的回答标识。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReactionEvent {
    private String type;
    private String reaction;
    private String user;
    private String turnRef;
    private String conversationId;
}
