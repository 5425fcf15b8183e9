package org.knowhub.controller;

import org.knowhub.DTO.Conversation;
import org.knowhub.service.ConversationService;
import org.knowhub.utils.Result;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/conversations")
public class ConversationController {

    @Autowired
    private ConversationService conversationService;

    /**
     * 查询会话历史及状态（EMPTY / ACTIVE / EXPIRED）
     */
    @GetMapping("/{conversationId}")
    public ResponseEntity<?> get(@PathVariable String conversationId) {
        Conversation conversation = conversationService.load(conversationId);
        Map<String, Object> data = new HashMap<>();
        data.put("conversation", conversation);
        data.put("state", conversationService.state(conversation));
        return ResponseEntity.ok(Result.success(data));
    }
}
