package org.knowhub.controller;

import org.knowhub.DTO.ChatRequest;
import org.knowhub.DTO.ChatResponse;
import org.knowhub.annotation.LogAction;
import org.knowhub.service.RagService;
import org.knowhub.utils.Result;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 非流式问答接口，流式问答走 WebSocket /chat/{conversationId}
 */
@RestController
@RequestMapping("/api/v1/chat")
public class ChatController {

    @Autowired
    private RagService ragService;

    @PostMapping
    @LogAction(value = "ChatController", action = "ask")
    public ResponseEntity<?> ask(@RequestBody ChatRequest request) {
        ChatResponse response = ragService.ask(request.getConversationId(), request.getQuestion(), request.getTopK());
        return ResponseEntity.ok(Result.success(response));
    }
}
