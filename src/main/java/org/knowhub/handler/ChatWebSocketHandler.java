package org.knowhub.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.knowhub.DTO.ChatResponse;
import org.knowhub.exception.CustomException;
import org.knowhub.exception.EmbeddingException;
import org.knowhub.exception.GenerationException;
import org.knowhub.exception.GlobalExceptionHandler;
import org.knowhub.exception.RetrievalException;
import org.knowhub.service.RagService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 流式问答的 WebSocket 入口，路径为 /chat/{conversationId}。
 * <p>
 * 客户端发送纯文本或 {"question": "..."}；发送 {"type": "stop"} 或断开连接会停止生成。
 * 服务端依次推送 {"type":"chunk"}、{"type":"completion"}，失败时推送 {"type":"error"}。
 */
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(ChatWebSocketHandler.class);

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final RagService ragService;
    private final ObjectMapper objectMapper;
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, Disposable> activeResponses = new ConcurrentHashMap<>();

    public ChatWebSocketHandler(RagService ragService, ObjectMapper objectMapper) {
        this.ragService = ragService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        // 流式输出在其它线程发送，需要线程安全的 session
        sessions.put(session.getId(), new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
        logger.info("WebSocket连接已建立，会话ID: {}，对话ID: {}", session.getId(), extractConversationId(session));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebSocketSession target = sessions.getOrDefault(session.getId(), session);
        String conversationId = extractConversationId(session);
        String payload = message.getPayload();
        String question = payload;
        Integer topK = null;

        if (payload.trim().startsWith("{")) {
            try {
                JsonNode json = objectMapper.readTree(payload);
                if ("stop".equals(json.path("type").asText())) {
                    stopResponse(session.getId());
                    send(target, Map.of("type", "stop", "message", "已停止生成"));
                    return;
                }
                if (json.hasNonNull("question")) {
                    question = json.get("question").asText();
                }
                if (json.hasNonNull("topK")) {
                    topK = json.get("topK").asInt();
                }
            } catch (IOException e) {
                // 不是合法 JSON，当作普通问题
                logger.debug("消息不是JSON，按纯文本处理: {}", e.getMessage());
            }
        }

        if (activeResponses.containsKey(session.getId())) {
            send(target, errorPayload("上一个回答尚未结束"));
            return;
        }

        final String q = question;
        final Integer k = topK;
        Disposable response = Flux.defer(() -> ragService.streamAsk(conversationId, q, k,
                        completed -> send(target, completionPayload(completed))))
                .subscribeOn(Schedulers.boundedElastic())
                .doFinally(signal -> activeResponses.remove(session.getId()))
                .subscribe(
                        token -> send(target, Map.of("type", "chunk", "content", token)),
                        error -> {
                            logger.error("流式回答失败，对话ID: {}，错误: {}", conversationId, error.getMessage(), error);
                            send(target, errorPayload(userMessage(error)));
                        });
        activeResponses.put(session.getId(), response);
        // 订阅可能在 put 之前就已经结束
        if (response.isDisposed()) {
            activeResponses.remove(session.getId(), response);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        stopResponse(session.getId());
        sessions.remove(session.getId());
        logger.info("WebSocket连接已关闭，会话ID: {}，状态: {}", session.getId(), status);
    }

    private void stopResponse(String sessionId) {
        Disposable response = activeResponses.remove(sessionId);
        if (response != null && !response.isDisposed()) {
            response.dispose();
            logger.info("已停止会话 {} 的回答生成", sessionId);
        }
    }

    private String extractConversationId(WebSocketSession session) {
        String path = session.getUri() != null ? session.getUri().getPath() : "";
        String[] segments = path.split("/");
        return segments.length > 0 ? segments[segments.length - 1] : "";
    }

    private Map<String, Object> completionPayload(ChatResponse response) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("type", "completion");
        payload.put("conversationId", response.getConversationId());
        payload.put("turnId", response.getTurnId());
        payload.put("citations", response.getCitations());
        payload.put("grounded", response.isGrounded());
        return payload;
    }

    private Map<String, Object> errorPayload(String message) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("type", "error");
        payload.put("error", message);
        return payload;
    }

    private String userMessage(Throwable error) {
        if (error instanceof RetrievalException || error instanceof GenerationException
                || error instanceof EmbeddingException) {
            return GlobalExceptionHandler.UNAVAILABLE_MESSAGE;
        }
        if (error instanceof CustomException || error instanceof IllegalArgumentException) {
            return error.getMessage();
        }
        return "消息处理失败";
    }

    private void send(WebSocketSession session, Map<String, ?> payload) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(payload)));
        } catch (IOException e) {
            logger.error("发送WebSocket消息失败，会话ID: {}，错误: {}", session.getId(), e.getMessage(), e);
        }
    }
}
