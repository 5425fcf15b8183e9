package org.knowhub.repository;

import org.knowhub.DTO.Conversation;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 单机部署或测试用的会话存储，进程重启后丢失。
 */
@Repository
@ConditionalOnProperty(name = "rag.conversation.store", havingValue = "memory")
public class InMemoryConversationStore implements ConversationStore {

    private final Map<String, Conversation> conversations = new ConcurrentHashMap<>();
    private final List<Conversation> archived = new CopyOnWriteArrayList<>();

    @Override
    public Optional<Conversation> load(String conversationId) {
        return Optional.ofNullable(conversations.get(conversationId)).map(this::copy);
    }

    @Override
    public void save(Conversation conversation) {
        conversations.put(conversation.getId(), copy(conversation));
    }

    @Override
    public void archive(Conversation conversation) {
        archived.add(copy(conversation));
    }

    public List<Conversation> archived() {
        return new ArrayList<>(archived);
    }

    // 与 Redis 实现保持一致：读出的对象与存储内容互不影响
    private Conversation copy(Conversation source) {
        return Conversation.builder()
                .id(source.getId())
                .turns(new ArrayList<>(source.getTurns()))
                .createdAt(source.getCreatedAt())
                .lastActivityAt(source.getLastActivityAt())
                .build();
    }
}
