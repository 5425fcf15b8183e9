package org.knowhub.repository;

import org.knowhub.DTO.Conversation;

import java.util.Optional;

/**
 * 会话持久化。调用方负责按会话加锁，实现本身只保证单次读写的原子性。
 */
public interface ConversationStore {

    Optional<Conversation> load(String conversationId);

    void save(Conversation conversation);

    /**
     * 过期会话被新历史替换前留档
     */
    void archive(Conversation conversation);
}
