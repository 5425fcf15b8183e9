package org.knowhub.repository;

import org.knowhub.DTO.Conversation;
import org.knowhub.config.RagProperties;
import org.knowhub.exception.CustomException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.SerializationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@ConditionalOnProperty(name = "rag.conversation.store", havingValue = "redis", matchIfMissing = true)
public class RedisConversationStore implements ConversationStore {

    private static final String KEY_PREFIX = "conversation:";

    private final RedisTemplate<String, Conversation> redisTemplate;
    private final RagProperties ragProperties;

    public RedisConversationStore(RedisTemplate<String, Conversation> redisTemplate, RagProperties ragProperties) {
        this.redisTemplate = redisTemplate;
        this.ragProperties = ragProperties;
    }

    @Override
    public Optional<Conversation> load(String conversationId) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(KEY_PREFIX + conversationId));
        } catch (SerializationException e) {
            throw new CustomException("会话数据解析失败: " + conversationId, HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    @Override
    public void save(Conversation conversation) {
        write(KEY_PREFIX + conversation.getId(), conversation);
    }

    @Override
    public void archive(Conversation conversation) {
        long stamp = conversation.getLastActivityAt() != null
                ? conversation.getLastActivityAt().toEpochMilli()
                : System.currentTimeMillis();
        write(KEY_PREFIX + conversation.getId() + ":archive:" + stamp, conversation);
    }

    private void write(String key, Conversation conversation) {
        try {
            redisTemplate.opsForValue().set(key, conversation, ragProperties.getConversation().getRetention());
        } catch (SerializationException e) {
            throw new CustomException("会话数据序列化失败: " + conversation.getId(), HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }
}
