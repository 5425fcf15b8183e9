package org.knowhub.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.knowhub.DTO.Conversation;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

@Configuration
public class RedisConfig {

    /**
     * 会话存储用的模板。值按 Conversation 类型序列化，
     * 复用应用的 ObjectMapper（Instant 输出为 ISO 字符串）。
     */
    @Bean
    public RedisTemplate<String, Conversation> conversationRedisTemplate(RedisConnectionFactory connectionFactory,
                                                                        ObjectMapper objectMapper) {
        RedisTemplate<String, Conversation> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        // Key 使用明文字符串，方便在 redis-cli 中排查
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(conversationSerializer(objectMapper));
        return template;
    }

    static Jackson2JsonRedisSerializer<Conversation> conversationSerializer(ObjectMapper objectMapper) {
        return new Jackson2JsonRedisSerializer<>(objectMapper, Conversation.class);
    }
}
