package org.knowhub.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 检索增强相关配置：切分、检索融合、会话、入库与后端调用策略。
 */
@Component
@ConfigurationProperties(prefix = "rag")
@Data
public class RagProperties {

    private Chunking chunking = new Chunking();
    private Retrieval retrieval = new Retrieval();
    private Conversation conversation = new Conversation();
    private Ingestion ingestion = new Ingestion();
    private Index index = new Index();
    private Backend backend = new Backend();

    @Data
    public static class Chunking {
        /** 单个分块的最大字符数 */
        private int maxChars = 1000;
        /** 滑动窗口兜底切分时的重叠字符数，必须小于 maxChars */
        private int overlap = 100;
    }

    @Data
    public static class Retrieval {
        private double lexicalWeight = 0.5;
        private double vectorWeight = 0.5;
        /** 为过滤失效版本而多召回的倍数 */
        private int candidateMultiplier = 3;
        /** 融合分数低于该值的候选丢弃 */
        private double minScore = 0.2;
        private int defaultTopK = 5;
        /** Prompt 中参考资料的字符预算 */
        private int maxContextChars = 6000;
    }

    @Data
    public static class Conversation {
        /** 超过该时长无活动则会话过期 */
        private Duration inactivityWindow = Duration.ofMinutes(30);
        private int maxHistoryTurns = 5;
        /** 会话在存储中的保留时长 */
        private Duration retention = Duration.ofDays(7);
        /** redis | memory */
        private String store = "redis";
    }

    @Data
    public static class Ingestion {
        /** 失败分块重新向量化的次数 */
        private int embeddingRetries = 2;
        /** 向量化子批次的并发度 */
        private int embeddingConcurrency = 4;
    }

    @Data
    public static class Index {
        /** elasticsearch | memory */
        private String backend = "elasticsearch";
        private String name = "knowledge_chunks";
    }

    @Data
    public static class Backend {
        private Duration timeout = Duration.ofSeconds(10);
        private int maxRetries = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
        private Duration maxBackoff = Duration.ofSeconds(5);
    }
}
