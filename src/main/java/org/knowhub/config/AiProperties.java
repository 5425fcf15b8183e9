package org.knowhub.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 全局 AI 相关配置，包含 Prompt 模板和生成参数。
 */
@Component
@ConfigurationProperties(prefix = "ai")
@Data
public class AiProperties {

    private Prompt prompt = new Prompt();
    private Generation generation = new Generation();

    @Data
    public static class Prompt {
        /** 规则文案 */
        private String rules = "You are a knowledge-base assistant. Answer only from the numbered references below. "
                + "Cite every fact with its reference label, for example [1]. "
                + "If the references do not contain the answer, say so explicitly.";
        /** 引用开始分隔符 */
        private String refStart = "<<REF>>";
        /** 引用结束分隔符 */
        private String refEnd = "<<END>>";
        /** 检索为空时直接返回给用户的回答，不调用模型 */
        private String noGroundingText = "I could not find anything in the knowledge base that answers this question.";
    }

    @Data
    public static class Generation {
        /** 采样温度 */
        private Double temperature = 0.3;
        /** 最大输出 tokens */
        private Integer maxTokens = 2000;
        /** nucleus top-p */
        private Double topP = 0.9;
        /** 单次生成（或流式相邻两段输出之间）的超时 */
        private Duration timeout = Duration.ofSeconds(60);
    }
}
