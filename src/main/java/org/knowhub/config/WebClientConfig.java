package org.knowhub.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * 向量服务与对话模型服务的 WebClient，均为 OpenAI 兼容接口。
 */
@Configuration
public class WebClientConfig {

    // 大批量向量响应体较大，放宽默认的 256KB 限制
    private static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024;

    @Bean
    public WebClient embeddingWebClient(@Value("${embedding.api.url}") String apiUrl,
                                        @Value("${embedding.api.key:}") String apiKey) {
        return build(apiUrl, apiKey);
    }

    @Bean
    public WebClient chatWebClient(@Value("${deepseek.api.url}") String apiUrl,
                                   @Value("${deepseek.api.key:}") String apiKey) {
        return build(apiUrl, apiKey);
    }

    private WebClient build(String apiUrl, String apiKey) {
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(apiUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                        .build());
        // 只有当 API key 不为空时才添加 Authorization header
        if (apiKey != null && !apiKey.trim().isEmpty()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        return builder.build();
    }
}
