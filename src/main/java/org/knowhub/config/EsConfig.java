package org.knowhub.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.elasticsearch.client.ClientConfiguration;
import org.springframework.data.elasticsearch.client.elc.ElasticsearchConfiguration;

// Elasticsearch客户端配置类
@Configuration
@ConditionalOnProperty(name = "rag.index.backend", havingValue = "elasticsearch", matchIfMissing = true)
public class EsConfig extends ElasticsearchConfiguration {

    @Value("${elasticsearch.host}")
    private String host;

    @Value("${elasticsearch.port}")
    private int port;

    @Value("${elasticsearch.username:}")
    private String username;

    @Value("${elasticsearch.password:}")
    private String password;

    @Override
    public ClientConfiguration clientConfiguration() {
        ClientConfiguration.MaybeSecureClientConfigurationBuilder builder = ClientConfiguration.builder()
                .connectedTo(host + ":" + port);
        // 本地开发环境通常关闭了安全认证
        if (username != null && !username.isBlank()) {
            return builder.withBasicAuth(username, password).build();
        }
        return builder.build();
    }
}
