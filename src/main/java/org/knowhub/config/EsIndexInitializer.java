package org.knowhub.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.ExistsRequest;
import co.elastic.clients.transport.endpoints.BooleanResponse;
import org.apache.http.ConnectionClosedException;
import org.knowhub.utils.LogUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.InputStream;

/**
 * 启动时确保分块索引存在，映射定义见 es-mappings/knowledge_chunks.json。
 */
@Component
@ConditionalOnProperty(name = "rag.index.backend", havingValue = "elasticsearch", matchIfMissing = true)
public class EsIndexInitializer implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(EsIndexInitializer.class);

    private final ElasticsearchClient esClient;
    private final RagProperties ragProperties;

    @Value("classpath:es-mappings/knowledge_chunks.json")
    private Resource mappingResource;

    public EsIndexInitializer(ElasticsearchClient esClient, RagProperties ragProperties) {
        this.esClient = esClient;
        this.ragProperties = ragProperties;
    }

    @Override
    public void run(String... args) throws Exception {
        try {
            initializeIndex();
        } catch (Exception exception) {
            // 容器刚启动时 ES 可能还没就绪，连接被关闭时等待后再试一次
            if (exception instanceof ConnectionClosedException || exception.getCause() instanceof ConnectionClosedException) {
                logger.error("Elasticsearch连接已关闭，等待5秒后重试...");
                Thread.sleep(5000);
                try {
                    initializeIndex();
                } catch (Exception retryException) {
                    throw new IllegalStateException("初始化索引失败，重试也未能成功", retryException);
                }
            } else {
                throw new IllegalStateException("初始化索引失败", exception);
            }
        }
    }

    private void initializeIndex() throws Exception {
        String indexName = ragProperties.getIndex().getName();
        BooleanResponse existsResponse = esClient.indices().exists(ExistsRequest.of(e -> e.index(indexName)));
        if (existsResponse.value()) {
            logger.info("索引 '{}' 已存在", indexName);
            return;
        }
        // 通过输入流读取，打成 jar 后 getFile() 不可用
        try (InputStream mapping = mappingResource.getInputStream()) {
            esClient.indices().create(CreateIndexRequest.of(c -> c.index(indexName).withJson(mapping)));
        }
        LogUtils.logSystemStart("EsIndexInitializer", "CREATED", "索引 " + indexName + " 已创建");
    }
}
