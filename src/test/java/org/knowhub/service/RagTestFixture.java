package org.knowhub.service;

import org.knowhub.DTO.StoredDocument;
import org.knowhub.client.ChatCompletionClient;
import org.knowhub.client.EmbeddingClient;
import org.knowhub.config.AiProperties;
import org.knowhub.config.RagProperties;
import org.knowhub.entity.DocumentStatus;
import org.knowhub.entity.KnowledgeDocument;
import org.knowhub.entity.SourceType;
import org.knowhub.repository.DocumentStore;
import org.knowhub.repository.InMemoryConversationStore;
import org.knowhub.repository.KnowledgeDocumentRepository;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * 用内存后端、内存会话存储和哈希向量把整条问答链路装起来，外部模型用 mock 代替。
 */
final class RagTestFixture {

    final RagProperties ragProperties = new RagProperties();
    final AiProperties aiProperties = new AiProperties();
    final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T09:00:00Z"));
    final Map<String, KnowledgeDocument> documents = new ConcurrentHashMap<>();
    final Map<String, byte[]> objects = new ConcurrentHashMap<>();

    final EmbeddingClient embeddingClient = mock(EmbeddingClient.class);
    final ChatCompletionClient chatClient = mock(ChatCompletionClient.class);
    final KnowledgeDocumentRepository documentRepository = mock(KnowledgeDocumentRepository.class);
    final InMemorySearchBackend backend = new InMemorySearchBackend();
    final InMemoryConversationStore conversationStore = new InMemoryConversationStore();

    final DocumentVersionRegistry registry;
    final EmbeddingService embeddingService;
    final IndexWriterService indexWriter;
    final IngestionService ingestionService;
    final HybridSearchService searchService;
    final ConversationService conversationService;
    final AnswerSynthesisService synthesisService;
    final RagService ragService;

    RagTestFixture() {
        ragProperties.getBackend().setMaxRetries(1);
        ragProperties.getBackend().setInitialBackoff(Duration.ofMillis(1));
        ragProperties.getBackend().setMaxBackoff(Duration.ofMillis(2));

        when(documentRepository.findById(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(documents.get(inv.<String>getArgument(0))));
        when(documentRepository.save(any(KnowledgeDocument.class))).thenAnswer(inv -> {
            KnowledgeDocument document = inv.getArgument(0);
            documents.put(document.getId(), document);
            return document;
        });
        when(embeddingClient.embed(anyList())).thenAnswer(inv -> {
            List<String> inputs = inv.getArgument(0);
            List<float[]> vectors = new ArrayList<>();
            for (String input : inputs) {
                vectors.add(HashingEmbeddings.vector(input));
            }
            return vectors;
        });

        registry = new DocumentVersionRegistry(documentRepository);
        embeddingService = new EmbeddingService(embeddingClient, ragProperties, 10, HashingEmbeddings.DIMENSION, 8000);
        indexWriter = new IndexWriterService(backend, registry, ragProperties, HashingEmbeddings.DIMENSION, "test-model");
        ingestionService = new IngestionService(documentRepository, new MapDocumentStore(), new ParseService(),
                new ChunkingService(ragProperties), embeddingService, indexWriter, ragProperties);
        searchService = new HybridSearchService(backend, registry, embeddingService, ragProperties);
        conversationService = new ConversationService(conversationStore, ragProperties, clock);
        synthesisService = new AnswerSynthesisService(chatClient, new PromptBuilder(aiProperties), aiProperties, ragProperties);
        ragService = new RagService(conversationService, searchService, synthesisService, ragProperties, clock);
    }

    /**
     * 登记一份 markdown 文档并同步入库
     */
    KnowledgeDocument ingestMarkdown(String documentId, String content) {
        KnowledgeDocument document = documents.get(documentId);
        if (document == null) {
            document = new KnowledgeDocument();
            document.setId(documentId);
        }
        long version = document.getLatestVersion() + 1;
        String key = documentId + "/v" + version + "/" + documentId + ".md";
        objects.put(key, content.getBytes(StandardCharsets.UTF_8));
        document.setFileName(documentId + ".md");
        document.setSourceType(SourceType.MARKDOWN);
        document.setContentMd5("md5-" + version);
        document.setStorageKey(key);
        document.setLatestVersion(version);
        document.setStatus(DocumentStatus.PENDING);
        documents.put(documentId, document);
        ingestionService.ingest(documentId, version);
        return documents.get(documentId);
    }

    private final class MapDocumentStore implements DocumentStore {

        @Override
        public void store(String key, byte[] content, String contentType) {
            objects.put(key, content);
        }

        @Override
        public StoredDocument fetch(String key) {
            return new StoredDocument(objects.get(key), "text/markdown");
        }

        @Override
        public void remove(String key) {
            objects.remove(key);
        }
    }
}
