package org.knowhub.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.knowhub.DTO.IndexRecord;
import org.knowhub.DTO.SearchFilters;
import org.knowhub.DTO.SearchResult;
import org.knowhub.DTO.StructuralTag;
import org.knowhub.config.RagProperties;
import org.knowhub.exception.EmbeddingException;
import org.knowhub.exception.RetrievalException;
import org.knowhub.repository.KnowledgeDocumentRepository;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class HybridSearchServiceTest {

    private RagProperties ragProperties;
    private InMemorySearchBackend backend;
    private DocumentVersionRegistry registry;
    private EmbeddingService embeddingService;
    private IndexWriterService indexWriter;
    private HybridSearchService searchService;

    @BeforeEach
    void setUp() {
        ragProperties = new RagProperties();
        ragProperties.getBackend().setMaxRetries(1);
        ragProperties.getBackend().setInitialBackoff(Duration.ofMillis(1));
        ragProperties.getBackend().setMaxBackoff(Duration.ofMillis(2));
        backend = new InMemorySearchBackend();
        registry = new DocumentVersionRegistry(mock(KnowledgeDocumentRepository.class));
        embeddingService = mock(EmbeddingService.class);
        when(embeddingService.embed(anyString())).thenAnswer(inv -> HashingEmbeddings.vector(inv.getArgument(0)));
        indexWriter = new IndexWriterService(backend, registry, ragProperties, HashingEmbeddings.DIMENSION, "test-model");
        searchService = new HybridSearchService(backend, registry, embeddingService, ragProperties);

        indexWriter.upsert("ops", 1, IndexWriterServiceTest.chunks("ops",
                "Deploy via `terraform apply`",
                "Our office is in Berlin.",
                "Lunch is served at noon."));
    }

    @Test
    void exactDeployChunkRanksFirst() {
        List<SearchResult> results = searchService.search("How do I deploy?", 5);

        assertThat(results).isNotEmpty();
        assertThat(results.get(0).getChunkId()).isEqualTo("ops:0");
        assertThat(results.get(0).getLexicalScore()).isEqualTo(1.0);
        assertThat(results.get(0).getScore()).isGreaterThan(0.5);
    }

    @Test
    void unrelatedQueryReturnsEmpty() {
        assertThat(searchService.search("quantum chromodynamics lecture", 5)).isEmpty();
    }

    @Test
    void repeatedQueriesReturnSameOrder() {
        indexWriter.upsert("b-doc", 1, IndexWriterServiceTest.chunks("b-doc", "Deploy via terraform"));
        indexWriter.upsert("a-doc", 1, IndexWriterServiceTest.chunks("a-doc", "Deploy via terraform"));

        List<SearchResult> first = searchService.search("deploy terraform", 5);
        List<SearchResult> second = searchService.search("deploy terraform", 5);

        assertThat(second).extracting(SearchResult::getChunkId)
                .containsExactlyElementsOf(first.stream().map(SearchResult::getChunkId).collect(Collectors.toList()));
        // 同分按文档 id 排序
        assertThat(first).extracting(SearchResult::getChunkId).startsWith("a-doc:0", "b-doc:0");
    }

    @Test
    void fallsBackToLexicalWhenEmbeddingFails() {
        when(embeddingService.embed(anyString())).thenThrow(new EmbeddingException("down"));

        List<SearchResult> results = searchService.search("deploy", 5);

        assertThat(results).extracting(SearchResult::getChunkId).containsExactly("ops:0");
        assertThat(results.get(0).getVectorScore()).isZero();
    }

    @Test
    void recordsOfInactiveVersionsAreIgnored() {
        backend.upsert(List.of(record("wiki", 1, "Deploy with the old pipeline"),
                record("wiki", 2, "Deploy with the new pipeline")));
        registry.activate("wiki", 2);

        List<SearchResult> results = searchService.search("deploy pipeline", 5,
                SearchFilters.builder().documentIds(Set.of("wiki")).build());

        assertThat(results).hasSize(1);
        assertThat(results.get(0).getVersion()).isEqualTo(2L);
        assertThat(results.get(0).getTextContent()).contains("new pipeline");
    }

    @Test
    void tagFilterRestrictsResults() {
        List<SearchResult> results = searchService.search("deploy", 5,
                SearchFilters.builder().tags(Set.of(StructuralTag.CODE)).build());

        assertThat(results).isEmpty();
    }

    @Test
    void topKMustBePositive() {
        assertThatThrownBy(() -> searchService.search("deploy", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void blankQueryReturnsEmpty() {
        assertThat(searchService.search("   ", 3)).isEmpty();
    }

    @Test
    void backendFailureSurfacesAsRetrievalException() {
        SearchBackend broken = mock(SearchBackend.class);
        when(broken.lexicalSearch(anyList(), any(), anyInt())).thenThrow(new IllegalStateException("connection refused"));
        HybridSearchService service = new HybridSearchService(broken, registry, embeddingService, ragProperties);

        assertThatThrownBy(() -> service.search("deploy", 3))
                .isInstanceOf(RetrievalException.class);
    }

    @Test
    void reindexNeverLeavesQueriesWithoutResults() throws Exception {
        AtomicBoolean writing = new AtomicBoolean(true);
        ConcurrentLinkedQueue<Integer> observedSizes = new ConcurrentLinkedQueue<>();
        ExecutorService readers = Executors.newFixedThreadPool(2);
        CountDownLatch started = new CountDownLatch(2);
        for (int i = 0; i < 2; i++) {
            readers.submit(() -> {
                started.countDown();
                while (writing.get()) {
                    observedSizes.add(searchService.search("deploy terraform", 5).size());
                }
                return null;
            });
        }
        started.await(5, TimeUnit.SECONDS);

        for (long version = 2; version <= 20; version++) {
            indexWriter.upsert("ops", version, IndexWriterServiceTest.chunks("ops",
                    "Deploy via `terraform apply` revision " + version,
                    "Our office is in Berlin."));
        }
        writing.set(false);
        readers.shutdown();
        assertThat(readers.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(observedSizes).isNotEmpty();
        assertThat(observedSizes).doesNotContain(0);
        assertThat(registry.activeVersion("ops")).isEqualTo(20L);
    }

    @Test
    void pendingVersionDoesNotCrowdOutActiveOne() {
        indexWriter.upsert("guide", 1, IndexWriterServiceTest.chunks("guide", "Deploy the service with terraform."));
        // v2 写入了但尚未激活，且比 v1 更相关
        for (int seq = 0; seq < 4; seq++) {
            backend.upsert(List.of(record("guide", 2, seq, "Deploy terraform")));
        }

        List<SearchResult> results = searchService.search("deploy terraform", 1,
                SearchFilters.builder().documentIds(Set.of("guide")).build());

        assertThat(results).hasSize(1);
        assertThat(results.get(0).getDocumentId()).isEqualTo("guide");
        assertThat(results.get(0).getVersion()).isEqualTo(1L);
    }

    @Test
    void backendReceivesActiveVersionsWithCallerFilters() {
        SearchBackend spying = mock(SearchBackend.class);
        when(spying.lexicalSearch(anyList(), any(), anyInt())).thenReturn(List.of());
        when(spying.vectorSearch(any(), any(), anyInt())).thenReturn(List.of());
        HybridSearchService service = new HybridSearchService(spying, registry, embeddingService, ragProperties);

        service.search("deploy", 3, SearchFilters.builder().tags(Set.of(StructuralTag.CODE)).build());

        ArgumentCaptor<SearchFilters> captor = ArgumentCaptor.forClass(SearchFilters.class);
        verify(spying).lexicalSearch(anyList(), captor.capture(), anyInt());
        assertThat(captor.getValue().getActiveVersions()).containsEntry("ops", 1L);
        assertThat(captor.getValue().getTags()).containsExactly(StructuralTag.CODE);
    }

    @Test
    void nothingActiveSkipsBackend() {
        SearchBackend untouched = mock(SearchBackend.class);
        DocumentVersionRegistry empty = new DocumentVersionRegistry(mock(KnowledgeDocumentRepository.class));
        HybridSearchService service = new HybridSearchService(untouched, empty, embeddingService, ragProperties);

        assertThat(service.search("deploy", 3)).isEmpty();
        verifyNoInteractions(untouched);
    }

    private static IndexRecord record(String documentId, long version, String text) {
        return record(documentId, version, 0, text);
    }

    private static IndexRecord record(String documentId, long version, int seq, String text) {
        return IndexRecord.builder()
                .id(IndexRecord.recordId(documentId, version, seq))
                .documentId(documentId)
                .version(version)
                .versionKey(IndexRecord.versionKey(documentId, version))
                .chunkId(documentId + ":" + seq)
                .sequenceIndex(seq)
                .textContent(text)
                .vector(HashingEmbeddings.vector(text))
                .tag(StructuralTag.BODY.name())
                .startOffset(0)
                .endOffset(text.length())
                .build();
    }
}
