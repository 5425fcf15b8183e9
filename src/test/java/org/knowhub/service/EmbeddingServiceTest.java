package org.knowhub.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.knowhub.DTO.EmbeddingBatchResult;
import org.knowhub.client.EmbeddingClient;
import org.knowhub.config.RagProperties;
import org.knowhub.exception.EmbeddingException;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EmbeddingServiceTest {

    private static final int DIMENSION = 4;

    private EmbeddingClient embeddingClient;
    private EmbeddingService embeddingService;

    @BeforeEach
    void setUp() {
        embeddingClient = mock(EmbeddingClient.class);
        embeddingService = new EmbeddingService(embeddingClient, new RagProperties(), 2, DIMENSION, 100);
    }

    @Test
    void failedSubBatchOnlyAffectsItsOwnItems() {
        when(embeddingClient.embed(anyList())).thenAnswer(invocation -> {
            List<String> inputs = invocation.getArgument(0);
            if (inputs.contains("broken")) {
                throw new EmbeddingException("upstream 503");
            }
            List<float[]> vectors = new ArrayList<>();
            for (int i = 0; i < inputs.size(); i++) {
                vectors.add(new float[]{3f, 4f, 0f, 0f});
            }
            return vectors;
        });

        EmbeddingBatchResult result = embeddingService.embedBatch(List.of("one", "two", "broken", "four"));

        assertThat(result.isComplete()).isFalse();
        assertThat(result.failedIndices()).containsExactly(2, 3);
        assertThat(result.successCount()).isEqualTo(2);
        // 返回的向量已归一化
        assertThat(result.vectorAt(0)).containsExactly(0.6f, 0.8f, 0f, 0f);
        assertThat(result.vectorAt(2)).isNull();
    }

    @Test
    void blankAndOversizedInputsFailWithoutCallingService() {
        EmbeddingBatchResult result = embeddingService.embedBatch(List.of(" ", "x".repeat(101)));

        assertThat(result.failedIndices()).containsExactly(0, 1);
        verify(embeddingClient, never()).embed(anyList());
    }

    @Test
    void wrongDimensionIsReportedPerItem() {
        when(embeddingClient.embed(anyList())).thenReturn(List.of(new float[]{1f, 0f, 0f, 0f}, new float[]{1f, 0f}));

        EmbeddingBatchResult result = embeddingService.embedBatch(List.of("good", "short"));

        assertThat(result.failedIndices()).containsExactly(1);
        assertThat(result.vectorAt(0)).hasSize(DIMENSION);
    }

    @Test
    void singleEmbedRejectsWrongDimension() {
        when(embeddingClient.embed(anyList())).thenReturn(List.of(new float[]{1f, 0f}));

        assertThatThrownBy(() -> embeddingService.embed("query"))
                .isInstanceOf(EmbeddingException.class);
    }

    @Test
    void singleEmbedRejectsEmptyText() {
        assertThatThrownBy(() -> embeddingService.embed(""))
                .isInstanceOf(EmbeddingException.class);
        verify(embeddingClient, never()).embed(anyList());
    }
}
