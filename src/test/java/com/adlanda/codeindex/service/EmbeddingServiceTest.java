package com.adlanda.codeindex.service;

import com.adlanda.codeindex.config.EmbeddingProperties;
import com.adlanda.codeindex.exception.EmbeddingDimensionMismatchException;
import com.adlanda.codeindex.exception.EmbeddingProviderException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.embedding.EmbeddingModel;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for EmbeddingService batching and validation.
 */
@ExtendWith(MockitoExtension.class)
class EmbeddingServiceTest {

    private static final int DIMENSION = 4;

    @Mock
    private EmbeddingModel embeddingModel;

    private EmbeddingProperties properties;
    private ExecutorService executor;
    private EmbeddingService embeddingService;

    @BeforeEach
    void setUp() {
        properties = new EmbeddingProperties();
        properties.setDimension(DIMENSION);
        properties.setBatchSize(2);
        properties.setTimeout(Duration.ofSeconds(5));
        executor = Executors.newSingleThreadExecutor();
        embeddingService = new EmbeddingService(EmbeddingModelProvider.of(embeddingModel), properties, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void embedAll_splitsIntoBatchesAndKeepsOrder() {
        when(embeddingModel.embed(List.of("a", "b"))).thenReturn(List.of(vector(1), vector(2)));
        when(embeddingModel.embed(List.of("c"))).thenReturn(List.of(vector(3)));

        List<float[]> vectors = embeddingService.embedAll(List.of("a", "b", "c"));

        assertThat(vectors).hasSize(3);
        assertThat(vectors.get(0)[0]).isEqualTo(1f);
        assertThat(vectors.get(1)[0]).isEqualTo(2f);
        assertThat(vectors.get(2)[0]).isEqualTo(3f);
        verify(embeddingModel, times(2)).embed(anyList());
    }

    @Test
    void embedAll_emptyInput_throws() {
        assertThatThrownBy(() -> embeddingService.embedAll(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void embedAll_wrongVectorCount_throwsProviderException() {
        when(embeddingModel.embed(anyList())).thenReturn(List.of(vector(1)));

        assertThatThrownBy(() -> embeddingService.embedAll(List.of("a", "b")))
                .isInstanceOf(EmbeddingProviderException.class)
                .hasMessageContaining("returned 1 vectors for 2 texts");
    }

    @Test
    void embedAll_wrongDimension_throwsMismatch() {
        when(embeddingModel.embed(anyList())).thenReturn(List.of(new float[DIMENSION + 1]));

        assertThatThrownBy(() -> embeddingService.embedAll(List.of("a")))
                .isInstanceOf(EmbeddingDimensionMismatchException.class)
                .hasMessageContaining("expected=" + DIMENSION);
    }

    @Test
    void embedAll_providerFailure_isWrapped() {
        when(embeddingModel.embed(anyList())).thenThrow(new IllegalStateException("model crashed"));

        assertThatThrownBy(() -> embeddingService.embedAll(List.of("a")))
                .isInstanceOf(EmbeddingProviderException.class)
                .isNotInstanceOf(EmbeddingDimensionMismatchException.class);
    }

    @Test
    void embedAll_slowProvider_timesOut() {
        properties.setTimeout(Duration.ofMillis(50));
        when(embeddingModel.embed(anyList())).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return List.of(vector(1));
        });

        assertThatThrownBy(() -> embeddingService.embedAll(List.of("a")))
                .isInstanceOf(EmbeddingProviderException.class)
                .hasMessageContaining("timed out");
    }

    @Test
    void embedAll_modelFailsToLoad_throwsProviderException() {
        EmbeddingModelProvider failing = new EmbeddingModelProvider("broken", () -> {
            throw new IllegalStateException("no model file");
        });
        EmbeddingService service = new EmbeddingService(failing, properties, executor);

        assertThatThrownBy(() -> service.embedAll(List.of("a")))
                .isInstanceOf(EmbeddingProviderException.class)
                .hasMessageContaining("broken");
    }

    private static float[] vector(float first) {
        float[] vector = new float[DIMENSION];
        vector[0] = first;
        return vector;
    }
}
