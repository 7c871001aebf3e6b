package com.adlanda.codeindex.service;

import com.adlanda.codeindex.config.EmbeddingProperties;
import com.adlanda.codeindex.exception.EmbeddingDimensionMismatchException;
import com.adlanda.codeindex.exception.EmbeddingProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Service responsible for generating vector embeddings from text.
 *
 * Batches texts for the model, checks that every vector has the configured
 * dimension and turns any provider failure into an
 * {@link EmbeddingProviderException}. A call either returns one vector per
 * input text or throws; partial results are never returned.
 */
@Service
public class EmbeddingService {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);

    private final EmbeddingModelProvider modelProvider;
    private final EmbeddingProperties properties;
    private final ExecutorService embeddingExecutor;

    public EmbeddingService(EmbeddingModelProvider modelProvider,
                            EmbeddingProperties properties,
                            @Qualifier("embeddingExecutor") ExecutorService embeddingExecutor) {
        this.modelProvider = modelProvider;
        this.properties = properties;
        this.embeddingExecutor = embeddingExecutor;
    }

    /**
     * Generates one embedding per text, in input order.
     *
     * @param texts Non-empty list of texts to embed
     * @return Vectors of length {@link #dimension()}, same size and order as {@code texts}
     * @throws EmbeddingDimensionMismatchException if a vector has the wrong length
     * @throws EmbeddingProviderException if the model fails to load, errors, times out
     *                                    or returns the wrong number of vectors
     */
    public List<float[]> embedAll(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            throw new IllegalArgumentException("texts must not be empty");
        }

        log.debug("Generating embeddings for {} texts...", texts.size());
        EmbeddingModel model = modelProvider.get();

        int batchSize = properties.getBatchSize();
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += batchSize) {
            List<String> batch = List.copyOf(texts.subList(from, Math.min(from + batchSize, texts.size())));
            List<float[]> batchVectors = callModel(model, batch);
            if (batchVectors == null || batchVectors.size() != batch.size()) {
                throw new EmbeddingProviderException(String.format(
                        "embedding provider returned %d vectors for %d texts",
                        batchVectors == null ? 0 : batchVectors.size(), batch.size()));
            }
            for (float[] vector : batchVectors) {
                validateDimension(vector);
            }
            vectors.addAll(batchVectors);
        }

        log.debug("Generated {} embeddings", vectors.size());
        return List.copyOf(vectors);
    }

    /**
     * The configured embedding dimension (D).
     */
    public int dimension() {
        return properties.getDimension();
    }

    private List<float[]> callModel(EmbeddingModel model, List<String> batch) {
        Future<List<float[]>> future = embeddingExecutor.submit(() -> model.embed(batch));
        long timeoutMs = properties.getTimeout().toMillis();
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new EmbeddingProviderException("embedding call timed out after " + timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new EmbeddingProviderException("interrupted while waiting for embeddings", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new EmbeddingProviderException("embedding provider failed: " + cause.getMessage(), cause);
        }
    }

    private void validateDimension(float[] vector) {
        int expected = properties.getDimension();
        int actual = vector == null ? 0 : vector.length;
        if (actual != expected) {
            throw new EmbeddingDimensionMismatchException(expected, actual);
        }
    }
}
