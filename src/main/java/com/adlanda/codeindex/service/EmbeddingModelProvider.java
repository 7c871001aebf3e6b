package com.adlanda.codeindex.service;

import com.adlanda.codeindex.exception.EmbeddingProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Process-wide handle on the embedding model.
 *
 * Loading a model is expensive, so it happens once, on first use, and the
 * instance is shared by every caller afterwards. A failed load is reported to
 * the caller that triggered it and retried by the next one; it never takes
 * the application down.
 */
public class EmbeddingModelProvider {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingModelProvider.class);

    private final String description;
    private final Callable<EmbeddingModel> factory;

    private volatile EmbeddingModel model;

    /**
     * @param description  Human-readable model name for logs
     * @param factory      Creates and initializes the model; may throw
     */
    public EmbeddingModelProvider(String description, Callable<EmbeddingModel> factory) {
        this.description = description;
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    /**
     * Wraps an already initialized model.
     */
    public static EmbeddingModelProvider of(EmbeddingModel model) {
        Objects.requireNonNull(model, "model");
        EmbeddingModelProvider provider = new EmbeddingModelProvider(model.getClass().getSimpleName(), () -> model);
        provider.model = model;
        return provider;
    }

    /**
     * Returns the model, loading it on first call.
     *
     * @throws EmbeddingProviderException if the model cannot be loaded
     */
    public EmbeddingModel get() {
        EmbeddingModel current = model;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (model == null) {
                model = load();
            }
            return model;
        }
    }

    public boolean isLoaded() {
        return model != null;
    }

    public String getDescription() {
        return description;
    }

    private EmbeddingModel load() {
        log.info("Loading embedding model {} ...", description);
        long start = System.currentTimeMillis();
        try {
            EmbeddingModel loaded = factory.call();
            if (loaded == null) {
                throw new EmbeddingProviderException("Embedding model factory returned null for " + description);
            }
            log.info("Embedding model {} loaded in {}ms", description, System.currentTimeMillis() - start);
            return loaded;
        } catch (EmbeddingProviderException e) {
            throw e;
        } catch (Exception | LinkageError e) {
            // LinkageError covers a missing or broken native runtime
            log.error("Failed to load embedding model {}: {}", description, e.getMessage(), e);
            throw new EmbeddingProviderException("Failed to load embedding model " + description, e);
        }
    }
}
