package com.adlanda.codeindex.config;

import com.adlanda.codeindex.repository.InMemoryVectorStore;
import com.adlanda.codeindex.repository.PgVectorStore;
import com.adlanda.codeindex.repository.VectorStore;
import com.adlanda.codeindex.service.EmbeddingModelProvider;
import org.springframework.ai.transformers.TransformersEmbeddingModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the embedding model, the vector store and the worker pools.
 *
 * The store is chosen with 'codeindex.store.type': 'postgres' (default) or 'memory'.
 */
@Configuration
public class AppConfig {

    @Bean
    @ConditionalOnMissingBean
    public EmbeddingModelProvider embeddingModelProvider(EmbeddingProperties properties) {
        return new EmbeddingModelProvider("transformers (local ONNX)", () -> {
            TransformersEmbeddingModel model = new TransformersEmbeddingModel();
            if (StringUtils.hasText(properties.getModelResource())) {
                model.setModelResource(properties.getModelResource());
            }
            if (StringUtils.hasText(properties.getTokenizerResource())) {
                model.setTokenizerResource(properties.getTokenizerResource());
            }
            if (StringUtils.hasText(properties.getCacheDirectory())) {
                model.setResourceCacheDirectory(properties.getCacheDirectory());
            }
            model.afterPropertiesSet();
            return model;
        });
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService embeddingExecutor() {
        int threads = Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
        return Executors.newFixedThreadPool(threads, namedThreads("embedding-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService indexingExecutor(IndexingProperties properties) {
        return Executors.newFixedThreadPool(properties.getStreamThreads(), namedThreads("indexing-"));
    }

    /**
     * Forwards streamed events to SSE clients, one thread per open stream.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService sseExecutor() {
        return Executors.newCachedThreadPool(namedThreads("sse-"));
    }

    @Bean
    @ConditionalOnProperty(name = "codeindex.store.type", havingValue = "postgres", matchIfMissing = true)
    public VectorStore pgVectorStore(JdbcTemplate jdbcTemplate,
                                     PlatformTransactionManager transactionManager,
                                     EmbeddingProperties properties) {
        return new PgVectorStore(jdbcTemplate, new TransactionTemplate(transactionManager), properties.getDimension());
    }

    @Bean
    @ConditionalOnProperty(name = "codeindex.store.type", havingValue = "memory")
    public VectorStore inMemoryVectorStore(EmbeddingProperties properties) {
        return new InMemoryVectorStore(properties.getDimension());
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
