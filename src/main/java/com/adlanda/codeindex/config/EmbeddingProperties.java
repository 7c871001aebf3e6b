package com.adlanda.codeindex.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for embedding generation.
 *
 * Maps to properties prefixed with 'codeindex.embedding' in application.properties.
 * The dimension is fixed for the lifetime of the process; an invalid value
 * fails application startup.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "codeindex.embedding")
public class EmbeddingProperties {

    /**
     * Length of every stored and queried vector (D).
     * Must match the chunks.embedding column and the model output.
     */
    @Min(1)
    private int dimension = 384;

    /**
     * Maximum number of texts sent to the model in one call.
     */
    @Min(1)
    private int batchSize = 32;

    /**
     * Upper bound for one embedding call before it is treated as a provider failure.
     */
    @NotNull
    private Duration timeout = Duration.ofSeconds(60);

    /**
     * ONNX model resource for the local transformers model. Empty uses the Spring AI default.
     */
    private String modelResource = "";

    /**
     * Tokenizer resource for the local transformers model. Empty uses the Spring AI default.
     */
    private String tokenizerResource = "";

    /**
     * Directory used to cache downloaded model resources. Empty uses the system temp dir.
     */
    private String cacheDirectory = "";

    public int getDimension() {
        return dimension;
    }

    public void setDimension(int dimension) {
        this.dimension = dimension;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public String getModelResource() {
        return modelResource;
    }

    public void setModelResource(String modelResource) {
        this.modelResource = modelResource;
    }

    public String getTokenizerResource() {
        return tokenizerResource;
    }

    public void setTokenizerResource(String tokenizerResource) {
        this.tokenizerResource = tokenizerResource;
    }

    public String getCacheDirectory() {
        return cacheDirectory;
    }

    public void setCacheDirectory(String cacheDirectory) {
        this.cacheDirectory = cacheDirectory;
    }
}
