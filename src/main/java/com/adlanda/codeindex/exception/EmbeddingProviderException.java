package com.adlanda.codeindex.exception;

/**
 * Signals that the embedding provider failed to load, failed mid-batch or
 * returned an unusable response.
 *
 * <p>No partial vectors accompany this exception. The indexing run treats it
 * as a failure of the current file only.</p>
 */
public class EmbeddingProviderException extends RuntimeException {

    public EmbeddingProviderException(String message) {
        super(message);
    }

    public EmbeddingProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
