package com.adlanda.codeindex.service;

import com.adlanda.codeindex.exception.DimensionException;
import com.adlanda.codeindex.model.SearchResponse;
import com.adlanda.codeindex.model.SearchResult;
import com.adlanda.codeindex.repository.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Service responsible for nearest-neighbor lookups over stored chunks.
 *
 * Orchestrates the query flow:
 * 1. Validate the query vector and k
 * 2. Ask the vector store for the k closest chunks
 * 3. Return them with index size and timing
 */
@Service
public class RetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

    private final VectorStore vectorStore;

    public RetrievalService(VectorStore vectorStore) {
        this.vectorStore = vectorStore;
    }

    /**
     * Finds the k chunks closest to the query vector.
     *
     * @param queryVector Vector of the configured dimension
     * @param k           Number of results, at least 1
     * @return SearchResponse with results ordered by ascending distance
     * @throws DimensionException if the vector has the wrong length
     */
    public SearchResponse search(float[] queryVector, int k) {
        Objects.requireNonNull(queryVector, "queryVector");
        if (queryVector.length != vectorStore.dimension()) {
            throw new DimensionException(vectorStore.dimension(), queryVector.length);
        }
        requirePositive(k);

        long startTime = System.currentTimeMillis();
        List<SearchResult> results = vectorStore.knn(queryVector, k);
        long queryTimeMs = System.currentTimeMillis() - startTime;

        log.debug("Search k={} returned {} results in {}ms", k, results.size(), queryTimeMs);
        return new SearchResponse(results, vectorStore.countChunks(), queryTimeMs);
    }

    /**
     * Searches with the most recently stored embedding as the query.
     * Useful to check an index end to end without an embedding client.
     */
    public SearchResponse searchFromLatest(int k) {
        requirePositive(k);

        long startTime = System.currentTimeMillis();
        List<SearchResult> results = vectorStore.knnFromLatest(k);
        long queryTimeMs = System.currentTimeMillis() - startTime;

        log.debug("Search from latest k={} returned {} results in {}ms", k, results.size(), queryTimeMs);
        return new SearchResponse(results, vectorStore.countChunks(), queryTimeMs);
    }

    /**
     * Returns the number of chunks in the index.
     */
    public long getIndexSize() {
        return vectorStore.countChunks();
    }

    private static void requirePositive(int k) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be >= 1, got " + k);
        }
    }
}
