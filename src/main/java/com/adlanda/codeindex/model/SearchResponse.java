package com.adlanda.codeindex.model;

import java.util.List;

/**
 * Response from the search endpoints.
 *
 * @param results      Matched chunks, ascending by distance
 * @param totalChunks  Total number of chunks in the index
 * @param queryTimeMs  Time taken to process the query in milliseconds
 */
public record SearchResponse(
        List<SearchResult> results,
        long totalChunks,
        long queryTimeMs
) {}
