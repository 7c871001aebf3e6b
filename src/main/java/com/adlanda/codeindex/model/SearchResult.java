package com.adlanda.codeindex.model;

/**
 * A single nearest-neighbor hit.
 *
 * @param path       Path of the file the chunk belongs to
 * @param startLine  First line of the chunk (1-based)
 * @param endLine    Last line of the chunk (1-based, inclusive)
 * @param distance   Euclidean (L2) distance to the query vector, lower is closer
 * @param chunkId    Store-assigned chunk identifier
 */
public record SearchResult(
        String path,
        int startLine,
        int endLine,
        double distance,
        long chunkId
) {}
