package com.adlanda.codeindex.model;

/**
 * Surrogate keys assigned by the vector store for one chunk write.
 */
public record StoredChunkIds(long repoId, long fileId, long chunkId) {}
