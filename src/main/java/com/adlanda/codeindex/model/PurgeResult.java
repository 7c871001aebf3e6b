package com.adlanda.codeindex.model;

/**
 * Outcome of dropping a repository's chunks.
 */
public record PurgeResult(String owner, String name, int deletedChunks) {}
