package com.adlanda.codeindex.model;

/**
 * Counters of an indexing run.
 *
 * @param considered     Files taken from the candidate list so far
 * @param filesWritten   Files whose chunks were all written
 * @param chunksWritten  Chunks written across all files
 * @param errors         Files that failed
 */
public record RunSummary(
        int considered,
        int filesWritten,
        int chunksWritten,
        int errors
) {}
